package com.clusterscope.backend.api;

import com.clusterscope.backend.api.dto.NavigationActionRequest;
import com.clusterscope.backend.domain.FunctionRef;
import com.clusterscope.backend.domain.FunctionRun;
import com.clusterscope.backend.domain.NavigationView;
import com.clusterscope.backend.repo.NavigationSession;
import com.clusterscope.backend.service.FunctionExecutionService;
import com.clusterscope.backend.service.NavigationSessionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/navigation/sessions")
public class NavigationSessionController {

    private final NavigationSessionService sessions;
    private final FunctionExecutionService execution;

    public NavigationSessionController(NavigationSessionService sessions, FunctionExecutionService execution) {
        this.sessions = sessions;
        this.execution = execution;
    }

    @PostMapping
    public ResponseEntity<NavigationView> create() {
        NavigationSession s = sessions.create();
        return ResponseEntity.status(201).body(sessions.view(s.id()));
    }

    @GetMapping
    public Map<String, Object> list() {
        List<NavigationView> items = sessions.list().stream()
                .map(s -> sessions.view(s.id()))
                .toList();
        return Map.of("items", items);
    }

    @GetMapping("/{sid}")
    public NavigationView get(@PathVariable String sid) {
        return sessions.view(sid);
    }

    @DeleteMapping("/{sid}")
    public ResponseEntity<Void> delete(@PathVariable String sid) {
        sessions.delete(sid);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sid}/select")
    public FunctionRun select(@PathVariable String sid, @RequestBody NavigationActionRequest req) {
        if (req == null || (req.functionName == null) == (req.functionId == null)) {
            throw new IllegalArgumentException("exactly one of functionName or functionId is required");
        }
        FunctionRef ref = req.functionId != null
                ? FunctionRef.user(req.functionId)
                : FunctionRef.builtin(req.functionName);
        return execution.open(sid, ref);
    }

    @PostMapping("/{sid}/drill")
    public NavigationView drill(@PathVariable String sid, @RequestBody NavigationActionRequest req) {
        if (req == null || req.row == null || req.column == null) {
            throw new IllegalArgumentException("row and column are required");
        }
        return sessions.drill(sid, req.row, req.column);
    }

    @PostMapping("/{sid}/back")
    public NavigationView back(@PathVariable String sid) {
        return sessions.back(sid);
    }

    @PostMapping("/{sid}/refresh")
    public NavigationView refresh(@PathVariable String sid) {
        return sessions.refresh(sid);
    }

    @PostMapping("/{sid}/reset")
    public NavigationView reset(@PathVariable String sid) {
        return sessions.reset(sid);
    }
}
