package com.clusterscope.backend.api;

import com.clusterscope.backend.api.dto.FunctionUpsertRequest;
import com.clusterscope.backend.api.dto.MoveRequest;
import com.clusterscope.backend.api.dto.OrderUpdateRequest;
import com.clusterscope.backend.domain.FunctionDescriptor;
import com.clusterscope.backend.domain.FunctionRef;
import com.clusterscope.backend.domain.QueryResultView;
import com.clusterscope.backend.service.FunctionCatalog;
import com.clusterscope.backend.service.FunctionExecutionService;
import com.clusterscope.backend.service.SystemFunctionService;
import com.clusterscope.backend.service.SystemFunctionService.FunctionUpsert;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/system-functions")
public class SystemFunctionController {

    private final SystemFunctionService functions;
    private final FunctionExecutionService execution;

    public SystemFunctionController(SystemFunctionService functions, FunctionExecutionService execution) {
        this.functions = functions;
        this.execution = execution;
    }

    @GetMapping
    public Map<String, Object> list() {
        return Map.of("items", functions.list());
    }

    @GetMapping("/catalog")
    public Map<String, Object> catalog() {
        return Map.of("categories", functions.catalog().categories());
    }

    @PostMapping
    public ResponseEntity<FunctionDescriptor> create(@Valid @RequestBody FunctionUpsertRequest req) {
        FunctionDescriptor created = functions.create(toUpsert(req), null);
        return ResponseEntity.status(201).body(created);
    }

    @PutMapping("/{id}")
    public FunctionDescriptor update(@PathVariable long id, @Valid @RequestBody FunctionUpsertRequest req) {
        return functions.update(id, toUpsert(req));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable long id) {
        functions.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/execute")
    public QueryResultView execute(@PathVariable long id) {
        return execution.execute(id);
    }

    @PutMapping("/{id}/favorite")
    public FunctionDescriptor toggleFavorite(@PathVariable long id) {
        return functions.toggleFavorite(FunctionRef.user(id));
    }

    @PutMapping("/builtin/{name}/favorite")
    public FunctionDescriptor toggleBuiltinFavorite(@PathVariable String name) {
        return functions.toggleFavorite(FunctionRef.builtin(name));
    }

    @PutMapping("/orders")
    public ResponseEntity<Void> updateOrders(@Valid @RequestBody OrderUpdateRequest req) {
        functions.updateOrders(req.functions);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/categories/move")
    public Map<String, Object> moveCategory(@Valid @RequestBody MoveRequest req) {
        FunctionCatalog catalog = functions.moveCategory(req.fromIndex, req.toIndex);
        return Map.of("categories", catalog.categories());
    }

    @PostMapping("/categories/{name}/move")
    public Map<String, Object> moveFunction(@PathVariable String name, @Valid @RequestBody MoveRequest req) {
        FunctionCatalog catalog = functions.moveFunction(name, req.fromIndex, req.toIndex);
        return Map.of("categories", catalog.categories());
    }

    @DeleteMapping("/categories/{name}")
    public ResponseEntity<Void> deleteCategory(@PathVariable String name) {
        functions.deleteCategory(name);
        return ResponseEntity.noContent().build();
    }

    private static FunctionUpsert toUpsert(FunctionUpsertRequest req) {
        return new FunctionUpsert(req.categoryName, req.functionName, req.description, req.sqlQuery);
    }
}
