package com.clusterscope.backend.api;

import com.clusterscope.backend.domain.Cluster;
import com.clusterscope.backend.service.ClusterContext;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/clusters")
public class ClusterController {

    private final ClusterContext clusters;

    public ClusterController(ClusterContext clusters) {
        this.clusters = clusters;
    }

    @GetMapping
    public Map<String, Object> list() {
        List<Cluster> items = clusters.list();
        Long activeId = clusters.activeCluster().map(Cluster::id).orElse(null);
        return activeId == null
                ? Map.of("items", items)
                : Map.of("items", items, "activeId", activeId);
    }

    @GetMapping("/active")
    public Cluster active() {
        return clusters.requireActive();
    }

    // switching resets every navigation session through ActiveClusterChangedEvent
    @PutMapping("/{id}/active")
    public Cluster activate(@PathVariable long id) {
        return clusters.activate(id);
    }
}
