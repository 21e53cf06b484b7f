package com.clusterscope.backend.service.fetch;

import com.clusterscope.backend.domain.Cluster;
import com.clusterscope.backend.navigation.DataFetcher;
import com.clusterscope.backend.navigation.FetchFailureException;
import com.clusterscope.backend.navigation.NavigationFrame;
import com.clusterscope.backend.service.ClusterContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Loads navigation levels from the active cluster's {@code /api/show_proc} endpoint.
 */
@Component
public class ShowProcDataFetcher implements DataFetcher {

    private static final Logger log = LoggerFactory.getLogger(ShowProcDataFetcher.class);

    private final RestClient http;
    private final ClusterContext clusters;
    private final Executor executor;
    private final ObjectMapper om;

    public ShowProcDataFetcher(RestClient.Builder builder,
                               ClusterContext clusters,
                               @Qualifier("fetchExecutor") Executor executor,
                               ObjectMapper om) {
        this.http = builder.build();
        this.clusters = clusters;
        this.executor = executor;
        this.om = om;
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> fetch(String functionName, String nestedPath) {
        Optional<Cluster> active = clusters.activeCluster();
        if (active.isEmpty()) {
            return CompletableFuture.failedFuture(new FetchFailureException("No active cluster"));
        }
        Cluster cluster = active.get();
        String procPath = new NavigationFrame(functionName, nestedPath).procPath();
        return CompletableFuture.supplyAsync(() -> load(cluster, procPath), executor);
    }

    List<Map<String, Object>> load(Cluster cluster, String procPath) {
        URI uri = procUri(cluster, procPath);
        log.debug("GET {} on {}", procPath, cluster.name());

        String body;
        try {
            body = http.get()
                    .uri(uri)
                    .headers(h -> h.setBasicAuth(cluster.username(), cluster.password() == null ? "" : cluster.password()))
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw new FetchFailureException("HTTP status " + e.getStatusCode().value() + " for " + procPath, e);
        } catch (RestClientException e) {
            throw new FetchFailureException("Request to " + cluster.name() + " failed: " + e.getMessage(), e);
        }
        return parseRows(body, procPath);
    }

    // expanded as a variable so reserved characters in cell values are percent-encoded
    static URI procUri(Cluster cluster, String procPath) {
        return UriComponentsBuilder.fromHttpUrl(cluster.baseUrl())
                .path("/api/show_proc")
                .queryParam("path", "{path}")
                .encode()
                .buildAndExpand(procPath)
                .toUri();
    }

    List<Map<String, Object>> parseRows(String body, String procPath) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = om.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchFailureException("Failed to parse response for " + procPath + ": " + e.getOriginalMessage(), e);
        }
        if (!root.isArray()) {
            throw new FetchFailureException("Unexpected response for " + procPath + ": expected a JSON array");
        }

        List<Map<String, Object>> rows = new ArrayList<>(root.size());
        for (JsonNode item : root) {
            if (!item.isObject()) continue;
            Map<String, Object> row = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                row.put(field.getKey(), cellText(field.getValue()));
            }
            rows.add(row);
        }
        return rows;
    }

    private static String cellText(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) return "";
        if (v.isValueNode()) return v.asText();
        return v.toString();
    }
}
