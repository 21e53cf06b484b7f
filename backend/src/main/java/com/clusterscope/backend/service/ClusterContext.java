package com.clusterscope.backend.service;

import com.clusterscope.backend.config.ConsoleProperties;
import com.clusterscope.backend.domain.Cluster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clusters known to the console and the one operators are currently working on.
 */
@Component
public class ClusterContext {

    private static final Logger log = LoggerFactory.getLogger(ClusterContext.class);

    private final Map<Long, Cluster> clusters = new ConcurrentHashMap<>();
    private final AtomicReference<Cluster> active = new AtomicReference<>();
    private final ApplicationEventPublisher events;

    public ClusterContext(ConsoleProperties props, ApplicationEventPublisher events) {
        this.events = events;
        Cluster first = null;
        Cluster flagged = null;
        for (ConsoleProperties.ClusterEntry e : props.getClusters()) {
            Cluster c = new Cluster(
                    e.getId(),
                    e.getName() == null || e.getName().isBlank() ? "cluster-" + e.getId() : e.getName(),
                    e.getFeHost(),
                    e.getFeHttpPort(),
                    e.getFeQueryPort(),
                    e.getUsername(),
                    e.getPassword(),
                    e.isSsl()
            );
            if (clusters.putIfAbsent(c.id(), c) != null) {
                throw new IllegalStateException("duplicate cluster id " + c.id());
            }
            if (first == null) first = c;
            if (flagged == null && e.isActive()) flagged = c;
        }
        Cluster initial = flagged != null ? flagged : first;
        active.set(initial);
        if (initial != null) {
            log.info("{} cluster(s) configured, active: {} ({})", clusters.size(), initial.name(), initial.baseUrl());
        } else {
            log.warn("no clusters configured");
        }
    }

    public List<Cluster> list() {
        List<Cluster> out = new ArrayList<>(clusters.values());
        out.sort(Comparator.comparingLong(Cluster::id));
        return out;
    }

    public Optional<Cluster> find(long id) {
        return Optional.ofNullable(clusters.get(id));
    }

    public Optional<Cluster> activeCluster() {
        return Optional.ofNullable(active.get());
    }

    public Cluster requireActive() {
        Cluster c = active.get();
        if (c == null) throw new NoSuchElementException("No active cluster");
        return c;
    }

    /**
     * Switches the active cluster. Publishes {@link ActiveClusterChangedEvent} only when the identity changes.
     */
    public Cluster activate(long id) {
        Cluster next = clusters.get(id);
        if (next == null) throw new NoSuchElementException("Cluster not found: " + id);

        Cluster prev = active.getAndSet(next);
        if (prev == null || prev.id() != next.id()) {
            log.info("active cluster changed: {} -> {}", prev == null ? "-" : prev.name(), next.name());
            events.publishEvent(new ActiveClusterChangedEvent(prev, next));
        }
        return next;
    }
}
