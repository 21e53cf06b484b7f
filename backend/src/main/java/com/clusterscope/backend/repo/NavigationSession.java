package com.clusterscope.backend.repo;

import com.clusterscope.backend.navigation.DataFetcher;
import com.clusterscope.backend.navigation.FetchFailureException;
import com.clusterscope.backend.navigation.LevelData;
import com.clusterscope.backend.navigation.NavigationController;
import com.clusterscope.backend.navigation.NavigationFrame;
import com.clusterscope.backend.navigation.NavigationListener;
import com.clusterscope.backend.navigation.NestableFunctions;

import java.time.Instant;

/**
 * One operator's browsing session, bound to the cluster that was active when it was last reset.
 */
public class NavigationSession implements NavigationListener {

    private final String id;
    private final Instant createdAt;
    private final NavigationController controller;

    private volatile long clusterId;
    private volatile String lastError;
    private volatile Instant lastActivity;

    public NavigationSession(String id, long clusterId, DataFetcher fetcher, int maxDepth) {
        this.id = id;
        this.clusterId = clusterId;
        this.createdAt = Instant.now();
        this.lastActivity = createdAt;
        this.controller = new NavigationController(fetcher, this, NestableFunctions::canDrillDown, maxDepth);
    }

    public String id() { return id; }
    public long clusterId() { return clusterId; }
    public Instant createdAt() { return createdAt; }
    public Instant lastActivity() { return lastActivity; }
    public String lastError() { return lastError; }
    public NavigationController controller() { return controller; }

    public void markActive() {
        lastActivity = Instant.now();
    }

    /**
     * Drops all navigation state and rebinds the session to another cluster.
     */
    public void rebind(long nextClusterId) {
        controller.resetOnContextChange();
        clusterId = nextClusterId;
    }

    @Override
    public void onLevelLoaded(LevelData level) {
        lastError = null;
    }

    @Override
    public void onFetchFailed(NavigationFrame frame, FetchFailureException failure) {
        lastError = failure.getMessage();
    }

    @Override
    public void onReset() {
        lastError = null;
    }
}
