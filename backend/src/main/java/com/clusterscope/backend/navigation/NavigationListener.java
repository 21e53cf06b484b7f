package com.clusterscope.backend.navigation;

/**
 * Receives the outcome of fetches that are still current when they resolve.
 * Stale responses are never reported.
 */
public interface NavigationListener {

    NavigationListener NOOP = new NavigationListener() {
    };

    default void onLevelLoaded(LevelData level) {
    }

    default void onFetchFailed(NavigationFrame frame, FetchFailureException failure) {
    }

    default void onReset() {
    }
}
