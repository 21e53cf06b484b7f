package com.clusterscope.backend.navigation;

/**
 * Transport or backend error while loading rows from the cluster.
 */
public class FetchFailureException extends RuntimeException {

    public FetchFailureException(String message) {
        super(message);
    }

    public FetchFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
