package com.clusterscope.backend.navigation;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Loads the rows of one navigation level. A failed future carries a {@link FetchFailureException}.
 */
@FunctionalInterface
public interface DataFetcher {

    CompletableFuture<List<Map<String, Object>>> fetch(String functionName, String nestedPath);
}
