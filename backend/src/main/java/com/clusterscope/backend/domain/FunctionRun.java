package com.clusterscope.backend.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of opening a function from the catalog. Built-ins start a navigation;
 * user-defined functions produce a flat result and leave navigation idle.
 */
public record FunctionRun(
        FunctionDescriptor function,
        NavigationView navigation,
        QueryResultView result
) {
    @JsonProperty("mode")
    public String mode() {
        return function.systemDefined() ? "navigation" : "query";
    }
}
