package com.clusterscope.backend.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.Map;

/**
 * Body of select and drill calls. Select takes either {@code functionName} (built-in)
 * or {@code functionId} (user-defined); drill takes the clicked {@code row} and {@code column}.
 */
public class NavigationActionRequest {

    @JsonAlias("function_name")
    public String functionName;

    @JsonAlias("function_id")
    public Long functionId;

    public Map<String, Object> row;

    public String column;
}
