package com.clusterscope.backend.domain;

import com.clusterscope.backend.navigation.ColumnDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Flat result of a user-defined function. Never navigable.
 */
public record QueryResultView(
        String functionName,
        List<ColumnDescriptor> columns,
        List<Map<String, Object>> rows,
        int totalCount
) {}
