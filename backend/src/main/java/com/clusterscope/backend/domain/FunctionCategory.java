package com.clusterscope.backend.domain;

import java.util.List;

/**
 * @param functions compact list (at most {@code FunctionCatalog.COMPACT_LIMIT} entries)
 * @param allFunctions every function of the category in display order
 */
public record FunctionCategory(
        String name,
        int order,
        List<FunctionDescriptor> functions,
        List<FunctionDescriptor> allFunctions
) {}
