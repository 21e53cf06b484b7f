package com.clusterscope.backend.service.storage;

import java.time.Instant;

/**
 * Per-cluster overrides of a function's position and favorite flag.
 * Orders are null until the function is first reordered.
 */
public record FunctionPreference(
        Integer categoryOrder,
        Integer displayOrder,
        boolean favorited,
        Instant updatedAt
) {}
