package com.clusterscope.backend.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * A system function as shown in the catalog.
 * Built-in functions have no id and no SQL; user-defined ones carry both.
 */
public record FunctionDescriptor(
        Long id,
        String name,
        String description,
        String category,
        String sqlQuery,
        boolean favorited,
        boolean systemDefined,
        int categoryOrder,
        int displayOrder,
        Long clusterId,
        Long createdBy,
        Instant createdAt,
        Instant updatedAt
) {

    public static FunctionDescriptor builtin(String name, String description, String category,
                                             int categoryOrder, int displayOrder) {
        return new FunctionDescriptor(null, name, description, category, null,
                false, true, categoryOrder, displayOrder, null, null, null, null);
    }

    @JsonIgnore
    public FunctionRef ref() {
        return systemDefined ? FunctionRef.builtin(name) : FunctionRef.user(id);
    }

    public FunctionDescriptor withOrders(int nextCategoryOrder, int nextDisplayOrder) {
        return new FunctionDescriptor(id, name, description, category, sqlQuery, favorited, systemDefined,
                nextCategoryOrder, nextDisplayOrder, clusterId, createdBy, createdAt, updatedAt);
    }

    public FunctionDescriptor withFavorited(boolean nextFavorited) {
        return new FunctionDescriptor(id, name, description, category, sqlQuery, nextFavorited, systemDefined,
                categoryOrder, displayOrder, clusterId, createdBy, createdAt, updatedAt);
    }

    public FunctionDescriptor withUpdatedAt(Instant nextUpdatedAt) {
        return new FunctionDescriptor(id, name, description, category, sqlQuery, favorited, systemDefined,
                categoryOrder, displayOrder, clusterId, createdBy, createdAt, nextUpdatedAt);
    }
}
