package com.clusterscope.backend.navigation;

import java.util.List;

/**
 * Schema derived from one batch of rows. Never cached across frames.
 */
public record SchemaInference(List<ColumnSpec> columnSpecs, String navigableColumn) {

    public static final SchemaInference EMPTY = new SchemaInference(List.of(), null);

    public List<String> columns() {
        return columnSpecs.stream().map(ColumnSpec::key).toList();
    }

    public boolean hasNavigableColumn() {
        return navigableColumn != null;
    }
}
