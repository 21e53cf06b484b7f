package com.clusterscope.backend.navigation;

import java.util.List;
import java.util.Optional;

public record TableRenderSpec(List<ColumnDescriptor> columns, String noDataMessage) {

    public static final String NO_DATA = "No data";

    public Optional<ColumnDescriptor> clickableColumn() {
        return columns.stream().filter(ColumnDescriptor::clickable).findFirst();
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }
}
