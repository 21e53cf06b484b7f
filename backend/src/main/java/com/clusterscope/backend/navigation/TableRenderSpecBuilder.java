package com.clusterscope.backend.navigation;

import java.util.ArrayList;
import java.util.List;

public final class TableRenderSpecBuilder {

    private TableRenderSpecBuilder() {
    }

    public static TableRenderSpec build(List<String> columns, String navigableColumn, RowClickHandler onClick) {
        if (columns == null || columns.isEmpty()) {
            return new TableRenderSpec(List.of(), TableRenderSpec.NO_DATA);
        }
        List<ColumnDescriptor> out = new ArrayList<>(columns.size());
        for (String key : columns) {
            boolean clickable = navigableColumn != null && navigableColumn.equals(key);
            out.add(new ColumnDescriptor(key, key, clickable, clickable ? onClick : null));
        }
        return new TableRenderSpec(List.copyOf(out), TableRenderSpec.NO_DATA);
    }

    public static TableRenderSpec build(SchemaInference schema, RowClickHandler onClick) {
        return build(schema.columns(), schema.navigableColumn(), onClick);
    }
}
