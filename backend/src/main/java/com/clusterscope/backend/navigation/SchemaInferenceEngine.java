package com.clusterscope.backend.navigation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Derives the column list and the clickable column of a row batch.
 *
 * <p>The first row's key order is the schema of the whole batch; later rows are not reconciled.
 * When drill-down is allowed, the first column whose name contains {@code "id"} (case-insensitive)
 * is navigable, otherwise the first column is. At most one column is ever navigable.
 */
public final class SchemaInferenceEngine {

    private SchemaInferenceEngine() {
    }

    public static SchemaInference infer(List<? extends Map<String, ?>> rows, boolean canDrillDown) {
        return infer(rows, canDrillDown, true);
    }

    public static SchemaInference infer(List<? extends Map<String, ?>> rows,
                                        boolean canDrillDown,
                                        boolean navigationDepthAllowsDrill) {
        if (rows == null || rows.isEmpty() || rows.get(0) == null) {
            return SchemaInference.EMPTY;
        }
        List<String> columns = new ArrayList<>(rows.get(0).keySet());
        String navigable = navigableColumn(columns, canDrillDown && navigationDepthAllowsDrill);

        List<ColumnSpec> specs = new ArrayList<>(columns.size());
        for (String key : columns) {
            specs.add(new ColumnSpec(key, key.equals(navigable)));
        }
        return new SchemaInference(List.copyOf(specs), navigable);
    }

    public static String navigableColumn(List<String> columns, boolean canDrillDown) {
        if (!canDrillDown || columns == null || columns.isEmpty()) {
            return null;
        }
        for (String column : columns) {
            if (column != null && column.toLowerCase(Locale.ROOT).contains("id")) {
                return column;
            }
        }
        return columns.get(0);
    }
}
