package com.clusterscope.backend.navigation;

import java.util.List;
import java.util.Map;

/**
 * Rows currently displayed for a frame, with the schema inferred from them.
 * {@code error} is set when the last fetch for the frame failed.
 */
public record LevelData(
        NavigationFrame frame,
        List<Map<String, Object>> rows,
        SchemaInference schema,
        String error
) {

    public static LevelData failed(NavigationFrame frame, String error) {
        return new LevelData(frame, List.of(), SchemaInference.EMPTY, error);
    }

    public LevelData withError(String message) {
        return new LevelData(frame, rows, schema, message);
    }

    public boolean hasError() {
        return error != null;
    }
}
