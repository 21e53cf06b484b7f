package com.clusterscope.backend.navigation;

import java.util.Map;

@FunctionalInterface
public interface RowClickHandler {

    void onClick(Map<String, ?> row, String columnKey);
}
