package com.clusterscope.backend.navigation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Rendering hint for one column. Only a clickable descriptor carries a click handler.
 */
public record ColumnDescriptor(
        String key,
        String title,
        boolean clickable,
        @JsonIgnore RowClickHandler handler
) {

    public static final String TYPE_LINK = "link";
    public static final String TYPE_STRING = "string";

    @JsonProperty("type")
    public String type() {
        return clickable ? TYPE_LINK : TYPE_STRING;
    }

    /**
     * Forwards a click on {@code row} to the handler; ignored for plain columns.
     */
    public void click(Map<String, ?> row) {
        if (clickable && handler != null) {
            handler.onClick(row, key);
        }
    }
}
