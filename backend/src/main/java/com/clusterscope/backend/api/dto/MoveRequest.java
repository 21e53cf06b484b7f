package com.clusterscope.backend.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Drag-and-drop move inside a list: item at {@code fromIndex} ends up at {@code toIndex}.
 */
public class MoveRequest {

    @NotNull
    @PositiveOrZero
    @JsonAlias("from_index")
    public Integer fromIndex;

    @NotNull
    @PositiveOrZero
    @JsonAlias("to_index")
    public Integer toIndex;

    public MoveRequest() {
    }

    public MoveRequest(Integer fromIndex, Integer toIndex) {
        this.fromIndex = fromIndex;
        this.toIndex = toIndex;
    }
}
