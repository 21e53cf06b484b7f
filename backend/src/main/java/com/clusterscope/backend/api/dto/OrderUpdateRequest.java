package com.clusterscope.backend.api.dto;

import com.clusterscope.backend.domain.FunctionOrder;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public class OrderUpdateRequest {
    @NotNull
    public List<FunctionOrder> functions;
}
