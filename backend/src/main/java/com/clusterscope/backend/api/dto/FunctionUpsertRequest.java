package com.clusterscope.backend.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of create and update calls for user-defined functions.
 */
public class FunctionUpsertRequest {

    @NotBlank
    @Size(max = 100)
    @JsonAlias("category_name")
    public String categoryName;

    @NotBlank
    @Size(max = 100)
    @JsonAlias("function_name")
    public String functionName;

    @NotBlank
    @Size(max = 500)
    public String description;

    @NotBlank
    @JsonAlias("sql_query")
    public String sqlQuery;

    public FunctionUpsertRequest() {
    }

    public FunctionUpsertRequest(String categoryName, String functionName, String description, String sqlQuery) {
        this.categoryName = categoryName;
        this.functionName = functionName;
        this.description = description;
        this.sqlQuery = sqlQuery;
    }
}
