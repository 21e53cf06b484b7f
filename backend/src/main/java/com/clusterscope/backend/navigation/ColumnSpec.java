package com.clusterscope.backend.navigation;

public record ColumnSpec(String key, boolean navigable) {}
