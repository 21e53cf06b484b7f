package com.clusterscope.backend.navigation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One level of the browsing stack: a system function plus the "/"-joined drill values below it.
 * {@code nestedPath} is null at the root.
 */
public record NavigationFrame(String functionName, String nestedPath) {

    public NavigationFrame {
        Objects.requireNonNull(functionName, "functionName");
    }

    public static NavigationFrame root(String functionName) {
        return new NavigationFrame(functionName, null);
    }

    public NavigationFrame child(String segment) {
        String next = (nestedPath == null || nestedPath.isEmpty()) ? segment : nestedPath + "/" + segment;
        return new NavigationFrame(functionName, next);
    }

    public boolean isRoot() {
        return nestedPath == null || nestedPath.isEmpty();
    }

    // ["transactions", "5001", "running"]
    public List<String> breadcrumb() {
        List<String> crumbs = new ArrayList<>();
        crumbs.add(functionName);
        if (!isRoot()) {
            crumbs.addAll(Arrays.asList(nestedPath.split("/")));
        }
        return crumbs;
    }

    public String procPath() {
        return isRoot() ? "/" + functionName : "/" + functionName + "/" + nestedPath;
    }
}
