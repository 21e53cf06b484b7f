package com.clusterscope.backend.domain;

import java.util.Objects;

/**
 * Identity of a function: the name for built-ins, the numeric id for user-defined ones.
 */
public record FunctionRef(Long id, String name) {

    private static final String SYSTEM_PREFIX = "system:";
    private static final String USER_PREFIX = "user:";

    public FunctionRef {
        if ((id == null) == (name == null)) {
            throw new IllegalArgumentException("exactly one of id or name is required");
        }
    }

    public static FunctionRef builtin(String name) {
        return new FunctionRef(null, Objects.requireNonNull(name));
    }

    public static FunctionRef user(long id) {
        return new FunctionRef(id, null);
    }

    public boolean isBuiltin() {
        return name != null;
    }

    // preference key in the store
    public String key() {
        return isBuiltin() ? SYSTEM_PREFIX + name : USER_PREFIX + id;
    }

    public static FunctionRef parse(String key) {
        if (key.startsWith(SYSTEM_PREFIX)) {
            return builtin(key.substring(SYSTEM_PREFIX.length()));
        }
        if (key.startsWith(USER_PREFIX)) {
            return user(Long.parseLong(key.substring(USER_PREFIX.length())));
        }
        throw new IllegalArgumentException("invalid function key: " + key);
    }
}
