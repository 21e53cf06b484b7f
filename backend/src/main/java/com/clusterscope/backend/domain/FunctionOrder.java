package com.clusterscope.backend.domain;

/**
 * New position of one function. {@code id} is set for user-defined functions, {@code name} for built-ins.
 */
public record FunctionOrder(
        Long id,
        String name,
        int categoryOrder,
        int displayOrder
) {

    public static FunctionOrder of(FunctionRef ref, int categoryOrder, int displayOrder) {
        return new FunctionOrder(ref.id(), ref.name(), categoryOrder, displayOrder);
    }

    public FunctionRef ref() {
        if (name != null && !name.isBlank()) {
            return FunctionRef.builtin(name);
        }
        if (id != null) {
            return FunctionRef.user(id);
        }
        throw new IllegalArgumentException("order entry needs an id or a name");
    }
}
