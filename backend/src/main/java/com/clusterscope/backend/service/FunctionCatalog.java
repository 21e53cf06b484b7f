package com.clusterscope.backend.service;

import com.clusterscope.backend.domain.FunctionCategory;
import com.clusterscope.backend.domain.FunctionDescriptor;
import com.clusterscope.backend.domain.FunctionOrder;
import com.clusterscope.backend.domain.FunctionRef;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Read-only view of every function available on a cluster, built-in and user-defined alike.
 *
 * <p>Functions are sorted favorites first, then by category order, then by display order, and
 * grouped by category in the order categories first appear in that sequence.
 */
public final class FunctionCatalog {

    public static final int COMPACT_LIMIT = 4;

    private static final Comparator<FunctionDescriptor> ORDER =
            Comparator.comparing((FunctionDescriptor f) -> !f.favorited())
                    .thenComparingInt(FunctionDescriptor::categoryOrder)
                    .thenComparingInt(FunctionDescriptor::displayOrder);

    private final List<FunctionDescriptor> functions;
    private final List<FunctionCategory> categories;

    private FunctionCatalog(List<FunctionDescriptor> functions, List<FunctionCategory> categories) {
        this.functions = functions;
        this.categories = categories;
    }

    public static FunctionCatalog load(Collection<FunctionDescriptor> systemDefined,
                                       Collection<FunctionDescriptor> userDefined) {
        List<FunctionDescriptor> all = new ArrayList<>(systemDefined);
        all.addAll(userDefined);
        all.sort(ORDER);

        Map<String, List<FunctionDescriptor>> byCategory = new LinkedHashMap<>();
        for (FunctionDescriptor f : all) {
            byCategory.computeIfAbsent(f.category(), k -> new ArrayList<>()).add(f);
        }

        List<FunctionCategory> categories = new ArrayList<>(byCategory.size());
        byCategory.forEach((name, list) -> categories.add(new FunctionCategory(
                name,
                list.get(0).categoryOrder(),
                List.copyOf(list.subList(0, Math.min(COMPACT_LIMIT, list.size()))),
                List.copyOf(list)
        )));
        return new FunctionCatalog(List.copyOf(all), List.copyOf(categories));
    }

    public List<FunctionDescriptor> functions() {
        return functions;
    }

    public List<FunctionCategory> categories() {
        return categories;
    }

    public Optional<FunctionDescriptor> find(FunctionRef ref) {
        return functions.stream().filter(f -> f.ref().equals(ref)).findFirst();
    }

    public Optional<FunctionCategory> category(String name) {
        return categories.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    // ---------------- reordering ----------------

    /**
     * Moves a whole category and returns the resulting position of every function.
     */
    public List<FunctionOrder> moveCategory(int fromIndex, int toIndex) {
        List<List<FunctionDescriptor>> groups = groups();
        checkIndex(fromIndex, groups.size(), "category");
        checkIndex(toIndex, groups.size(), "category");
        groups.add(toIndex, groups.remove(fromIndex));
        return orders(groups);
    }

    /**
     * Moves one function inside its category and returns the resulting position of every function.
     */
    public List<FunctionOrder> moveFunction(String categoryName, int fromIndex, int toIndex) {
        List<List<FunctionDescriptor>> groups = groups();
        int idx = -1;
        for (int i = 0; i < categories.size(); i++) {
            if (categories.get(i).name().equals(categoryName)) {
                idx = i;
                break;
            }
        }
        if (idx < 0) {
            throw new NoSuchElementException("Category not found: " + categoryName);
        }
        List<FunctionDescriptor> members = groups.get(idx);
        checkIndex(fromIndex, members.size(), "function");
        checkIndex(toIndex, members.size(), "function");
        members.add(toIndex, members.remove(fromIndex));
        return orders(groups);
    }

    private List<List<FunctionDescriptor>> groups() {
        List<List<FunctionDescriptor>> groups = new ArrayList<>(categories.size());
        for (FunctionCategory c : categories) {
            groups.add(new ArrayList<>(c.allFunctions()));
        }
        return groups;
    }

    private static List<FunctionOrder> orders(List<List<FunctionDescriptor>> groups) {
        List<FunctionOrder> out = new ArrayList<>();
        for (int c = 0; c < groups.size(); c++) {
            List<FunctionDescriptor> members = groups.get(c);
            for (int d = 0; d < members.size(); d++) {
                out.add(FunctionOrder.of(members.get(d).ref(), c, d));
            }
        }
        return out;
    }

    private static void checkIndex(int index, int size, String what) {
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException(what + " index out of range: " + index);
        }
    }
}
