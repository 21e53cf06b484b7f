package com.clusterscope.backend.service;

import com.clusterscope.backend.domain.Cluster;
import com.clusterscope.backend.domain.FunctionDescriptor;
import com.clusterscope.backend.domain.FunctionOrder;
import com.clusterscope.backend.domain.FunctionRef;
import com.clusterscope.backend.service.storage.FunctionPreference;
import com.clusterscope.backend.service.storage.FunctionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Built-in and user-defined functions of the active cluster, with per-cluster preferences applied.
 */
@Service
public class SystemFunctionService {

    private static final Logger log = LoggerFactory.getLogger(SystemFunctionService.class);

    /**
     * Fields of a user-defined function as submitted; trimmed and validated here.
     */
    public record FunctionUpsert(String category, String name, String description, String sql) {}

    static final int MAX_FUNCTIONS_PER_CATEGORY = 4;
    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 500;

    private final FunctionStore store;
    private final ClusterContext clusters;

    public SystemFunctionService(FunctionStore store, ClusterContext clusters) {
        this.store = store;
        this.clusters = clusters;
    }

    // ---------------- read ----------------

    public List<FunctionDescriptor> list() {
        return catalog().functions();
    }

    public FunctionCatalog catalog() {
        long clusterId = clusters.requireActive().id();
        Map<String, FunctionPreference> prefs = store.preferences(clusterId);

        List<FunctionDescriptor> system = new ArrayList<>();
        for (FunctionDescriptor f : SystemFunctions.all()) {
            FunctionDescriptor withTime = store.lastAccess(f.name()).map(f::withUpdatedAt).orElse(f);
            system.add(apply(withTime, prefs));
        }
        List<FunctionDescriptor> user = new ArrayList<>();
        for (FunctionDescriptor f : store.userFunctions(clusterId)) {
            user.add(apply(f, prefs));
        }
        return FunctionCatalog.load(system, user);
    }

    public FunctionDescriptor get(FunctionRef ref) {
        return catalog().find(ref)
                .orElseThrow(() -> new NoSuchElementException("Function not found: " + describe(ref)));
    }

    // ---------------- user-defined CRUD ----------------

    public FunctionDescriptor create(FunctionUpsert req, Long createdBy) {
        Cluster cluster = clusters.requireActive();
        Fields f = validate(req);

        requireRoom(cluster, f.category());
        Placement at = placeLast(catalog(), f.category());

        Instant now = Instant.now();
        FunctionDescriptor created = store.insert(new FunctionDescriptor(
                null, f.name(), f.description(), f.category(), f.sql(),
                false, false, at.categoryOrder(), at.displayOrder(),
                cluster.id(), createdBy, now, now));
        log.info("created function {} ({}) in category {} for cluster {}",
                created.id(), created.name(), created.category(), cluster.name());
        return created;
    }

    public FunctionDescriptor update(long id, FunctionUpsert req) {
        Cluster cluster = clusters.requireActive();
        Fields f = validate(req);
        FunctionDescriptor prev = store.userFunction(cluster.id(), id)
                .orElseThrow(() -> new NoSuchElementException("Function not found: " + id));

        int categoryOrder = prev.categoryOrder();
        int displayOrder = prev.displayOrder();
        if (!prev.category().equals(f.category())) {
            requireRoom(cluster, f.category());
            Placement at = placeLast(catalog(), f.category());
            categoryOrder = at.categoryOrder();
            displayOrder = at.displayOrder();
            FunctionRef ref = FunctionRef.user(id);
            // saved positions belong to the old category
            if (store.preferences(cluster.id()).containsKey(ref.key())) {
                store.upsertOrders(cluster.id(), List.of(FunctionOrder.of(ref, categoryOrder, displayOrder)));
            }
            log.info("function {} moved from category {} to {}", id, prev.category(), f.category());
        }

        store.replace(new FunctionDescriptor(
                prev.id(), f.name(), f.description(), f.category(), f.sql(),
                prev.favorited(), false, categoryOrder, displayOrder,
                prev.clusterId(), prev.createdBy(), prev.createdAt(), Instant.now()));
        return get(FunctionRef.user(id));
    }

    public void delete(long id) {
        Cluster cluster = clusters.requireActive();
        if (!store.delete(cluster.id(), id)) {
            throw new NoSuchElementException("Function not found: " + id);
        }
        log.info("deleted function {} for cluster {}", id, cluster.name());
    }

    public void deleteCategory(String category) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Category name is required");
        }
        if (SystemFunctions.isBuiltinCategory(category)) {
            throw new IllegalArgumentException("Built-in categories cannot be deleted");
        }
        Cluster cluster = clusters.requireActive();
        int removed = store.deleteCategory(cluster.id(), category);
        log.info("deleted category {} ({} function(s)) for cluster {}", category, removed, cluster.name());
    }

    // ---------------- preferences ----------------

    public FunctionDescriptor toggleFavorite(FunctionRef ref) {
        Cluster cluster = clusters.requireActive();
        requireExists(cluster, ref);
        store.toggleFavorite(cluster.id(), ref);
        return get(ref);
    }

    public void updateOrders(List<FunctionOrder> orders) {
        if (orders == null || orders.isEmpty()) return;
        Cluster cluster = clusters.requireActive();
        for (FunctionOrder o : orders) {
            requireExists(cluster, o.ref());
        }
        store.upsertOrders(cluster.id(), orders);
    }

    public FunctionCatalog moveCategory(int fromIndex, int toIndex) {
        updateOrders(catalog().moveCategory(fromIndex, toIndex));
        return catalog();
    }

    public FunctionCatalog moveFunction(String category, int fromIndex, int toIndex) {
        updateOrders(catalog().moveFunction(category, fromIndex, toIndex));
        return catalog();
    }

    public void touch(String name) {
        if (!SystemFunctions.isBuiltin(name)) {
            throw new NoSuchElementException("Function not found: " + name);
        }
        store.touch(name, Instant.now());
    }

    // ---------------- helpers ----------------

    private record Fields(String category, String name, String description, String sql) {}

    private record Placement(int categoryOrder, int displayOrder) {}

    private void requireRoom(Cluster cluster, String category) {
        long inCategory = store.userFunctions(cluster.id()).stream()
                .filter(fn -> fn.category().equals(category))
                .count();
        if (inCategory >= MAX_FUNCTIONS_PER_CATEGORY) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "category_full");
        }
    }

    // end of an existing category, or a new category after all others
    private static Placement placeLast(FunctionCatalog current, String category) {
        int displayOrder = current.category(category)
                .map(c -> c.allFunctions().stream().mapToInt(FunctionDescriptor::displayOrder).max().orElse(-1) + 1)
                .orElse(0);
        int categoryOrder = current.category(category)
                .map(c -> c.allFunctions().get(0).categoryOrder())
                .orElseGet(() -> current.functions().stream()
                        .mapToInt(FunctionDescriptor::categoryOrder).max().orElse(-1) + 1);
        return new Placement(categoryOrder, displayOrder);
    }

    private Fields validate(FunctionUpsert req) {
        if (req == null) throw new IllegalArgumentException("Body is required");
        String category = trim(req.category());
        String name = trim(req.name());
        String description = trim(req.description());
        String sql = trim(req.sql());

        if (category.isEmpty()) throw new IllegalArgumentException("Category name cannot be empty");
        if (name.isEmpty()) throw new IllegalArgumentException("Function name cannot be empty");
        if (description.isEmpty()) throw new IllegalArgumentException("Function description cannot be empty");
        if (category.length() > MAX_NAME_LENGTH) throw new IllegalArgumentException("Category name is too long");
        if (name.length() > MAX_NAME_LENGTH) throw new IllegalArgumentException("Function name is too long");
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException("Function description is too long");
        }
        SqlSafetyValidator.validate(sql);
        return new Fields(category, name, description, sql);
    }

    private void requireExists(Cluster cluster, FunctionRef ref) {
        boolean exists = ref.isBuiltin()
                ? SystemFunctions.isBuiltin(ref.name())
                : store.userFunction(cluster.id(), ref.id()).isPresent();
        if (!exists) throw new NoSuchElementException("Function not found: " + describe(ref));
    }

    private static FunctionDescriptor apply(FunctionDescriptor f, Map<String, FunctionPreference> prefs) {
        FunctionPreference p = prefs.get(f.ref().key());
        if (p == null) return f;
        int categoryOrder = p.categoryOrder() != null ? p.categoryOrder() : f.categoryOrder();
        int displayOrder = p.displayOrder() != null ? p.displayOrder() : f.displayOrder();
        return f.withOrders(categoryOrder, displayOrder).withFavorited(p.favorited());
    }

    private static String describe(FunctionRef ref) {
        return ref.isBuiltin() ? ref.name() : String.valueOf(ref.id());
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }
}
