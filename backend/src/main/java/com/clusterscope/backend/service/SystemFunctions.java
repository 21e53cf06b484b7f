package com.clusterscope.backend.service;

import com.clusterscope.backend.domain.FunctionDescriptor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Built-in introspection functions exposed by the frontend's {@code show_proc} endpoint.
 */
public final class SystemFunctions {

    public static final String CLUSTER_INFO = "Cluster Info";
    public static final String DATABASES = "Databases";
    public static final String TRANSACTIONS = "Transactions";
    public static final String TASKS = "Tasks";
    public static final String METADATA = "Metadata";
    public static final String STORAGE = "Storage";
    public static final String JOBS = "Jobs";

    // category -> (name -> description), in display order
    private static final Map<String, Map<String, String>> DEFINITIONS = new LinkedHashMap<>();

    static {
        category(CLUSTER_INFO,
                "backends", "Backend nodes",
                "frontends", "Frontend nodes",
                "brokers", "Broker nodes",
                "statistic", "Cluster statistics");
        category(DATABASES,
                "dbs", "Databases",
                "tables", "Tables",
                "tablet_schema", "Tablet schema",
                "partitions", "Partitions");
        category(TRANSACTIONS,
                "transactions", "Transactions");
        category(TASKS,
                "routine_loads", "Routine load jobs",
                "stream_loads", "Stream load jobs",
                "loads", "Load jobs",
                "load_error_hub", "Load errors");
        category(METADATA,
                "catalog", "Catalogs",
                "resources", "Resources",
                "workload_groups", "Workload groups",
                "workload_sched_policy", "Workload scheduling policies");
        category(STORAGE,
                "compactions", "Compaction tasks",
                "colocate_group", "Colocate groups",
                "bdbje", "BDBJE metadata journal",
                "small_files", "Small files",
                "trash", "Trash");
        category(JOBS,
                "jobs", "Background jobs",
                "repositories", "Backup repositories");
    }

    private static final List<FunctionDescriptor> ALL = build();

    private SystemFunctions() {
    }

    private static void category(String name, String... pairs) {
        Map<String, String> entries = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            entries.put(pairs[i], pairs[i + 1]);
        }
        DEFINITIONS.put(name, entries);
    }

    private static List<FunctionDescriptor> build() {
        List<FunctionDescriptor> out = new ArrayList<>();
        int categoryOrder = 0;
        for (Map.Entry<String, Map<String, String>> category : DEFINITIONS.entrySet()) {
            int displayOrder = 0;
            for (Map.Entry<String, String> fn : category.getValue().entrySet()) {
                out.add(FunctionDescriptor.builtin(fn.getKey(), fn.getValue(), category.getKey(),
                        categoryOrder, displayOrder++));
            }
            categoryOrder++;
        }
        return List.copyOf(out);
    }

    public static List<FunctionDescriptor> all() {
        return ALL;
    }

    public static Optional<FunctionDescriptor> find(String name) {
        return ALL.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public static boolean isBuiltin(String name) {
        return find(name).isPresent();
    }

    static Set<String> categories() {
        return DEFINITIONS.keySet();
    }

    public static boolean isBuiltinCategory(String category) {
        return DEFINITIONS.containsKey(category);
    }

    static int categoryCount() {
        return DEFINITIONS.size();
    }
}
