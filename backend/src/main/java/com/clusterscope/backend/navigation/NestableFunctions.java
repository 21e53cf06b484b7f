package com.clusterscope.backend.navigation;

import java.util.Set;

/**
 * System functions whose rows can be drilled into. Every other function is flat.
 */
public final class NestableFunctions {

    public static final Set<String> NAMES = Set.of(
            "transactions", "dbs", "catalog", "routine_loads",
            "stream_loads", "loads", "load_error_hub", "resources",
            "workload_groups", "workload_sched_policy", "compactions",
            "colocate_group", "bdbje", "small_files", "trash",
            "jobs", "repositories"
    );

    private NestableFunctions() {
    }

    public static boolean canDrillDown(String functionName) {
        return functionName != null && NAMES.contains(functionName);
    }
}
