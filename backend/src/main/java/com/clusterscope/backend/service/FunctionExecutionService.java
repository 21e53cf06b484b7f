package com.clusterscope.backend.service;

import com.clusterscope.backend.domain.Cluster;
import com.clusterscope.backend.domain.FunctionDescriptor;
import com.clusterscope.backend.domain.FunctionRef;
import com.clusterscope.backend.domain.FunctionRun;
import com.clusterscope.backend.domain.NavigationView;
import com.clusterscope.backend.domain.QueryResultView;
import com.clusterscope.backend.navigation.SchemaInference;
import com.clusterscope.backend.navigation.SchemaInferenceEngine;
import com.clusterscope.backend.navigation.TableRenderSpecBuilder;
import com.clusterscope.backend.service.fetch.StoredQueryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Dispatches a catalog entry: built-ins browse show_proc through a navigation session,
 * user-defined functions run their stored SQL once.
 */
@Service
public class FunctionExecutionService {

    private static final Logger log = LoggerFactory.getLogger(FunctionExecutionService.class);

    private final SystemFunctionService functions;
    private final NavigationSessionService sessions;
    private final StoredQueryExecutor executor;
    private final ClusterContext clusters;

    public FunctionExecutionService(SystemFunctionService functions,
                                    NavigationSessionService sessions,
                                    StoredQueryExecutor executor,
                                    ClusterContext clusters) {
        this.functions = functions;
        this.sessions = sessions;
        this.executor = executor;
        this.clusters = clusters;
    }

    public FunctionRun open(String sessionId, FunctionRef ref) {
        FunctionDescriptor fn = functions.get(ref);
        if (fn.systemDefined()) {
            functions.touch(fn.name());
            NavigationView view = sessions.select(sessionId, fn.name());
            return new FunctionRun(fn, view, null);
        }
        // a flat query result replaces whatever the session was browsing
        sessions.reset(sessionId);
        return new FunctionRun(fn, sessions.view(sessionId), run(fn));
    }

    public QueryResultView execute(long id) {
        FunctionDescriptor fn = functions.get(FunctionRef.user(id));
        return run(fn);
    }

    private QueryResultView run(FunctionDescriptor fn) {
        if (fn.systemDefined()) {
            throw new IllegalArgumentException("Built-in functions are browsed, not executed: " + fn.name());
        }
        Cluster cluster = clusters.requireActive();
        long started = System.currentTimeMillis();
        List<Map<String, Object>> rows = executor.query(cluster, fn.sqlQuery());
        log.info("executed function {} ({}) on {}: {} row(s) in {}ms",
                fn.id(), fn.name(), cluster.name(), rows.size(), System.currentTimeMillis() - started);

        SchemaInference schema = SchemaInferenceEngine.infer(rows, false);
        return new QueryResultView(
                fn.name(),
                TableRenderSpecBuilder.build(schema, null).columns(),
                rows,
                rows.size());
    }
}
