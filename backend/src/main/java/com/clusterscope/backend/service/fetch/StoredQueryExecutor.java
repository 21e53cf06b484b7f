package com.clusterscope.backend.service.fetch;

import com.clusterscope.backend.domain.Cluster;

import java.util.List;
import java.util.Map;

/**
 * Runs the SQL of a user-defined function against a cluster.
 * Rows keep the result set's column order. Failures surface as
 * {@link com.clusterscope.backend.navigation.FetchFailureException}.
 */
public interface StoredQueryExecutor {

    List<Map<String, Object>> query(Cluster cluster, String sql);
}
