package com.clusterscope.backend.domain;

import com.clusterscope.backend.navigation.ColumnDescriptor;
import com.clusterscope.backend.navigation.FetchOutcome;
import com.clusterscope.backend.navigation.NavigationFrame;
import com.clusterscope.backend.navigation.NavigationState;

import java.util.List;
import java.util.Map;

/**
 * What the console shows for a browsing session after an action.
 *
 * @param loading true while the fetch for the top frame has not landed yet
 * @param error failure of the level on screen
 * @param lastError most recent fetch failure reported to the session, cleared by the next load or reset
 * @param outcome result of the action that produced this view, null for plain reads
 */
public record NavigationView(
        String sessionId,
        long clusterId,
        NavigationState state,
        int depth,
        NavigationFrame frame,
        List<String> breadcrumb,
        List<NavigationFrame> history,
        List<ColumnDescriptor> columns,
        String navigableColumn,
        List<Map<String, Object>> rows,
        int totalCount,
        boolean loading,
        String error,
        String lastError,
        FetchOutcome outcome
) {}
