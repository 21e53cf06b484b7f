package com.clusterscope.backend.config;

import com.clusterscope.backend.domain.Cluster;
import com.clusterscope.backend.service.ClusterContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Logs each console API call with the cluster that was active when it completed.
 */
@Component
public class ApiLoggingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiLoggingFilter.class);

    static final String API_PREFIX = "/api/";

    // absent in sliced web tests
    private final ObjectProvider<ClusterContext> clusters;

    public ApiLoggingFilter(ObjectProvider<ClusterContext> clusters) {
        this.clusters = clusters;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        String path = req.getRequestURI().substring(req.getContextPath().length());
        return !path.startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        long t0 = System.currentTimeMillis();
        try {
            chain.doFilter(req, res);
        } finally {
            long ms = System.currentTimeMillis() - t0;
            log.info("[API] {} {} cluster={} -> {} ({}ms)",
                    req.getMethod(), req.getRequestURI(), activeClusterLabel(), res.getStatus(), ms);
        }
    }

    String activeClusterLabel() {
        ClusterContext ctx = clusters.getIfAvailable();
        if (ctx == null) {
            return "-";
        }
        return ctx.activeCluster().map(Cluster::id).map(String::valueOf).orElse("-");
    }
}
