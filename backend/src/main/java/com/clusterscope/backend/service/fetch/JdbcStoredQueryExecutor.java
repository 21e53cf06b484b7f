package com.clusterscope.backend.service.fetch;

import com.clusterscope.backend.config.ConsoleProperties;
import com.clusterscope.backend.domain.Cluster;
import com.clusterscope.backend.navigation.FetchFailureException;
import com.zaxxer.hikari.HikariDataSource;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs stored SQL over a connection pool kept per cluster. Pools start on first use
 * and are closed when the application context shuts down.
 */
@Component
public class JdbcStoredQueryExecutor implements StoredQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcStoredQueryExecutor.class);

    static final String DRIVER = "com.mysql.cj.jdbc.Driver";

    // cluster id -> pool
    private final Map<Long, HikariDataSource> pools = new ConcurrentHashMap<>();
    private final Map<Long, JdbcTemplate> templates = new ConcurrentHashMap<>();
    private final int queryTimeoutSeconds;
    private final Duration connectTimeout;
    private final int maxPoolSize;

    public JdbcStoredQueryExecutor(ConsoleProperties props) {
        Duration timeout = props.getFetch().getTimeout();
        this.queryTimeoutSeconds = (int) Math.max(1, timeout.toSeconds());
        // Hikari rejects connection timeouts below 250ms
        this.connectTimeout = timeout.toMillis() < 250 ? Duration.ofMillis(250) : timeout;
        this.maxPoolSize = Math.max(1, props.getFetch().getPoolSize());
    }

    @Override
    public List<Map<String, Object>> query(Cluster cluster, String sql) {
        JdbcTemplate jdbc = templates.computeIfAbsent(cluster.id(), id -> template(dataSource(cluster)));
        List<Map<String, Object>> raw;
        try {
            raw = jdbc.queryForList(sql);
        } catch (DataAccessException e) {
            log.warn("stored query failed on {}: {}", cluster.name(), e.getMostSpecificCause().getMessage());
            throw new FetchFailureException("Query failed on " + cluster.name() + ": "
                    + e.getMostSpecificCause().getMessage(), e);
        }

        List<Map<String, Object>> rows = new ArrayList<>(raw.size());
        for (Map<String, Object> r : raw) {
            Map<String, Object> row = new LinkedHashMap<>();
            r.forEach((k, v) -> row.put(k, v == null ? "" : String.valueOf(v)));
            rows.add(row);
        }
        return rows;
    }

    HikariDataSource dataSource(Cluster cluster) {
        return pools.computeIfAbsent(cluster.id(), id -> {
            // setter-configured pools stay unstarted until the first getConnection()
            HikariDataSource ds = new HikariDataSource();
            ds.setPoolName("cluster-" + id);
            ds.setDriverClassName(DRIVER);
            ds.setJdbcUrl(cluster.jdbcUrl());
            ds.setUsername(cluster.username());
            ds.setPassword(cluster.password() == null ? "" : cluster.password());
            ds.setMaximumPoolSize(maxPoolSize);
            ds.setMinimumIdle(0);
            ds.setConnectionTimeout(connectTimeout.toMillis());
            log.info("connection pool {} created for {}", ds.getPoolName(), cluster.name());
            return ds;
        });
    }

    @PreDestroy
    public void close() {
        templates.clear();
        pools.values().forEach(HikariDataSource::close);
        if (!pools.isEmpty()) {
            log.info("closed {} cluster connection pool(s)", pools.size());
        }
        pools.clear();
    }

    private JdbcTemplate template(HikariDataSource ds) {
        JdbcTemplate jdbc = new JdbcTemplate(ds);
        jdbc.setQueryTimeout(queryTimeoutSeconds);
        return jdbc;
    }
}
