package com.clusterscope.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "console")
public class ConsoleProperties {

    /** Directory of the JSON function store. */
    private String storageDir = "data";

    private final Fetch fetch = new Fetch();

    private List<ClusterEntry> clusters = new ArrayList<>();

    public String getStorageDir() { return storageDir; }
    public void setStorageDir(String storageDir) { this.storageDir = storageDir; }

    public Fetch getFetch() { return fetch; }

    public List<ClusterEntry> getClusters() { return clusters; }
    public void setClusters(List<ClusterEntry> clusters) { this.clusters = clusters; }

    public static class Fetch {
        private Duration timeout = Duration.ofSeconds(30);
        private int poolSize = 4;
        // 0 = unlimited
        private int maxDepth = 0;
        /** Navigation sessions untouched for this long are dropped. */
        private Duration sessionIdleTimeout = Duration.ofMinutes(30);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }

        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

        public Duration getSessionIdleTimeout() { return sessionIdleTimeout; }
        public void setSessionIdleTimeout(Duration sessionIdleTimeout) { this.sessionIdleTimeout = sessionIdleTimeout; }
    }

    public static class ClusterEntry {
        private long id;
        private String name;
        private String feHost = "127.0.0.1";
        private int feHttpPort = 8030;
        private int feQueryPort = 9030;
        private String username = "root";
        private String password = "";
        private boolean ssl;
        private boolean active;

        public long getId() { return id; }
        public void setId(long id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getFeHost() { return feHost; }
        public void setFeHost(String feHost) { this.feHost = feHost; }

        public int getFeHttpPort() { return feHttpPort; }
        public void setFeHttpPort(int feHttpPort) { this.feHttpPort = feHttpPort; }

        public int getFeQueryPort() { return feQueryPort; }
        public void setFeQueryPort(int feQueryPort) { this.feQueryPort = feQueryPort; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public boolean isSsl() { return ssl; }
        public void setSsl(boolean ssl) { this.ssl = ssl; }

        public boolean isActive() { return active; }
        public void setActive(boolean active) { this.active = active; }
    }
}
