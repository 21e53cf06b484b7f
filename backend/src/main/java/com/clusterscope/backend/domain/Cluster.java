package com.clusterscope.backend.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A registered cluster, addressed through its frontend node.
 */
public record Cluster(
        long id,
        String name,
        String feHost,
        int feHttpPort,    // REST api, /api/show_proc
        int feQueryPort,   // MySQL protocol
        String username,
        @JsonIgnore String password,
        boolean ssl
) {

    public String baseUrl() {
        return (ssl ? "https://" : "http://") + feHost + ":" + feHttpPort;
    }

    public String jdbcUrl() {
        return "jdbc:mysql://" + feHost + ":" + feQueryPort + "/?useSSL=" + ssl;
    }
}
