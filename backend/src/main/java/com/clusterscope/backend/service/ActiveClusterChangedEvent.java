package com.clusterscope.backend.service;

import com.clusterscope.backend.domain.Cluster;

/**
 * Published when the active cluster identity changes. {@code previous} is null on the first activation.
 */
public record ActiveClusterChangedEvent(Cluster previous, Cluster current) {}
