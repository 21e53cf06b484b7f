package com.clusterscope.backend.repo;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryStore {
    // sessionId -> session; transient, never persisted
    public final ConcurrentHashMap<String, NavigationSession> sessions = new ConcurrentHashMap<>();
}
