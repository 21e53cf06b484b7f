package com.clusterscope.backend.service;

import com.clusterscope.backend.config.ConsoleProperties;
import com.clusterscope.backend.domain.NavigationView;
import com.clusterscope.backend.navigation.DataFetcher;
import com.clusterscope.backend.navigation.FetchOutcome;
import com.clusterscope.backend.navigation.LevelData;
import com.clusterscope.backend.navigation.NavigationController;
import com.clusterscope.backend.navigation.TableRenderSpec;
import com.clusterscope.backend.repo.InMemoryStore;
import com.clusterscope.backend.repo.NavigationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

@Service
public class NavigationSessionService {

    private static final Logger log = LoggerFactory.getLogger(NavigationSessionService.class);

    // show_proc function names: letters, digits, underscores
    private static final Pattern FUNCTION_NAME = Pattern.compile("[A-Za-z0-9_]+");

    private final InMemoryStore store;
    private final ClusterContext clusters;
    private final DataFetcher fetcher;
    private final Duration waitTimeout;
    private final int maxDepth;
    private final Duration idleTimeout;

    public NavigationSessionService(InMemoryStore store,
                                    ClusterContext clusters,
                                    DataFetcher fetcher,
                                    ConsoleProperties props) {
        this.store = store;
        this.clusters = clusters;
        this.fetcher = fetcher;
        this.waitTimeout = props.getFetch().getTimeout();
        this.maxDepth = props.getFetch().getMaxDepth();
        this.idleTimeout = props.getFetch().getSessionIdleTimeout();
    }

    public NavigationSession create() {
        long clusterId = clusters.requireActive().id();
        String id = UUID.randomUUID().toString();
        NavigationSession s = new NavigationSession(id, clusterId, fetcher, maxDepth);
        store.sessions.put(id, s);
        log.info("navigation session {} opened on cluster {}", id, clusterId);
        return s;
    }

    public NavigationSession get(String sessionId) {
        NavigationSession s = store.sessions.get(sessionId);
        if (s == null) throw new NoSuchElementException("navigation_session_not_found");
        return s;
    }

    public List<NavigationSession> list() {
        return store.sessions.values().stream()
                .sorted(Comparator.comparing(NavigationSession::createdAt))
                .toList();
    }

    public void delete(String sessionId) {
        if (store.sessions.remove(sessionId) == null) {
            throw new NoSuchElementException("navigation_session_not_found");
        }
        log.info("navigation session {} closed", sessionId);
    }

    public NavigationView view(String sessionId) {
        return toView(get(sessionId), null);
    }

    public NavigationView select(String sessionId, String functionName) {
        if (functionName == null || !FUNCTION_NAME.matcher(functionName.trim()).matches()) {
            throw new IllegalArgumentException("invalid function name: " + functionName);
        }
        NavigationSession s = touched(sessionId);
        return await(s, s.controller().selectRoot(functionName.trim()));
    }

    public NavigationView drill(String sessionId, Map<String, Object> row, String columnKey) {
        NavigationSession s = touched(sessionId);
        return await(s, s.controller().drillInto(row, columnKey));
    }

    public NavigationView back(String sessionId) {
        NavigationSession s = touched(sessionId);
        return await(s, s.controller().goBack());
    }

    public NavigationView refresh(String sessionId) {
        NavigationSession s = touched(sessionId);
        return await(s, s.controller().refreshCurrent());
    }

    /**
     * Returns the session to Idle without touching its cluster binding.
     */
    public NavigationView reset(String sessionId) {
        NavigationSession s = touched(sessionId);
        s.controller().resetOnContextChange();
        return toView(s, null);
    }

    @EventListener
    public void onActiveClusterChanged(ActiveClusterChangedEvent event) {
        long next = event.current().id();
        int n = 0;
        for (NavigationSession s : store.sessions.values()) {
            s.rebind(next);
            n++;
        }
        log.info("cluster switched to {}, reset {} navigation session(s)", event.current().name(), n);
    }

    @Scheduled(fixedDelayString = "${console.fetch.session-sweep-interval:PT1M}")
    public void evictIdleSessions() {
        evictIdle(Instant.now());
    }

    /**
     * Drops every session whose last activity is older than the idle timeout at {@code now}.
     *
     * @return number of sessions removed
     */
    public int evictIdle(Instant now) {
        Instant cutoff = now.minus(idleTimeout);
        int n = 0;
        for (NavigationSession s : store.sessions.values()) {
            if (s.lastActivity().isBefore(cutoff) && store.sessions.remove(s.id(), s)) {
                log.info("navigation session {} evicted after {} idle", s.id(), idleTimeout);
                n++;
            }
        }
        return n;
    }

    private NavigationSession touched(String sessionId) {
        NavigationSession s = get(sessionId);
        s.markActive();
        return s;
    }

    private NavigationView await(NavigationSession s, CompletableFuture<FetchOutcome> pending) {
        FetchOutcome outcome = null;
        try {
            outcome = pending.get(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // the fetch keeps running; the view reports loading until it lands
            log.warn("session {} fetch still pending after {}ms", s.id(), waitTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for fetch", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("navigation fetch crashed", e.getCause());
        }
        return toView(s, outcome);
    }

    static NavigationView toView(NavigationSession s, FetchOutcome outcome) {
        NavigationController c = s.controller();
        // one consistent snapshot of the controller
        synchronized (c) {
            LevelData level = c.currentLevel().orElse(null);
            TableRenderSpec spec = c.currentRenderSpec();
            List<Map<String, Object>> rows = level == null ? List.of() : level.rows();
            return new NavigationView(
                    s.id(),
                    s.clusterId(),
                    c.state(),
                    c.depth(),
                    c.currentFrame().orElse(null),
                    c.breadcrumb(),
                    c.history(),
                    spec.columns(),
                    level == null ? null : level.schema().navigableColumn(),
                    rows,
                    rows.size(),
                    level == null && c.depth() > 0,
                    level == null ? null : level.error(),
                    s.lastError(),
                    outcome
            );
        }
    }
}
