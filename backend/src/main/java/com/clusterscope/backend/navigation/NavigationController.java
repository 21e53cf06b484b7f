package com.clusterscope.backend.navigation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

/**
 * Drill-down navigation over system functions.
 *
 * <p>The controller is {@link NavigationState#IDLE} with an empty stack, or
 * {@link NavigationState#BROWSING} with at least one frame. History only remembers how to
 * re-fetch each level; rows of the top frame are kept in a separate {@link LevelData}.
 *
 * <p>Stack changes are committed before the fetch for the new top frame is issued and are not
 * rolled back when the fetch fails. Each fetch is tagged with its frame and a request number;
 * a response is applied only while its frame is still on top and no newer request for that
 * frame has been issued. Anything else is dropped.
 *
 * <p>One instance per browsing session and cluster. Fetch completions may arrive on other
 * threads, so every state access is synchronized.
 */
public class NavigationController {

    private static final Logger log = LoggerFactory.getLogger(NavigationController.class);

    private final DataFetcher fetcher;
    private final NavigationListener listener;
    private final Predicate<String> canDrillDown;
    private final int maxDepth;

    // head is the top frame
    private final Deque<NavigationFrame> stack = new ArrayDeque<>();
    private LevelData currentLevel;
    private long requestCounter;
    private long latestRequest;

    public NavigationController(DataFetcher fetcher) {
        this(fetcher, NavigationListener.NOOP);
    }

    public NavigationController(DataFetcher fetcher, NavigationListener listener) {
        this(fetcher, listener, NestableFunctions::canDrillDown, 0);
    }

    /**
     * @param maxDepth stack depth at which rows stop being navigable; 0 means unlimited
     */
    public NavigationController(DataFetcher fetcher,
                                NavigationListener listener,
                                Predicate<String> canDrillDown,
                                int maxDepth) {
        this.fetcher = fetcher;
        this.listener = listener == null ? NavigationListener.NOOP : listener;
        this.canDrillDown = canDrillDown;
        this.maxDepth = Math.max(0, maxDepth);
    }

    // ---------------- operations ----------------

    public synchronized CompletableFuture<FetchOutcome> selectRoot(String functionName) {
        if (functionName == null || functionName.isBlank()) {
            throw new IllegalArgumentException("functionName is required");
        }
        stack.clear();
        NavigationFrame root = NavigationFrame.root(functionName.trim());
        stack.push(root);
        currentLevel = null;
        log.debug("select {}", root.procPath());
        return issue(root);
    }

    public synchronized CompletableFuture<FetchOutcome> drillInto(Map<String, ?> row, String columnKey) {
        NavigationFrame top = stack.peek();
        if (top == null || row == null || columnKey == null) {
            return done(FetchOutcome.SKIPPED);
        }
        if (currentLevel == null || !currentLevel.frame().equals(top)) {
            return done(FetchOutcome.SKIPPED);
        }
        String navigable = currentLevel.schema().navigableColumn();
        if (navigable == null || !navigable.equals(columnKey)) {
            return done(FetchOutcome.SKIPPED);
        }
        Object value = row.get(columnKey);
        String segment = value == null ? "" : String.valueOf(value);
        if (segment.isEmpty()) {
            return done(FetchOutcome.SKIPPED);
        }
        // a '/' would split into several path segments and desync breadcrumb from depth
        if (segment.indexOf('/') >= 0) {
            log.debug("drill skipped, value {} contains '/'", segment);
            return done(FetchOutcome.SKIPPED);
        }

        NavigationFrame child = top.child(segment);
        stack.push(child);
        currentLevel = null;
        log.debug("drill {} -> {}", top.procPath(), child.procPath());
        return issue(child);
    }

    public synchronized CompletableFuture<FetchOutcome> goBack() {
        if (stack.isEmpty()) {
            return done(FetchOutcome.SKIPPED);
        }
        if (stack.size() == 1) {
            clear();
            log.debug("back to idle");
            return done(FetchOutcome.NO_FETCH);
        }
        stack.pop();
        currentLevel = null;
        NavigationFrame parent = stack.peek();
        log.debug("back to {}", parent.procPath());
        return issue(parent);
    }

    public synchronized CompletableFuture<FetchOutcome> refreshCurrent() {
        NavigationFrame top = stack.peek();
        if (top == null) {
            return done(FetchOutcome.SKIPPED);
        }
        return issue(top);
    }

    public synchronized void resetOnContextChange() {
        clear();
        log.debug("navigation reset");
        listener.onReset();
    }

    // ---------------- read side ----------------

    public synchronized NavigationState state() {
        return stack.isEmpty() ? NavigationState.IDLE : NavigationState.BROWSING;
    }

    public synchronized int depth() {
        return stack.size();
    }

    public synchronized Optional<NavigationFrame> currentFrame() {
        return Optional.ofNullable(stack.peek());
    }

    /**
     * Frames from the root to the top.
     */
    public synchronized List<NavigationFrame> history() {
        List<NavigationFrame> frames = new ArrayList<>(stack);
        Collections.reverse(frames);
        return List.copyOf(frames);
    }

    public synchronized List<String> breadcrumb() {
        NavigationFrame top = stack.peek();
        return top == null ? List.of() : top.breadcrumb();
    }

    /**
     * Rows of the top frame, empty while its fetch is pending or when idle.
     */
    public synchronized Optional<LevelData> currentLevel() {
        return Optional.ofNullable(currentLevel);
    }

    public synchronized TableRenderSpec currentRenderSpec() {
        SchemaInference schema = currentLevel == null ? SchemaInference.EMPTY : currentLevel.schema();
        return TableRenderSpecBuilder.build(schema, this::drillInto);
    }

    // ---------------- internals ----------------

    private void clear() {
        stack.clear();
        currentLevel = null;
        // in-flight responses can no longer match
        latestRequest = ++requestCounter;
    }

    private CompletableFuture<FetchOutcome> issue(NavigationFrame frame) {
        long requestId = ++requestCounter;
        latestRequest = requestId;

        CompletableFuture<List<Map<String, Object>>> pending;
        try {
            pending = fetcher.fetch(frame.functionName(), frame.nestedPath());
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }
        if (pending == null) {
            pending = CompletableFuture.failedFuture(new FetchFailureException("No response for " + frame.procPath()));
        }
        return pending.handle((rows, error) -> complete(frame, requestId, rows, error));
    }

    private synchronized FetchOutcome complete(NavigationFrame frame,
                                               long requestId,
                                               List<Map<String, Object>> rows,
                                               Throwable error) {
        if (requestId != latestRequest || !frame.equals(stack.peek())) {
            log.debug("discarding stale response for {} (request {})", frame.procPath(), requestId);
            return FetchOutcome.STALE;
        }

        if (error != null) {
            FetchFailureException failure = asFetchFailure(frame, error);
            log.warn("fetch {} failed: {}", frame.procPath(), failure.getMessage());
            currentLevel = (currentLevel != null && currentLevel.frame().equals(frame))
                    ? currentLevel.withError(failure.getMessage())
                    : LevelData.failed(frame, failure.getMessage());
            listener.onFetchFailed(frame, failure);
            return FetchOutcome.FAILED;
        }

        List<Map<String, Object>> batch = new ArrayList<>();
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                if (row != null) {
                    batch.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
                }
            }
        }
        boolean depthAllowsDrill = maxDepth == 0 || stack.size() < maxDepth;
        SchemaInference schema = SchemaInferenceEngine.infer(
                batch, canDrillDown.test(frame.functionName()), depthAllowsDrill);
        currentLevel = new LevelData(frame, List.copyOf(batch), schema, null);
        log.debug("loaded {} rows for {}", batch.size(), frame.procPath());
        listener.onLevelLoaded(currentLevel);
        return FetchOutcome.APPLIED;
    }

    private static FetchFailureException asFetchFailure(NavigationFrame frame, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof FetchFailureException failure) {
            return failure;
        }
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new FetchFailureException("Failed to load " + frame.procPath() + ": " + message, cause);
    }

    private static CompletableFuture<FetchOutcome> done(FetchOutcome outcome) {
        return CompletableFuture.completedFuture(outcome);
    }
}
