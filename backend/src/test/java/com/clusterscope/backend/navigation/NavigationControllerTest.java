package com.clusterscope.backend.navigation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NavigationControllerTest {

    /** Fetcher whose responses are completed by hand. */
    static class ManualFetcher implements DataFetcher {
        record Call(String functionName, String nestedPath, CompletableFuture<List<Map<String, Object>>> future) {}

        final List<Call> calls = new ArrayList<>();

        @Override
        public CompletableFuture<List<Map<String, Object>>> fetch(String functionName, String nestedPath) {
            CompletableFuture<List<Map<String, Object>>> f = new CompletableFuture<>();
            calls.add(new Call(functionName, nestedPath, f));
            return f;
        }

        Call last() {
            return calls.get(calls.size() - 1);
        }
    }

    static class RecordingListener implements NavigationListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void onLevelLoaded(LevelData level) {
            events.add("loaded " + level.frame().procPath());
        }

        @Override
        public void onFetchFailed(NavigationFrame frame, FetchFailureException failure) {
            events.add("failed " + frame.procPath());
        }

        @Override
        public void onReset() {
            events.add("reset");
        }
    }

    private ManualFetcher fetcher;
    private RecordingListener listener;
    private NavigationController nav;

    @BeforeEach
    void setUp() {
        fetcher = new ManualFetcher();
        listener = new RecordingListener();
        nav = new NavigationController(fetcher, listener);
    }

    private static Map<String, Object> row(String... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
        return m;
    }

    private static final List<Map<String, Object>> TXN_ROWS = List.of(
            row("Label", "load_1", "TransactionId", "5001"),
            row("Label", "load_2", "TransactionId", "5002"));

    private void browseTransactions() {
        nav.selectRoot("transactions");
        fetcher.last().future().complete(TXN_ROWS);
    }

    @Test
    void startsIdle() {
        assertThat(nav.state()).isEqualTo(NavigationState.IDLE);
        assertThat(nav.depth()).isZero();
        assertThat(nav.currentFrame()).isEmpty();
        assertThat(nav.breadcrumb()).isEmpty();
        assertThat(nav.currentRenderSpec().isEmpty()).isTrue();
    }

    @Test
    void selectRootPushesFrameAndAppliesRows() {
        CompletableFuture<FetchOutcome> outcome = nav.selectRoot("transactions");

        assertThat(nav.state()).isEqualTo(NavigationState.BROWSING);
        assertThat(fetcher.last().functionName()).isEqualTo("transactions");
        assertThat(fetcher.last().nestedPath()).isNull();
        assertThat(nav.currentLevel()).isEmpty();

        fetcher.last().future().complete(TXN_ROWS);

        assertThat(outcome).isCompletedWithValue(FetchOutcome.APPLIED);
        LevelData level = nav.currentLevel().orElseThrow();
        assertThat(level.rows()).hasSize(2);
        assertThat(level.schema().navigableColumn()).isEqualTo("TransactionId");
        assertThat(listener.events).containsExactly("loaded /transactions");
    }

    @Test
    void selectRootRejectsBlankName() {
        assertThatThrownBy(() -> nav.selectRoot(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThat(nav.state()).isEqualTo(NavigationState.IDLE);
    }

    @Test
    void selectRootReplacesExistingStack() {
        browseTransactions();
        nav.drillInto(TXN_ROWS.get(0), "TransactionId");

        nav.selectRoot("dbs");

        assertThat(nav.depth()).isEqualTo(1);
        assertThat(nav.currentFrame()).contains(NavigationFrame.root("dbs"));
    }

    @Test
    void drillBuildsNestedPath() {
        browseTransactions();

        CompletableFuture<FetchOutcome> outcome = nav.drillInto(TXN_ROWS.get(0), "TransactionId");

        assertThat(nav.depth()).isEqualTo(2);
        assertThat(fetcher.last().functionName()).isEqualTo("transactions");
        assertThat(fetcher.last().nestedPath()).isEqualTo("5001");

        fetcher.last().future().complete(List.of(row("State", "running", "Count", "3")));
        assertThat(outcome).isCompletedWithValue(FetchOutcome.APPLIED);

        nav.drillInto(nav.currentLevel().orElseThrow().rows().get(0), "State");
        assertThat(fetcher.last().nestedPath()).isEqualTo("5001/running");
        assertThat(nav.breadcrumb()).containsExactly("transactions", "5001", "running");
        assertThat(nav.history()).extracting(NavigationFrame::procPath)
                .containsExactly("/transactions", "/transactions/5001", "/transactions/5001/running");
    }

    @Test
    void drillOnPlainColumnIsSkipped() {
        browseTransactions();
        int calls = fetcher.calls.size();

        assertThat(nav.drillInto(TXN_ROWS.get(0), "Label")).isCompletedWithValue(FetchOutcome.SKIPPED);
        assertThat(fetcher.calls).hasSize(calls);
        assertThat(nav.depth()).isEqualTo(1);
    }

    @Test
    void drillOnEmptyValueIsSkipped() {
        browseTransactions();

        assertThat(nav.drillInto(row("Label", "x", "TransactionId", ""), "TransactionId"))
                .isCompletedWithValue(FetchOutcome.SKIPPED);
        assertThat(nav.depth()).isEqualTo(1);
    }

    @Test
    void flatFunctionHasNothingToDrill() {
        nav.selectRoot("backends");
        fetcher.last().future().complete(List.of(row("BackendId", "10001", "Host", "be1")));

        assertThat(nav.currentRenderSpec().clickableColumn()).isEmpty();
        assertThat(nav.drillInto(row("BackendId", "10001"), "BackendId")).isCompletedWithValue(FetchOutcome.SKIPPED);
    }

    @Test
    void drillOnValueWithSlashIsSkipped() {
        nav.selectRoot("routine_loads");
        fetcher.last().future().complete(List.of(row("JobId", "a/b", "Name", "job")));
        int callsBefore = fetcher.calls.size();

        assertThat(nav.drillInto(row("JobId", "a/b", "Name", "job"), "JobId"))
                .isCompletedWithValue(FetchOutcome.SKIPPED);
        assertThat(nav.depth()).isEqualTo(1);
        assertThat(nav.breadcrumb()).containsExactly("routine_loads");
        assertThat(fetcher.calls).hasSize(callsBefore);
    }

    @Test
    void drillWhileLoadingIsSkipped() {
        nav.selectRoot("transactions");

        assertThat(nav.drillInto(TXN_ROWS.get(0), "TransactionId")).isCompletedWithValue(FetchOutcome.SKIPPED);
        assertThat(nav.depth()).isEqualTo(1);
    }

    @Test
    void backFromRootReturnsToIdleWithoutFetch() {
        browseTransactions();
        int calls = fetcher.calls.size();

        assertThat(nav.goBack()).isCompletedWithValue(FetchOutcome.NO_FETCH);
        assertThat(nav.state()).isEqualTo(NavigationState.IDLE);
        assertThat(nav.currentLevel()).isEmpty();
        assertThat(fetcher.calls).hasSize(calls);
    }

    @Test
    void backWhenIdleIsSkipped() {
        assertThat(nav.goBack()).isCompletedWithValue(FetchOutcome.SKIPPED);
    }

    @Test
    void backRefetchesParent() {
        browseTransactions();
        nav.drillInto(TXN_ROWS.get(0), "TransactionId");
        fetcher.last().future().complete(List.of(row("State", "running")));

        CompletableFuture<FetchOutcome> back = nav.goBack();

        assertThat(nav.depth()).isEqualTo(1);
        assertThat(nav.currentLevel()).isEmpty();
        assertThat(fetcher.last().functionName()).isEqualTo("transactions");
        assertThat(fetcher.last().nestedPath()).isNull();

        fetcher.last().future().complete(TXN_ROWS);
        assertThat(back).isCompletedWithValue(FetchOutcome.APPLIED);
        assertThat(nav.currentLevel().orElseThrow().rows()).hasSize(2);
    }

    @Test
    void responseForReplacedRootIsStale() {
        nav.selectRoot("transactions");
        ManualFetcher.Call first = fetcher.last();
        CompletableFuture<FetchOutcome> second = nav.selectRoot("dbs");
        ManualFetcher.Call dbs = fetcher.last();

        first.future().complete(TXN_ROWS);

        assertThat(nav.currentLevel()).isEmpty();
        assertThat(listener.events).isEmpty();

        dbs.future().complete(List.of(row("DbId", "10", "DbName", "demo")));
        assertThat(second).isCompletedWithValue(FetchOutcome.APPLIED);
        assertThat(nav.currentLevel().orElseThrow().frame()).isEqualTo(NavigationFrame.root("dbs"));
    }

    @Test
    void staleOutcomeIsReported() {
        CompletableFuture<FetchOutcome> first = nav.selectRoot("transactions");
        ManualFetcher.Call txn = fetcher.last();
        nav.selectRoot("dbs");

        txn.future().complete(TXN_ROWS);

        assertThat(first).isCompletedWithValue(FetchOutcome.STALE);
    }

    @Test
    void childResponseAfterBackIsDiscarded() {
        browseTransactions();
        CompletableFuture<FetchOutcome> drill = nav.drillInto(TXN_ROWS.get(0), "TransactionId");
        ManualFetcher.Call child = fetcher.last();

        nav.goBack();
        ManualFetcher.Call parent = fetcher.last();

        child.future().complete(List.of(row("State", "running")));
        assertThat(drill).isCompletedWithValue(FetchOutcome.STALE);
        assertThat(nav.currentLevel()).isEmpty();

        parent.future().complete(TXN_ROWS);
        assertThat(nav.currentLevel().orElseThrow().frame()).isEqualTo(NavigationFrame.root("transactions"));
    }

    @Test
    void abandonedChildLandingAfterParentIsStale() {
        browseTransactions();
        CompletableFuture<FetchOutcome> drill = nav.drillInto(TXN_ROWS.get(0), "TransactionId");
        ManualFetcher.Call child = fetcher.last();

        CompletableFuture<FetchOutcome> back = nav.goBack();
        ManualFetcher.Call parent = fetcher.last();

        parent.future().complete(TXN_ROWS);
        assertThat(back).isCompletedWithValue(FetchOutcome.APPLIED);

        child.future().complete(List.of(row("State", "running")));
        assertThat(drill).isCompletedWithValue(FetchOutcome.STALE);

        LevelData level = nav.currentLevel().orElseThrow();
        assertThat(level.frame()).isEqualTo(NavigationFrame.root("transactions"));
        assertThat(level.rows()).isEqualTo(TXN_ROWS);
        assertThat(nav.depth()).isEqualTo(1);
    }

    @Test
    void olderRefreshOfSameFrameIsStale() {
        browseTransactions();
        CompletableFuture<FetchOutcome> r1 = nav.refreshCurrent();
        ManualFetcher.Call c1 = fetcher.last();
        CompletableFuture<FetchOutcome> r2 = nav.refreshCurrent();
        ManualFetcher.Call c2 = fetcher.last();

        c2.future().complete(List.of(row("Label", "new", "TransactionId", "6001")));
        c1.future().complete(List.of(row("Label", "old", "TransactionId", "1")));

        assertThat(r2).isCompletedWithValue(FetchOutcome.APPLIED);
        assertThat(r1).isCompletedWithValue(FetchOutcome.STALE);
        assertThat(nav.currentLevel().orElseThrow().rows().get(0)).containsEntry("Label", "new");
    }

    @Test
    void refreshWhenIdleIsSkipped() {
        assertThat(nav.refreshCurrent()).isCompletedWithValue(FetchOutcome.SKIPPED);
        assertThat(fetcher.calls).isEmpty();
    }

    @Test
    void failedDrillKeepsStack() {
        browseTransactions();
        CompletableFuture<FetchOutcome> drill = nav.drillInto(TXN_ROWS.get(0), "TransactionId");

        fetcher.last().future().completeExceptionally(new FetchFailureException("HTTP status 500 for /transactions/5001"));

        assertThat(drill).isCompletedWithValue(FetchOutcome.FAILED);
        assertThat(nav.depth()).isEqualTo(2);
        LevelData level = nav.currentLevel().orElseThrow();
        assertThat(level.hasError()).isTrue();
        assertThat(level.error()).contains("500");
        assertThat(level.rows()).isEmpty();
        assertThat(listener.events).containsExactly("loaded /transactions", "failed /transactions/5001");
    }

    @Test
    void failedRefreshKeepsPreviousRows() {
        browseTransactions();
        nav.refreshCurrent();

        fetcher.last().future().completeExceptionally(new IllegalStateException("connection reset"));

        LevelData level = nav.currentLevel().orElseThrow();
        assertThat(level.rows()).hasSize(2);
        assertThat(level.error()).contains("connection reset");
    }

    @Test
    void fetcherThrowingSynchronouslyIsAFailure() {
        NavigationController broken = new NavigationController((fn, path) -> {
            throw new IllegalStateException("boom");
        });

        assertThat(broken.selectRoot("dbs")).isCompletedWithValue(FetchOutcome.FAILED);
        assertThat(broken.state()).isEqualTo(NavigationState.BROWSING);
        assertThat(broken.currentLevel().orElseThrow().error()).contains("boom");
    }

    @Test
    void resetReturnsToIdleAndDropsInflightResponse() {
        CompletableFuture<FetchOutcome> pending = nav.selectRoot("transactions");

        nav.resetOnContextChange();
        fetcher.last().future().complete(TXN_ROWS);

        assertThat(nav.state()).isEqualTo(NavigationState.IDLE);
        assertThat(pending).isCompletedWithValue(FetchOutcome.STALE);
        assertThat(nav.currentLevel()).isEmpty();
        assertThat(listener.events).containsExactly("reset");
    }

    @Test
    void maxDepthStopsDrilling() {
        NavigationController limited = new NavigationController(fetcher, listener, NestableFunctions::canDrillDown, 2);
        limited.selectRoot("transactions");
        fetcher.last().future().complete(TXN_ROWS);
        limited.drillInto(TXN_ROWS.get(0), "TransactionId");
        fetcher.last().future().complete(List.of(row("State", "running")));

        assertThat(limited.currentLevel().orElseThrow().schema().hasNavigableColumn()).isFalse();
    }

    @Test
    void renderSpecClickDrills() {
        browseTransactions();
        ColumnDescriptor link = nav.currentRenderSpec().clickableColumn().orElseThrow();

        link.click(TXN_ROWS.get(1));

        assertThat(nav.depth()).isEqualTo(2);
        assertThat(fetcher.last().nestedPath()).isEqualTo("5002");
    }

    @Test
    void rowsAreCopiedOnApply() {
        nav.selectRoot("dbs");
        List<Map<String, Object>> rows = new ArrayList<>();
        Map<String, Object> r = row("DbId", "10");
        rows.add(r);
        fetcher.last().future().complete(rows);

        r.put("DbId", "changed");

        assertThat(nav.currentLevel().orElseThrow().rows().get(0)).containsEntry("DbId", "10");
    }
}
