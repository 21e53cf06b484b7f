package com.clusterscope.backend.navigation;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaInferenceEngineTest {

    private static Map<String, Object> row(String... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put(kv[i], kv[i + 1]);
        return m;
    }

    @Test
    void emptyBatchHasNoColumns() {
        assertThat(SchemaInferenceEngine.infer(List.of(), true)).isEqualTo(SchemaInference.EMPTY);
        assertThat(SchemaInferenceEngine.infer(null, true).columns()).isEmpty();
    }

    @Test
    void columnsFollowFirstRowKeyOrder() {
        SchemaInference s = SchemaInferenceEngine.infer(List.of(
                row("Label", "a", "TransactionId", "1", "Status", "RUNNING"),
                row("Other", "x")), true);

        assertThat(s.columns()).containsExactly("Label", "TransactionId", "Status");
    }

    @Test
    void firstColumnContainingIdIsNavigable() {
        SchemaInference s = SchemaInferenceEngine.infer(List.of(
                row("Label", "a", "TransactionId", "1", "DbId", "9")), true);

        assertThat(s.navigableColumn()).isEqualTo("TransactionId");
        assertThat(s.columnSpecs()).filteredOn(ColumnSpec::navigable)
                .extracting(ColumnSpec::key)
                .containsExactly("TransactionId");
    }

    @Test
    void idMatchIsCaseInsensitiveAndSubstring() {
        assertThat(SchemaInferenceEngine.navigableColumn(List.of("Name", "GUIDE"), true)).isEqualTo("GUIDE");
    }

    @Test
    void fallsBackToFirstColumnWithoutIdColumn() {
        SchemaInference s = SchemaInferenceEngine.infer(List.of(row("Name", "db1", "Quota", "1G")), true);
        assertThat(s.navigableColumn()).isEqualTo("Name");
    }

    @Test
    void nothingNavigableWhenDrillNotAllowed() {
        SchemaInference s = SchemaInferenceEngine.infer(List.of(row("BackendId", "10001")), false);

        assertThat(s.hasNavigableColumn()).isFalse();
        assertThat(s.columnSpecs()).noneMatch(ColumnSpec::navigable);
    }

    @Test
    void depthLimitDisablesDrill() {
        SchemaInference s = SchemaInferenceEngine.infer(List.of(row("JobId", "1")), true, false);
        assertThat(s.navigableColumn()).isNull();
    }
}
