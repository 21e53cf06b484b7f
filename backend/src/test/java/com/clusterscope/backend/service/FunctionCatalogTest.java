package com.clusterscope.backend.service;

import com.clusterscope.backend.domain.FunctionCategory;
import com.clusterscope.backend.domain.FunctionDescriptor;
import com.clusterscope.backend.domain.FunctionOrder;
import com.clusterscope.backend.domain.FunctionRef;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FunctionCatalogTest {

    private static FunctionDescriptor user(long id, String name, String category, int categoryOrder,
                                           int displayOrder, boolean favorited) {
        Instant now = Instant.parse("2026-01-01T00:00:00Z");
        return new FunctionDescriptor(id, name, "desc", category, "SELECT 1",
                favorited, false, categoryOrder, displayOrder, 1L, null, now, now);
    }

    @Test
    void builtinsGroupInDefinitionOrder() {
        FunctionCatalog catalog = FunctionCatalog.load(SystemFunctions.all(), List.of());

        assertThat(catalog.categories()).extracting(FunctionCategory::name)
                .containsExactlyElementsOf(SystemFunctions.categories());
        assertThat(catalog.functions()).hasSize(24);
    }

    @Test
    void compactListIsCapped() {
        FunctionCatalog catalog = FunctionCatalog.load(SystemFunctions.all(), List.of());
        FunctionCategory storage = catalog.category(SystemFunctions.STORAGE).orElseThrow();

        assertThat(storage.allFunctions()).hasSize(5);
        assertThat(storage.functions()).hasSize(FunctionCatalog.COMPACT_LIMIT);
        assertThat(storage.functions().get(0).name()).isEqualTo("compactions");
    }

    @Test
    void favoritesComeFirstAndPullTheirCategoryUp() {
        FunctionDescriptor fav = user(7, "slow_queries", "Custom", 9, 0, true);
        FunctionDescriptor plain = user(8, "big_tables", "Custom", 9, 1, false);

        FunctionCatalog catalog = FunctionCatalog.load(SystemFunctions.all(), List.of(plain, fav));

        assertThat(catalog.functions().get(0).name()).isEqualTo("slow_queries");
        assertThat(catalog.categories().get(0).name()).isEqualTo("Custom");
        assertThat(catalog.categories().get(0).allFunctions())
                .extracting(FunctionDescriptor::name)
                .containsExactly("slow_queries", "big_tables");
    }

    @Test
    void displayOrderSortsWithinCategory() {
        FunctionCatalog catalog = FunctionCatalog.load(List.of(), List.of(
                user(1, "b", "Custom", 0, 2, false),
                user(2, "a", "Custom", 0, 1, false)));

        assertThat(catalog.functions()).extracting(FunctionDescriptor::name).containsExactly("a", "b");
    }

    @Test
    void findByRef() {
        FunctionCatalog catalog = FunctionCatalog.load(SystemFunctions.all(), List.of(user(3, "x", "Custom", 9, 0, false)));

        assertThat(catalog.find(FunctionRef.builtin("dbs"))).isPresent();
        assertThat(catalog.find(FunctionRef.user(3))).map(FunctionDescriptor::name).contains("x");
        assertThat(catalog.find(FunctionRef.user(99))).isEmpty();
    }

    @Test
    void moveCategoryRenumbersEverything() {
        FunctionCatalog catalog = FunctionCatalog.load(SystemFunctions.all(), List.of());

        List<FunctionOrder> orders = catalog.moveCategory(0, 2);

        assertThat(orders).hasSize(24);
        assertThat(orders).filteredOn(o -> "backends".equals(o.name()))
                .singleElement()
                .satisfies(o -> {
                    assertThat(o.categoryOrder()).isEqualTo(2);
                    assertThat(o.displayOrder()).isZero();
                });
        assertThat(orders).filteredOn(o -> "dbs".equals(o.name()))
                .singleElement()
                .extracting(FunctionOrder::categoryOrder)
                .isEqualTo(0);
    }

    @Test
    void moveFunctionWithinCategory() {
        FunctionCatalog catalog = FunctionCatalog.load(SystemFunctions.all(), List.of());

        List<FunctionOrder> orders = catalog.moveFunction(SystemFunctions.DATABASES, 3, 0);

        assertThat(orders).filteredOn(o -> o.categoryOrder() == 1)
                .extracting(FunctionOrder::name)
                .containsExactly("partitions", "dbs", "tables", "tablet_schema");
    }

    @Test
    void moveRejectsBadInput() {
        FunctionCatalog catalog = FunctionCatalog.load(SystemFunctions.all(), List.of());

        assertThatThrownBy(() -> catalog.moveCategory(0, 99)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> catalog.moveFunction(SystemFunctions.JOBS, -1, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> catalog.moveFunction("Nope", 0, 0)).isInstanceOf(NoSuchElementException.class);
    }
}
