package com.clusterscope.backend.navigation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NavigationFrameTest {

    @Test
    void childJoinsSegmentsWithSlash() {
        NavigationFrame f = NavigationFrame.root("transactions").child("5001").child("running");

        assertThat(f.nestedPath()).isEqualTo("5001/running");
        assertThat(f.procPath()).isEqualTo("/transactions/5001/running");
        assertThat(f.breadcrumb()).containsExactly("transactions", "5001", "running");
    }

    @Test
    void rootHasNoNestedPath() {
        NavigationFrame f = NavigationFrame.root("backends");

        assertThat(f.isRoot()).isTrue();
        assertThat(f.procPath()).isEqualTo("/backends");
        assertThat(f.breadcrumb()).containsExactly("backends");
    }

    @Test
    void nestableFunctionsAllowList() {
        assertThat(NestableFunctions.canDrillDown("dbs")).isTrue();
        assertThat(NestableFunctions.canDrillDown("backends")).isFalse();
        assertThat(NestableFunctions.canDrillDown(null)).isFalse();
        assertThat(NestableFunctions.NAMES).hasSize(17);
    }
}
