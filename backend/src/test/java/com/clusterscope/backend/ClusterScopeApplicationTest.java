package com.clusterscope.backend;

import com.clusterscope.backend.navigation.DataFetcher;
import com.clusterscope.backend.service.ClusterContext;
import com.clusterscope.backend.service.fetch.ShowProcDataFetcher;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ClusterScopeApplicationTest {

    @Autowired
    ClusterContext clusters;

    @Autowired
    DataFetcher fetcher;

    @Test
    void contextLoadsWithConfiguredCluster() {
        assertThat(clusters.requireActive().name()).isEqualTo("test");
        assertThat(fetcher).isInstanceOf(ShowProcDataFetcher.class);
    }
}
