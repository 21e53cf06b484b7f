package com.clusterscope.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

// data sources are built per cluster by JdbcStoredQueryExecutor
@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
@ConfigurationPropertiesScan
@EnableScheduling
public class ClusterScopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClusterScopeApplication.class, args);
    }
}
