package com.clusterscope.backend.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestClientCustomizer fetchTimeouts(ConsoleProperties props) {
        return builder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(props.getFetch().getTimeout());
            factory.setReadTimeout(props.getFetch().getTimeout());
            builder.requestFactory(factory);
        };
    }
}
