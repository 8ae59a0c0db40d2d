package com.policywatch.ingest.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class HttpClientConfig {

    /**
     * Shared client for listing, detail and document fetches. Connections are pooled per host by
     * the client itself; read timeouts are set per request.
     */
    @Bean
    public HttpClient fetchHttpClient(IngesterProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getHttp().getConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    /** Used only for LLM polish calls */
    @Bean
    public RestTemplate polishRestTemplate(RestTemplateBuilder builder, IngesterProperties properties) {
        Duration timeout = Duration.ofMillis(properties.getPolish().getTimeoutMs());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
