package com.deepansh.trader.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.TimeValue;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * One pooled Apache HttpClient shared by every outbound RestClient
 * (oracle, DexScreener, RugCheck, TweetScout, Jupiter, Solana RPC).
 *
 * Nothing in the cycle wraps the oracle or RPC calls in a deadline, so these
 * per-call timeouts are the only bound on how long a cycle can block on I/O.
 *
 * The builder is a singleton: consumers must clone() it before setting a base URL.
 */
@Configuration
@Slf4j
public class HttpClientConfig {

    @Value("${http.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${http.response-timeout-ms:30000}")
    private long responseTimeoutMs;

    @Value("${http.max-connections:50}")
    private int maxConnections;

    @Value("${http.idle-eviction-seconds:30}")
    private long idleEvictionSeconds;

    @Bean
    public RestClient.Builder restClientBuilder() {
        ConnectionConfig connectionConfig = ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(connectTimeoutMs))
                .setSocketTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
                .build();

        // Data sources are hit in bursts per cycle, then sit idle for minutes
        CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setMaxConnTotal(maxConnections)
                        .setMaxConnPerRoute(Math.max(2, maxConnections / 5))
                        .setDefaultConnectionConfig(connectionConfig)
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(responseTimeoutMs))
                        .build())
                .evictIdleConnections(TimeValue.ofSeconds(idleEvictionSeconds))
                .setUserAgent("solana-trading-agent")
                .build();

        log.info("Outbound HTTP pool ready [connectTimeout={}ms, responseTimeout={}ms, maxConnections={}, idleEviction={}s]",
                connectTimeoutMs, responseTimeoutMs, maxConnections, idleEvictionSeconds);

        return RestClient.builder()
                .requestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    }
}
