package com.company.failover.config;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP clients: a pooled client for the traffic control plane and a plain
 * short-timeout client for region health probes
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class HttpClientConfig {

    private final MeterRegistry meterRegistry;

    @Value("${failover.traffic.http.connect-timeout-ms:5000}")
    private int controlPlaneConnectTimeoutMs;

    @Value("${failover.traffic.http.read-timeout-ms:10000}")
    private int controlPlaneReadTimeoutMs;

    @Value("${failover.traffic.http.max-connections:20}")
    private int maxConnections;

    @Value("${failover.health.timeout-ms:5000}")
    private int probeTimeoutMs;

    @Bean
    @Primary
    public RestTemplate controlPlaneRestTemplate(RestTemplateBuilder builder) {
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setMaxConnTotal(maxConnections)
                .setMaxConnPerRoute(maxConnections)
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofMilliseconds(controlPlaneConnectTimeoutMs))
                        .build())
                .build();

        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectionRequestTimeout(Timeout.ofMilliseconds(controlPlaneConnectTimeoutMs))
                .setResponseTimeout(Timeout.ofMilliseconds(controlPlaneReadTimeoutMs))
                .build();

        HttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .build();

        HttpComponentsClientHttpRequestFactory requestFactory = new HttpComponentsClientHttpRequestFactory(httpClient);

        RestTemplate restTemplate = builder
                .requestFactory(() -> requestFactory)
                .additionalInterceptors(metricsInterceptor())
                .build();

        log.info("Control plane RestTemplate configured: connect timeout {}ms, read timeout {}ms, max connections {}",
                controlPlaneConnectTimeoutMs, controlPlaneReadTimeoutMs, maxConnections);

        return restTemplate;
    }

    /**
     * No pooling and no retries: each probe is one bounded attempt
     */
    @Bean
    public RestTemplate probeRestTemplate() {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(probeTimeoutMs);
        requestFactory.setReadTimeout(probeTimeoutMs);
        return new RestTemplate(requestFactory);
    }

    private ClientHttpRequestInterceptor metricsInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            String host = request.getURI().getHost();

            try {
                ClientHttpResponse response = execution.execute(request, body);

                meterRegistry.counter("traffic.controlplane.requests",
                        "method", request.getMethod().name(),
                        "host", host,
                        "status", String.valueOf(response.getStatusCode().value())
                ).increment();
                meterRegistry.timer("traffic.controlplane.duration", "method", request.getMethod().name())
                        .record(Duration.ofMillis(System.currentTimeMillis() - startTime));

                return response;

            } catch (Exception e) {
                meterRegistry.counter("traffic.controlplane.errors",
                        "method", request.getMethod().name(),
                        "host", host,
                        "exception", e.getClass().getSimpleName()
                ).increment();
                throw e;
            }
        };
    }
}
