package com.company.failover.service;

import com.company.failover.domain.enums.ProbeErrorType;
import com.company.failover.domain.enums.SubsystemStatus;
import com.company.failover.util.EndpointCheckResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

/**
 * Single bounded GET against a region health endpoint.
 * Failures are classified into {@link ProbeErrorType} and returned, never thrown.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HealthEndpointClient {

    static final String USER_AGENT = "Cloudify-HealthCheck/1.0";

    @Qualifier("probeRestTemplate")
    private final RestTemplate probeRestTemplate;

    public EndpointCheckResult check(String url) {
        long start = System.currentTimeMillis();

        try {
            probeRestTemplate.execute(url, HttpMethod.GET,
                    request -> request.getHeaders().set(HttpHeaders.USER_AGENT, USER_AGENT),
                    response -> null);

            return EndpointCheckResult.ok(System.currentTimeMillis() - start);

        } catch (RestClientResponseException e) {
            return EndpointCheckResult.failed(SubsystemStatus.ERROR, elapsed(start),
                    "HTTP " + e.getStatusCode().value(), ProbeErrorType.HTTP);

        } catch (RestClientException | IllegalArgumentException e) {
            EndpointCheckResult result = classify(e, elapsed(start));
            log.debug("Health endpoint {} failed: {} ({})", url, result.getError(), result.getErrorType().code());
            return result;
        }
    }

    private EndpointCheckResult classify(Exception e, long latencyMs) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException) {
                return EndpointCheckResult.failed(SubsystemStatus.TIMEOUT, latencyMs,
                        "Request timeout", ProbeErrorType.TIMEOUT);
            }
            if (cause instanceof ConnectException) {
                return EndpointCheckResult.failed(SubsystemStatus.ERROR, latencyMs,
                        "Connection refused", ProbeErrorType.CONNECTION);
            }
            if (cause instanceof UnknownHostException) {
                return EndpointCheckResult.failed(SubsystemStatus.ERROR, latencyMs,
                        "DNS resolution failed", ProbeErrorType.DNS);
            }
            if (cause instanceof SSLException) {
                return EndpointCheckResult.failed(SubsystemStatus.ERROR, latencyMs,
                        "SSL certificate error", ProbeErrorType.SSL);
            }
        }

        String message = e.getMessage() != null ? e.getMessage() : "Unknown error";
        return EndpointCheckResult.failed(SubsystemStatus.ERROR, latencyMs, message, ProbeErrorType.UNKNOWN);
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }
}
