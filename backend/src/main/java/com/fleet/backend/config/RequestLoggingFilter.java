package com.fleet.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * One access line per telemetry API call. Server-side failures (5xx, which
 * includes an unreachable store) are logged at WARN so they stand out from
 * regular ingest and lookup traffic.
 */
@Component
@Slf4j
@Order(Ordered.LOWEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            int status = response.getStatus();
            String assetId = MDC.get(RequestCorrelationFilter.MDC_ASSET_ID);
            if (status >= 500) {
                log.warn("{} {} asset={} -> {} ({} ms)", request.getMethod(), request.getRequestURI(),
                        assetId == null ? "-" : assetId, status, durationMs);
            } else {
                log.info("{} {} asset={} -> {} ({} ms)", request.getMethod(), request.getRequestURI(),
                        assetId == null ? "-" : assetId, status, durationMs);
            }
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri.startsWith("/actuator") || uri.startsWith("/swagger-ui") || uri.startsWith("/v3/api-docs");
    }
}
