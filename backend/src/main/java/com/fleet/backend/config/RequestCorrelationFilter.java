package com.fleet.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with a request id and a correlation id, taken from the
 * caller's headers when present. Lookups by asset also carry the asset id in
 * the MDC so the request log line and any store failure can be traced to it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_ASSET_ID = "assetId";

    private static final String ASSET_ID_PARAM = "asset_id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = headerOrNewId(request, REQUEST_ID_HEADER);
        // a caller without its own correlation id starts a new trace at this request
        String correlationId = headerOrDefault(request, CORRELATION_ID_HEADER, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_CORRELATION_ID, correlationId);
        String assetId = request.getParameter(ASSET_ID_PARAM);
        if (assetId != null && !assetId.isBlank()) {
            MDC.put(MDC_ASSET_ID, assetId);
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_CORRELATION_ID);
            MDC.remove(MDC_ASSET_ID);
        }
    }

    private static String headerOrNewId(HttpServletRequest request, String header) {
        return headerOrDefault(request, header, UUID.randomUUID().toString());
    }

    private static String headerOrDefault(HttpServletRequest request, String header, String fallback) {
        String value = request.getHeader(header);
        return (value == null || value.isBlank()) ? fallback : value.trim();
    }
}
