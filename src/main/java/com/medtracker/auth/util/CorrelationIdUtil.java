package com.medtracker.auth.util;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.UUID;

/**
 * Utility component for handling correlation IDs across the application.
 */
@Slf4j
@Component
public class CorrelationIdUtil {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    private static final String CORRELATION_ID_ATTRIBUTE = "correlation-id";

    /**
     * Correlation ID from the request header, then the request attributes,
     * else a fresh UUID stored for the rest of the request.
     */
    public String getCorrelationId() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes == null) {
            return UUID.randomUUID().toString();
        }

        if (attributes instanceof ServletRequestAttributes) {
            HttpServletRequest request = ((ServletRequestAttributes) attributes).getRequest();
            String header = request.getHeader(CORRELATION_ID_HEADER);
            if (header != null && !header.isBlank()) {
                return header.trim();
            }
        }

        Object stored = attributes.getAttribute(CORRELATION_ID_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (stored != null) {
            return stored.toString();
        }

        String correlationId = UUID.randomUUID().toString();
        log.debug("Generated new correlation ID: {}", correlationId);
        attributes.setAttribute(CORRELATION_ID_ATTRIBUTE, correlationId, RequestAttributes.SCOPE_REQUEST);
        return correlationId;
    }
}
