package com.xbleey.signalalert.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
    private static final int MAX_BODY_LENGTH = 1024;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        ContentCachingRequestWrapper wrappedRequest = wrapRequest(request);
        String method = wrappedRequest.getMethod();
        String path = wrappedRequest.getRequestURI();
        String query = Optional.ofNullable(wrappedRequest.getQueryString()).orElse("-");
        boolean healthCheck = isHealthCheck(path);
        long startNanos = System.nanoTime();

        if (healthCheck) {
            log.debug("Request start: method={} path={}", method, path);
        } else {
            log.info("Request start: method={} path={} query={}", method, path, query);
        }
        try {
            filterChain.doFilter(wrappedRequest, response);
        } finally {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            if (healthCheck) {
                log.debug("Request end: method={} path={} status={} durationMs={}",
                        method, path, response.getStatus(), durationMs);
            } else {
                log.info("Request end: method={} path={} status={} durationMs={} body={}",
                        method, path, response.getStatus(), durationMs, resolveBody(wrappedRequest));
            }
        }
    }

    static boolean isHealthCheck(String path) {
        return path != null && path.startsWith("/health");
    }

    private static ContentCachingRequestWrapper wrapRequest(HttpServletRequest request) {
        if (request instanceof ContentCachingRequestWrapper wrapped) {
            return wrapped;
        }
        return new ContentCachingRequestWrapper(request, MAX_BODY_LENGTH);
    }

    private static String resolveBody(ContentCachingRequestWrapper request) {
        String contentType = request.getContentType();
        if (contentType == null || !contentType.startsWith(MediaType.APPLICATION_JSON_VALUE)) {
            return "-";
        }
        byte[] content = request.getContentAsByteArray();
        if (content.length == 0) {
            return "-";
        }
        int length = Math.min(content.length, MAX_BODY_LENGTH);
        String payload = new String(content, 0, length, StandardCharsets.UTF_8).replaceAll("\\s+", " ").trim();
        if (content.length > MAX_BODY_LENGTH) {
            payload = payload + "...(" + content.length + " bytes)";
        }
        return payload.isEmpty() ? "-" : payload;
    }
}
