package com.solusoft.medclaims.config;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Tags every request with a correlation id kept in the MDC under {@code trace_id},
 * so log lines, error bodies and audit entries of one request can be matched up.
 * <p>
 * A caller may pass its own id in {@code X-Request-ID}. It is only reused when it is a short
 * token of letters, digits and {@code . _ : -}; anything else is replaced by a fresh UUID, since
 * the value ends up in log lines and in a response header.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String MDC_KEY = "trace_id";
    public static final String HEADER_KEY = "X-Request-ID";
    public static final String REQUEST_ATTRIBUTE = RequestIdFilter.class.getName() + ".requestId";

    static final int MAX_LENGTH = 64;
    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:-]{1," + MAX_LENGTH + "}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = resolveRequestId(request.getHeader(HEADER_KEY));
        long started = System.nanoTime();

        MDC.put(MDC_KEY, requestId);
        request.setAttribute(REQUEST_ATTRIBUTE, requestId);
        response.setHeader(HEADER_KEY, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            log.debug("{} {} -> {} in {} ms", request.getMethod(), request.getRequestURI(), response.getStatus(),
                    (System.nanoTime() - started) / 1_000_000);
            // pooled worker threads must not leak the id into the next request
            MDC.remove(MDC_KEY);
        }
    }

    static String resolveRequestId(String supplied) {
        if (supplied != null) {
            String candidate = supplied.trim();
            if (ACCEPTED.matcher(candidate).matches()) {
                return candidate;
            }
            log.debug("Ignoring malformed {} header of length {}", HEADER_KEY, supplied.length());
        }
        return UUID.randomUUID().toString();
    }
}
