package com.di.sqlpulse.config;

import com.di.sqlpulse.util.MdcPropagation;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Request context for the monitoring API. Every log line of a request carries:
 * <ul>
 *   <li>{@code requestId}: the caller's {@code X-Request-Id} when it is a plain token, otherwise a
 *       generated one; echoed back in the response header</li>
 *   <li>{@code requestPath}: request URI, reported by GlobalExceptionHandler</li>
 *   <li>{@code connectionId}: the {@code connectionId} query parameter, when present, so history and
 *       collection calls log under the monitored connection they touch</li>
 * </ul>
 * Cleared in {@code finally} so pooled threads do not leak it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcRequestFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID = "requestId";
    public static final String REQUEST_PATH = "requestPath";
    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String CONNECTION_PARAM = "connectionId";

    private static final Pattern SAFE_TOKEN = Pattern.compile("^[A-Za-z0-9._:-]{1,64}$");

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = requestIdOf(request.getHeader(REQUEST_ID_HEADER));
        String path = request.getRequestURI();
        String connectionId = request.getParameter(CONNECTION_PARAM);
        MDC.put(REQUEST_ID, requestId);
        MDC.put(REQUEST_PATH, path != null ? path : "");
        boolean tagged = connectionId != null && SAFE_TOKEN.matcher(connectionId.trim()).matches();
        if (tagged) {
            MDC.put(MdcPropagation.CONNECTION_ID, connectionId.trim());
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID);
            MDC.remove(REQUEST_PATH);
            if (tagged) {
                MDC.remove(MdcPropagation.CONNECTION_ID);
            }
        }
    }

    /** Keeps a caller-supplied id only when it cannot break a log line. */
    static String requestIdOf(String header) {
        if (header != null && SAFE_TOKEN.matcher(header.trim()).matches()) {
            return header.trim();
        }
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
