package com.grouptab.expense.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;
import java.util.UUID;

/**
 * Logs every group API request with its duration. Puts the correlation id, the calling member
 * and the addressed group into the MDC for the duration of the request.
 */
@Slf4j
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String MEMBER_ID_HEADER = "X-Member-Id";
    public static final String TRACE_ID = "traceId";
    public static final String MEMBER_ID = "memberId";
    public static final String GROUP_ID = "groupId";
    private static final String START_TIME = "startTime";
    private static final long SLOW_REQUEST_MILLIS = 5000;

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        MDC.put(TRACE_ID, correlationId);
        putIfPresent(MEMBER_ID, request.getHeader(MEMBER_ID_HEADER));
        putIfPresent(GROUP_ID, pathVariable(request, GROUP_ID));
        request.setAttribute(START_TIME, System.currentTimeMillis());
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        log.info("Incoming request: {} {} from member {}", request.getMethod(), request.getRequestURI(),
                MDC.get(MEMBER_ID));
        return true;
    }

    @Override
    public void afterCompletion(@NonNull HttpServletRequest request,
                                @NonNull HttpServletResponse response,
                                @NonNull Object handler,
                                Exception ex) {
        Object startTime = request.getAttribute(START_TIME);

        if (startTime instanceof Long started) {
            long duration = System.currentTimeMillis() - started;
            String method = request.getMethod();
            String uri = request.getRequestURI();
            int status = response.getStatus();

            if (status >= 500) {
                log.error("Request completed: {} {} - Status: {} - Duration: {}ms", method, uri, status, duration);
            } else if (status >= 400) {
                log.warn("Request completed: {} {} - Status: {} - Duration: {}ms", method, uri, status, duration);
            } else {
                log.info("Request completed: {} {} - Status: {} - Duration: {}ms", method, uri, status, duration);
            }

            if (duration > SLOW_REQUEST_MILLIS) {
                log.warn("SLOW REQUEST DETECTED: {} {} took {}ms", method, uri, duration);
            }
        }

        MDC.remove(TRACE_ID);
        MDC.remove(MEMBER_ID);
        MDC.remove(GROUP_ID);
    }

    private static String pathVariable(HttpServletRequest request, String name) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map<?, ?> map) {
            Object value = map.get(name);
            return value != null ? value.toString() : null;
        }
        return null;
    }

    private static void putIfPresent(String key, String value) {
        if (value != null && !value.isBlank()) {
            MDC.put(key, value);
        }
    }
}
