package com.edgeviewer.edgeviewer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Logs each viewer request with its status and duration when {@code logging.request.enabled} is set.
 */
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingInterceptor.class);
    private static final String START_ATTRIBUTE = RequestLoggingInterceptor.class.getName() + ".start";

    private final boolean enabled;

    public RequestLoggingInterceptor(boolean enabled) {
        this.enabled = enabled;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (enabled) {
            request.setAttribute(START_ATTRIBUTE, System.nanoTime());
        }
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        if (!enabled) {
            return;
        }

        Object start = request.getAttribute(START_ATTRIBUTE);
        long elapsedMs = start instanceof Long ? (System.nanoTime() - (Long) start) / 1_000_000L : -1;
        String handlerInfo = (handler instanceof HandlerMethod) ? ((HandlerMethod) handler).getShortLogMessage() : String.valueOf(handler);

        logger.info("Request - method={}, uri={}, status={}, durationMs={}, handler={}, remoteAddr={}",
                request.getMethod(), request.getRequestURI(), response.getStatus(), elapsedMs, handlerInfo,
                request.getRemoteAddr());
    }
}
