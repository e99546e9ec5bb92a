package com.example.musiccollection.common.logging;

import java.io.IOException;
import java.util.UUID;
import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every API request with a request id (echoed back and carried in {@code ApiResponse.requestId})
 * and writes one access line per request. Synchronous sync triggers can run for minutes, so requests
 * slower than {@link #SLOW_REQUEST_MS} are logged at warn.
 */
public class AccessLogFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessLogFilter.class);

    public static final String MDC_REQUEST_ID = "requestId";

    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final long SLOW_REQUEST_MS = 3000L;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();
        String requestId = request.getHeader(HEADER_REQUEST_ID);
        if (requestId == null || requestId.trim().isEmpty()) {
            requestId = UUID.randomUUID().toString().replace("-", "");
        }
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            long cost = System.currentTimeMillis() - start;
            if (cost >= SLOW_REQUEST_MS) {
                log.warn("ACCESS_SLOW method={} uri={} status={} costMs={}",
                        request.getMethod(), request.getRequestURI(), response.getStatus(), cost);
            } else {
                log.info("ACCESS method={} uri={} status={} costMs={}",
                        request.getMethod(), request.getRequestURI(), response.getStatus(), cost);
            }
            MDC.remove(MDC_REQUEST_ID);
        }
    }
}
