package com.example.audiobooksync.common.logging;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

public class AccessLogFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessLogFilter.class);

    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final Pattern JOB_URI = Pattern.compile("/jobs/(\\d+)");

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

        MDC.put(JobMdc.REQUEST_ID, requestId);
        Matcher jobMatcher = JOB_URI.matcher(request.getRequestURI());
        boolean jobScoped = jobMatcher.find();
        if (jobScoped) {
            MDC.put(JobMdc.JOB_ID, jobMatcher.group(1));
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            long cost = System.currentTimeMillis() - start;
            log.info("ACCESS method={} uri={} status={} costMs={} ip={}",
                    request.getMethod(), request.getRequestURI(), response.getStatus(), cost, request.getRemoteAddr());
            MDC.remove(JobMdc.REQUEST_ID);
            if (jobScoped) {
                MDC.remove(JobMdc.JOB_ID);
            }
        }
    }
}
