package com.williamcallahan.photo_mosaic_engine;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Set;

@Component
public class RequestLoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    // Endpoints slow enough that their timings matter
    private static final Set<String> TIMED_PATHS = Set.of("/generate", "/cached");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest req = (HttpServletRequest) request;
        String uri = req.getRequestURI();
        if (!TIMED_PATHS.contains(uri)) {
            chain.doFilter(request, response);
            return;
        }
        long startTime = System.currentTimeMillis();
        logger.info("Incoming request: {} {} from {}", req.getMethod(), uri, req.getRemoteAddr());
        try {
            chain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            int status = response instanceof HttpServletResponse ? ((HttpServletResponse) response).getStatus() : 0;
            logger.info("Completed request: {} {} with status {} in {} ms", req.getMethod(), uri, status, duration);
        }
    }
}
