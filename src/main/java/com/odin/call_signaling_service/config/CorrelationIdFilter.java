package com.odin.call_signaling_service.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import com.odin.call_signaling_service.constants.ApplicationConstants;
import com.odin.call_signaling_service.utility.CorrelationIdUtil;

/**
 * Binds the caller's correlation id (or a fresh one) to the request thread and
 * echoes it back, then logs the request outcome.
 */
@Slf4j
@Component
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String correlationId = request.getHeader(ApplicationConstants.CORRELATION_ID_HEADER);
        if (!StringUtils.hasText(correlationId)) {
            correlationId = CorrelationIdUtil.generateCorrelationId();
        }
        CorrelationIdUtil.setCorrelationId(correlationId);
        response.setHeader(ApplicationConstants.CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            log.info("{} {} {}", response.getStatus(), request.getMethod(), request.getRequestURI());
            CorrelationIdUtil.clear();
        }
    }
}
