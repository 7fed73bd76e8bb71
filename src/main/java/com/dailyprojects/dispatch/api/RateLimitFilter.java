package com.dailyprojects.dispatch.api;

import com.dailyprojects.core.engine.ProjectOrchestrator;
import com.dailyprojects.core.logging.MdcContext;
import com.dailyprojects.core.ratelimit.RateDecision;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Admits or rejects every project API request against the caller's rate window,
 * and tags the request's log lines with the caller key.
 */
@Component
@Order(1)
public class RateLimitFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String PROTECTED_PREFIX = "/api/v1/projects";

    private final ProjectOrchestrator orchestrator;

    public RateLimitFilter(ProjectOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        if (!httpRequest.getRequestURI().startsWith(PROTECTED_PREFIX)) {
            chain.doFilter(request, response);
            return;
        }

        String callerKey = callerKey(httpRequest);
        MdcContext.setCaller(callerKey);
        try {
            RateDecision decision = orchestrator.admitRequest(callerKey);
            if (decision.allowed()) {
                chain.doFilter(request, response);
                return;
            }
            log.info("Rejecting {} {}: rate limit exceeded", httpRequest.getMethod(), httpRequest.getRequestURI());
            httpResponse.setStatus(429);
            httpResponse.setHeader("Retry-After", String.valueOf(decision.retryAfterSeconds()));
            httpResponse.setContentType("application/json");
            httpResponse.getWriter().write("{\"error\":\"Rate limit exceeded. Please try again later.\",\"retry_after\":"
                    + decision.retryAfterSeconds() + "}");
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * The request's remote address. Forwarding headers are not read here; behind
     * a proxy, {@code server.forward-headers-strategy} rewrites the remote
     * address before this filter runs.
     */
    static String callerKey(HttpServletRequest request) {
        String remote = request.getRemoteAddr();
        return remote != null && !remote.isBlank() ? remote : "unknown";
    }
}
