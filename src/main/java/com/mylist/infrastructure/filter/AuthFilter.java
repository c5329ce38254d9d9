package com.mylist.infrastructure.filter;

import com.mylist.domain.model.UserId;
import com.mylist.infrastructure.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Stand-in for authentication: the caller is whoever the {@code x-user-id} header names.
 * List endpoints are rejected without a valid header; every other path passes through.
 */
@Component
@Order(1)
public class AuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);

    public static final String USER_ID_HEADER = "x-user-id";
    private static final String REQUEST_ID_HEADER = "X-Request-Id";
    private static final String PROTECTED_PATH = "/my-list";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String path = request.getRequestURI();
        String requestId = getOrGenerateRequestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        if (!isProtectedPath(path)) {
            RequestContext.bind(requestId);
            try {
                filterChain.doFilter(request, response);
            } finally {
                RequestContext.clear();
            }
            return;
        }

        var userIdResult = UserId.parse(request.getHeader(USER_ID_HEADER));
        if (userIdResult.isFailure()) {
            var error = userIdResult.errorOrNull();
            log.warn("Rejected {} {}: {}", request.getMethod(), path, error.message());
            response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
            response.setContentType("application/json");
            response.getWriter().write(
                "{\"error\":\"" + error.code() + "\",\"message\":\"" + escape(error.message()) + "\",\"requestId\":\"" + escape(requestId) + "\"}"
            );
            return;
        }

        UserId userId = userIdResult.getOrThrow();
        RequestContext.bind(requestId, userId);
        log.debug("Request identified: userId={}, requestId={}, path={}", userId, requestId, path);

        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    private boolean isProtectedPath(String path) {
        return path.equals(PROTECTED_PATH) || path.startsWith(PROTECTED_PATH + "/");
    }

    private String getOrGenerateRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        return requestId;
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
