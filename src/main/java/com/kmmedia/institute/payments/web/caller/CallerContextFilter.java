package com.kmmedia.institute.payments.web.caller;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Turns the identity headers set by the upstream auth gateway into a {@link Caller} request
 * attribute. Requests without a usable identity get no attribute; endpoints that need one answer
 * 401.
 */
@Slf4j
@Component
public class CallerContextFilter extends OncePerRequestFilter {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String userId = request.getHeader(USER_ID_HEADER);
        String rawRole = request.getHeader(USER_ROLE_HEADER);
        if (userId != null && !userId.isBlank()) {
            CallerRole role = CallerRole.parse(rawRole);
            if (role != null) {
                request.setAttribute(Caller.ATTRIBUTE, new Caller(userId.trim(), role));
            } else {
                log.debug("Ignoring identity with unknown role. userId={} role={}", userId, rawRole);
            }
        }
        filterChain.doFilter(request, response);
    }
}
