package com.cred.freestyle.pos.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Authenticates requests from identity headers set by the gateway.
 *
 * - X-User-Id: staff account ID (required for authenticated requests)
 * - X-User-Role: role name, e.g. "Admin", "Staff", "Enterprise Division"
 *   (optional, defaults to STAFF); normalized to ROLE_ADMIN, ROLE_STAFF,
 *   ROLE_ENTERPRISE_DIVISION
 *
 * Token validation happens at the gateway; this service trusts the headers.
 *
 * @author POS Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_ROLE_HEADER = "X-User-Role";
    private static final String DEFAULT_ROLE = "STAFF";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String userId = request.getHeader(USER_ID_HEADER);

        if (userId != null && !userId.isBlank()) {
            String authority = toAuthority(request.getHeader(USER_ROLE_HEADER));

            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    userId.trim(), null, List.of(new SimpleGrantedAuthority(authority)));
            SecurityContextHolder.getContext().setAuthentication(authentication);

            logger.debug("Authenticated user: {} with role: {}", userId, authority);
        } else {
            logger.debug("No {} header found, request will be unauthenticated", USER_ID_HEADER);
        }

        filterChain.doFilter(request, response);
    }

    /**
     * Map a role header value to a Spring Security authority.
     *
     * @param role Raw header value, may be null
     * @return Authority name with ROLE_ prefix
     */
    static String toAuthority(String role) {
        String normalized = (role == null || role.isBlank())
                ? DEFAULT_ROLE
                : role.trim().toUpperCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        return normalized.startsWith("ROLE_") ? normalized : "ROLE_" + normalized;
    }
}
