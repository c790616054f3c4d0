package com.cred.freestyle.pos.security;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Helpers for reading the acting user from the security context.
 *
 * @author POS Team
 */
public final class SecurityUtils {

    private static final String SYSTEM_ACTOR = "system";

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID from authentication context, or null if not authenticated
     */
    public static String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.isAuthenticated()
                && !(authentication instanceof AnonymousAuthenticationToken)
                && authentication.getPrincipal() instanceof String) {
            return (String) authentication.getPrincipal();
        }
        return null;
    }

    /**
     * Name to record as the actor of an order change.
     *
     * @return Current user ID, or "system" outside a request
     */
    public static String currentActor() {
        String userId = getCurrentUserId();
        return userId != null ? userId : SYSTEM_ACTOR;
    }
}
