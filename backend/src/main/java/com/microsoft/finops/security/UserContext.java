package com.microsoft.finops.security;

/**
 * Thread-local caller context.
 *
 * USAGE:
 * - Set by JwtAuthenticationFilter after token validation
 * - Read by services that record who performed an action (violation approvals)
 * - Cleared after request completion
 *
 * Outside a request (scheduler, local mode without a token) there is no user.
 */
public final class UserContext {

    public static final String SYSTEM_USER = "system";

    private static final ThreadLocal<String> CURRENT_USER = new ThreadLocal<>();

    private UserContext() {
        // Utility class
    }

    public static void setCurrentUser(String userId) {
        CURRENT_USER.set(userId);
    }

    /**
     * Current user, or "system" when no user is bound to the thread.
     */
    public static String getCurrentUserOrSystem() {
        String user = CURRENT_USER.get();
        return user != null ? user : SYSTEM_USER;
    }

    public static void clear() {
        CURRENT_USER.remove();
    }
}
