package com.cra.policy;

import java.util.Collection;

/**
 * Action id patterns used by atlas policies: an exact id, {@code *},
 * {@code prefix.*} or {@code *.suffix}.
 */
public final class ActionPatterns {

    private ActionPatterns() {
    }

    public static boolean matches(String pattern, String actionId) {
        if (pattern == null || actionId == null) {
            return false;
        }
        if ("*".equals(pattern)) {
            return true;
        }
        if (pattern.endsWith(".*")) {
            return actionId.startsWith(pattern.substring(0, pattern.length() - 1));
        }
        if (pattern.startsWith("*.")) {
            return actionId.endsWith(pattern.substring(1));
        }
        return pattern.equals(actionId);
    }

    public static boolean matchesAny(Collection<String> patterns, String actionId) {
        return patterns.stream().anyMatch(p -> matches(p, actionId));
    }
}
