package com.agentcollab.core.review;

import java.util.List;
import java.util.Map;

/**
 * Focus text and shared constraints appended to a lens's context pack.
 */
public final class LensPrompts {

    public static final String CORRECTNESS = "correctness";
    public static final String SECURITY = "security";
    public static final String MAINTAINABILITY = "maintainability";

    static final List<String> CONSTRAINTS = List.of(
            "Analysis only. Do not apply fixes.",
            "Produce concrete, file-targeted findings.",
            "Include severity and confidence in findings.");

    private static final Map<String, String> FOCUS = Map.of(
            CORRECTNESS, "Focus strictly on correctness and behavioral defects. Prioritize logic errors, "
                    + "incorrect edge-case handling, state transitions, and regressions.",
            SECURITY, "Focus strictly on security risks and unsafe patterns. Prioritize injection vectors, "
                    + "authz/authn gaps, secret exposure, data leaks, and unsafe shell usage.",
            MAINTAINABILITY, "Focus strictly on maintainability and long-term code health. Prioritize clarity, "
                    + "cohesion, duplication, fragile coupling, and testability gaps.");

    private LensPrompts() {}

    /**
     * Lenses in launch and merge order.
     */
    public static List<String> lenses(boolean securityEnabled) {
        return securityEnabled
                ? List.of(CORRECTNESS, SECURITY, MAINTAINABILITY)
                : List.of(CORRECTNESS, MAINTAINABILITY);
    }

    public static String focus(String lens) {
        String focus = FOCUS.get(lens);
        if (focus == null) {
            throw new IllegalArgumentException("Unknown review lens: " + lens);
        }
        return focus;
    }

    public static String constraints() {
        var sb = new StringBuilder();
        for (String constraint : CONSTRAINTS) {
            sb.append("- ").append(constraint).append('\n');
        }
        return sb.toString();
    }

    /**
     * Markdown written in place of a lens's findings when the lens failed without timing out.
     * It parses as a single low-severity finding.
     */
    public static String degradedPlaceholder(String lens, int exitCode) {
        return "# Lens: " + lens + "\n\n"
                + "Status: DEGRADED (exit=" + exitCode + ")\n\n"
                + "- info: lens " + lens + " degraded (exit=" + exitCode + "); findings for this lens are unavailable\n";
    }
}
