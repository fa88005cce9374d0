package com.agentcollab.core.review;

import com.agentcollab.core.model.SecurityMode;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether the security lens runs.
 */
public final class SecurityTrigger {

    static final List<String> KEYWORDS = List.of(
            "auth", "crypto", "secret", "token", "apikey", "api_key", "permission", "rbac", "acl",
            "session", "password", "passwd", "hash", "hmac", "sign", "eval", "exec", "cors", "csrf",
            "csp", "infra", "firewall", "certificate", "tls", "ssl", "private_key", "ssh_key");

    private SecurityTrigger() {}

    public static boolean enabled(SecurityMode mode, boolean securitySensitive, String... texts) {
        return switch (mode) {
            case OFF -> false;
            case ALWAYS -> true;
            case AUTO -> securitySensitive || matchedKeyword(texts).isPresent();
        };
    }

    /**
     * First keyword found, case-insensitively, in any of the texts.
     */
    public static Optional<String> matchedKeyword(String... texts) {
        for (String text : texts) {
            if (text == null || text.isEmpty()) {
                continue;
            }
            String lower = text.toLowerCase(Locale.ROOT);
            for (String keyword : KEYWORDS) {
                if (lower.contains(keyword)) {
                    return Optional.of(keyword);
                }
            }
        }
        return Optional.empty();
    }
}
