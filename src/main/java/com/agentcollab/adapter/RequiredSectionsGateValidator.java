package com.agentcollab.adapter;

import com.agentcollab.config.CollabProperties;
import com.agentcollab.core.model.GateResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Default gate: the artifact must be non-blank, must not declare a scope violation and must
 * contain every heading configured for its role under {@code agentcollab.gate.required-sections}.
 */
@Component
public class RequiredSectionsGateValidator implements GateValidator {

    private final CollabProperties properties;

    public RequiredSectionsGateValidator(CollabProperties properties) {
        this.properties = properties;
    }

    @Override
    public GateResult validate(String artifact, String role) {
        if (artifact == null || artifact.isBlank()) {
            return GateResult.contractViolation(List.of("artifact is empty"));
        }

        String lower = artifact.toLowerCase(Locale.ROOT);
        for (String marker : properties.getGate().getScopeViolationMarkers()) {
            if (lower.contains(marker.toLowerCase(Locale.ROOT))) {
                return GateResult.scopeViolation(List.of("artifact reports: " + marker));
            }
        }

        List<String> missing = new ArrayList<>();
        for (String heading : properties.getGate().getRequiredSections().getOrDefault(role, List.of())) {
            if (!containsHeading(artifact, heading)) {
                missing.add("missing required section: " + heading);
            }
        }
        return missing.isEmpty() ? GateResult.pass() : GateResult.contractViolation(missing);
    }

    private static boolean containsHeading(String artifact, String heading) {
        String wanted = heading.strip().toLowerCase(Locale.ROOT);
        return artifact.lines()
                .map(line -> line.strip().toLowerCase(Locale.ROOT))
                .anyMatch(wanted::equals);
    }
}
