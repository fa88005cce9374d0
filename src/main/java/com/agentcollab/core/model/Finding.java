package com.agentcollab.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A structured issue extracted from a lens's free-text output.
 *
 * @param findingId            sequential id assigned at merge time ({@code F001}, ...), null before merge
 * @param lens                 lens that reported the finding
 * @param targetFile           referenced file, empty when none was found
 * @param targetLocation       line or column reference, empty when none was found
 * @param issue                the issue text
 * @param severity             inferred severity
 * @param confidence           inferred confidence
 * @param usesExternalEvidence whether the finding cites an external link
 * @param evidenceIds          CVE, RFC or evidence identifiers cited by the finding
 * @param proposedImprovement  suggested change, empty when none was given
 */
public record Finding(
    String findingId,
    String lens,
    String targetFile,
    String targetLocation,
    String issue,
    Severity severity,
    FindingConfidence confidence,
    boolean usesExternalEvidence,
    List<String> evidenceIds,
    String proposedImprovement
) implements Serializable {

    public Finding {
        evidenceIds = evidenceIds == null ? List.of() : List.copyOf(evidenceIds);
        targetFile = targetFile == null ? "" : targetFile;
        targetLocation = targetLocation == null ? "" : targetLocation;
        proposedImprovement = proposedImprovement == null ? "" : proposedImprovement;
    }

    public Finding withId(String id) {
        return new Finding(id, lens, targetFile, targetLocation, issue, severity, confidence,
                usesExternalEvidence, evidenceIds, proposedImprovement);
    }
}
