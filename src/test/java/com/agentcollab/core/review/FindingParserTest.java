package com.agentcollab.core.review;

import com.agentcollab.core.model.Finding;
import com.agentcollab.core.model.FindingConfidence;
import com.agentcollab.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FindingParserTest {

    @Nested
    @DisplayName("candidate lines")
    class Candidates {

        @Test
        @DisplayName("bullets, numbered items and severity lines become findings")
        void recognizedShapes() {
            List<Finding> findings = FindingParser.parse("correctness", """
                    # Lens: correctness

                    - [high] auth.py L10: token not validated
                    * [low] utils.py: duplicated helper
                    1. Missing test for upload.py:42 (medium)
                    Critical: SQL injection in db.py
                    The rest of the change reads well.
                    """);

            assertEquals(4, findings.size());
            assertTrue(findings.stream().allMatch(f -> f.lens().equals("correctness")));
            assertTrue(findings.stream().allMatch(f -> f.findingId() == null));
            assertEquals("Critical: SQL injection in db.py", findings.get(3).issue());
        }

        @Test
        @DisplayName("code fences, headings and short lines are skipped")
        void skipped() {
            List<Finding> findings = FindingParser.parse("security", """
                    ## High level notes
                    ```
                    - [critical] this is sample output inside a fence
                    ```
                    - ok
                    """);

            assertTrue(findings.isEmpty());
        }

        @Test
        @DisplayName("null output parses to nothing")
        void nullText() {
            assertTrue(FindingParser.parse("security", null).isEmpty());
        }
    }

    @Nested
    @DisplayName("fields")
    class Fields {

        @Test
        @DisplayName("extracts the target file and location")
        void target() {
            Finding finding = FindingParser.parse("security", "- [high] auth.py L10: token not validated").get(0);

            assertEquals("auth.py", finding.targetFile());
            assertEquals("L10", finding.targetLocation());
            assertEquals(Severity.MAJOR, finding.severity());
            assertEquals(FindingConfidence.HIGH, finding.confidence());
        }

        @Test
        @DisplayName("collects evidence ids and marks external evidence")
        void evidence() {
            Finding finding = FindingParser.parse("security",
                    "- [medium] MD5 is broken per CVE-2004-2761 and rfc 6151, see https://example.org/md5").get(0);

            assertEquals(List.of("CVE-2004-2761", "RFC6151"), finding.evidenceIds());
            assertTrue(finding.usesExternalEvidence());
        }

        @Test
        @DisplayName("a bare link is external evidence without ids")
        void bareLink() {
            Finding finding = FindingParser.parse("security",
                    "- [medium] session fixation, see https://owasp.org/session").get(0);

            assertTrue(finding.usesExternalEvidence());
            assertTrue(finding.evidenceIds().isEmpty());
        }

        @Test
        @DisplayName("picks up a proposed fix")
        void proposal() {
            Finding finding = FindingParser.parse("maintainability",
                    "- [low] utils.py: duplicated helper. Fix: extract a shared function").get(0);

            assertEquals("extract a shared function", finding.proposedImprovement());
        }

        @Test
        @DisplayName("explicit low confidence is honored when no location is given")
        void lowConfidence() {
            Finding finding = FindingParser.parse("correctness",
                    "- [medium] possible race on the cache, confidence: low").get(0);

            assertEquals(FindingConfidence.LOW, finding.confidence());
            assertEquals("", finding.targetFile());
        }
    }

    @Test
    @DisplayName("severity follows keyword priority")
    void severityPriority() {
        assertEquals(Severity.CRITICAL, FindingParser.detectSeverity("critical and low"));
        assertEquals(Severity.MAJOR, FindingParser.detectSeverity("Major regression"));
        assertEquals(Severity.MAJOR, FindingParser.detectSeverity("highlight the null case"));
        assertEquals(Severity.MEDIUM, FindingParser.detectSeverity("warning: unchecked cast"));
        assertEquals(Severity.LOW, FindingParser.detectSeverity("info only"));
        assertEquals(Severity.MINOR, FindingParser.detectSeverity("naming could be clearer"));
    }

    @Test
    @DisplayName("issue keys ignore severity and confidence labels")
    void issueKey() {
        assertEquals("x py missing null check", FindingParser.issueKey("[medium] x.py: missing null check"));
        assertEquals("x py missing null check",
                FindingParser.issueKey("[CRITICAL] x.py:  missing null-check (confidence: high)"));
        assertEquals(FindingParser.issueKey("severity: high - Missing   null check"),
                FindingParser.issueKey("missing null check"));
    }

    @Test
    @DisplayName("a bare leading severity word is part of the issue")
    void issueKeyKeepsBareSeverityWord() {
        assertNotEquals(FindingParser.issueKey("High memory usage in x.py"),
                FindingParser.issueKey("Low memory usage in x.py"));
        assertEquals("high memory usage in x py", FindingParser.issueKey("High memory usage in x.py"));
        assertEquals("memory usage in x py", FindingParser.issueKey("**High**: memory usage in x.py"));
        assertEquals("memory usage in x py", FindingParser.issueKey("(low) memory usage in x.py"));
        assertEquals("memory usage in x py", FindingParser.issueKey("major - memory usage in x.py"));
    }
}
