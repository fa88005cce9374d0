package com.agentcollab.core.review;

import com.agentcollab.core.model.Finding;
import com.agentcollab.core.model.FindingConfidence;
import com.agentcollab.core.model.Severity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a lens's free-text output into findings. Pure; no I/O.
 * <p>
 * Code fences and {@code #} headings are skipped. A line is a candidate when it is a bullet,
 * a numbered item, or mentions a severity keyword, and is at least {@value #MIN_CANDIDATE_LENGTH}
 * characters long. Severity is inferred by keyword priority: critical, then high/major, then
 * medium/warning, then low/info; anything else is minor.
 */
public final class FindingParser {

    static final int MIN_CANDIDATE_LENGTH = 8;

    private static final Pattern NUMBERED = Pattern.compile("^\\d+\\.\\s+");
    private static final Pattern SEVERITY_WORD = Pattern.compile(
            "\\b(critical|high|major|medium|warning|minor|low|info)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern TARGET_FILE = Pattern.compile(
            "([A-Za-z0-9_./-]+\\.(?:sh|py|md|json|ya?ml|ts|js|tsx|jsx|go|rs|java|kt|rb|php|c|cpp|h))");
    private static final Pattern TARGET_LOCATION = Pattern.compile(
            "((?:L|line)\\s*\\d+|:\\d+(?::\\d+)?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern EVIDENCE_ID = Pattern.compile(
            "\\b(?:CVE-\\d{4}-\\d+|RFC\\s*\\d+|EVID-\\d+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PROPOSAL = Pattern.compile(
            "\\b(?:fix|suggestion|proposed improvement|proposed|recommendation)\\s*:\\s*(.+)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern LABELS = Pattern.compile(
            "\\b(?:severity|confidence)\\s*[:=]\\s*[a-z]+", Pattern.CASE_INSENSITIVE);
    /** Severity label at the start of an issue: {@code [high]}, {@code (high)}, {@code **high**:}, {@code high -}. */
    private static final Pattern LEADING_SEVERITY_LABEL = Pattern.compile(
            "^\\W*(?:\\[\\s*(?:SEV)\\s*]|\\(\\s*(?:SEV)\\s*\\)|(?:SEV)\\**\\s*[:-])\\W*"
                    .replace("SEV", "critical|high|major|medium|warning|minor|low|info"),
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private FindingParser() {}

    public static List<Finding> parse(String lens, String text) {
        List<Finding> findings = new ArrayList<>();
        if (text == null) {
            return findings;
        }
        boolean inCode = false;
        for (String line : text.split("\n")) {
            String stripped = line.strip();
            if (stripped.startsWith("```")) {
                inCode = !inCode;
                continue;
            }
            if (inCode || stripped.isEmpty() || stripped.startsWith("#")) {
                continue;
            }
            String candidate = candidate(stripped);
            if (candidate == null || candidate.length() < MIN_CANDIDATE_LENGTH) {
                continue;
            }
            findings.add(toFinding(lens, candidate));
        }
        return findings;
    }

    static String candidate(String stripped) {
        if (stripped.startsWith("- ") || stripped.startsWith("* ")) {
            return stripped.substring(2).strip();
        }
        Matcher numbered = NUMBERED.matcher(stripped);
        if (numbered.find()) {
            return stripped.substring(numbered.end()).strip();
        }
        if (SEVERITY_WORD.matcher(stripped).find()) {
            return stripped;
        }
        return null;
    }

    static Finding toFinding(String lens, String candidate) {
        String targetFile = firstGroup(TARGET_FILE, candidate);
        String targetLocation = firstGroup(TARGET_LOCATION, candidate).strip();
        List<String> evidenceIds = evidenceIds(candidate);
        String lower = candidate.toLowerCase(Locale.ROOT);
        boolean external = !evidenceIds.isEmpty() || lower.contains("http://") || lower.contains("https://");
        Matcher proposal = PROPOSAL.matcher(candidate);
        return new Finding(
                null,
                lens,
                targetFile,
                targetLocation,
                WHITESPACE.matcher(candidate).replaceAll(" ").strip(),
                detectSeverity(candidate),
                detectConfidence(candidate, !targetFile.isEmpty(), !targetLocation.isEmpty()),
                external,
                evidenceIds,
                proposal.find() ? proposal.group(1).strip() : "");
    }

    /**
     * Keyword priority over substrings of the lower-cased text, so "highlight" counts as high.
     */
    public static Severity detectSeverity(String text) {
        String t = text.toLowerCase(Locale.ROOT);
        if (t.contains("critical")) {
            return Severity.CRITICAL;
        }
        if (t.contains("high") || t.contains("major")) {
            return Severity.MAJOR;
        }
        if (t.contains("medium") || t.contains("warning")) {
            return Severity.MEDIUM;
        }
        if (t.contains("low") || t.contains("info")) {
            return Severity.LOW;
        }
        return Severity.MINOR;
    }

    static FindingConfidence detectConfidence(String text, boolean hasFile, boolean hasLocation) {
        String t = text.toLowerCase(Locale.ROOT);
        if (t.contains("confidence: high") || (hasFile && hasLocation)) {
            return FindingConfidence.HIGH;
        }
        if (t.contains("confidence: low")) {
            return FindingConfidence.LOW;
        }
        return FindingConfidence.MEDIUM;
    }

    /**
     * Dedup key text: lower-cased issue without severity and confidence labels, with every run
     * of non-alphanumerics collapsed to one space. A bare leading severity word is part of the
     * issue ("High memory usage") and is kept.
     */
    public static String issueKey(String issue) {
        String t = issue.toLowerCase(Locale.ROOT);
        t = LABELS.matcher(t).replaceAll(" ");
        t = LEADING_SEVERITY_LABEL.matcher(t).replaceFirst("");
        return NON_ALNUM.matcher(t).replaceAll(" ").strip();
    }

    static List<String> evidenceIds(String text) {
        Set<String> ids = new LinkedHashSet<>();
        Matcher m = EVIDENCE_ID.matcher(text);
        while (m.find()) {
            ids.add(WHITESPACE.matcher(m.group().toUpperCase(Locale.ROOT)).replaceAll(""));
        }
        return List.copyOf(ids);
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1) : "";
    }
}
