package com.agentcollab.core.triage;

import com.agentcollab.core.model.ErrorClass;
import com.agentcollab.core.model.GateOutcome;
import com.agentcollab.core.model.GateResult;
import com.agentcollab.core.model.ToolExitStatus;
import com.agentcollab.core.model.Triage;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Classifies a failed stage attempt.
 * <p>
 * Precedence: gate violation, then the normalized exit status, then stderr keywords, then
 * {@link ErrorClass#UNKNOWN}. Only the first {@value #MAX_STDERR_LINES} stderr lines are inspected.
 */
@Component
public class ErrorClassifier {

    static final int MAX_STDERR_LINES = 100;

    private static final Pattern AUTH = Pattern.compile(
            "401|403|unauthorized|forbidden|invalid.*(token|key|credential)|authentication",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTEXT_SIZE = Pattern.compile(
            "context.*(length|window)|too (large|long|many)|token.*(limit|exceed)|prompt.*too",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NETWORK = Pattern.compile(
            "connection|network|timeout|socket|refused|ECONNRESET|ETIMEDOUT",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MISSING_BINARY = Pattern.compile(
            "not found|command not found|No such file|binary|executable|ENOENT",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SIZE_LIMIT = Pattern.compile(
            "too large|size|50kb|limit", Pattern.CASE_INSENSITIVE);

    /**
     * @param exitStatus normalized exit status of the attempt
     * @param exitCode   raw exit code of the attempt
     * @param stderr     diagnostic stream, nullable
     * @param gate       gate result; {@link GateResult#notRun()} when the tool itself failed
     */
    public Triage classify(ToolExitStatus exitStatus, int exitCode, String stderr, GateResult gate) {
        if (exitStatus == ToolExitStatus.SUCCESS && gate.passed()) {
            throw new IllegalArgumentException("Cannot classify a successful attempt");
        }
        String head = head(stderr);
        ErrorClass errorClass = determineClass(exitStatus, head, gate);

        String signatureSource = head;
        if (gate.violated()) {
            signatureSource = String.join("\n", gate.reasons()) + "\n" + head;
        }
        return new Triage(
                errorClass,
                SignatureNormalizer.signature(errorClass, signatureSource),
                exitCode,
                gate.outcome(),
                errorClass.suggestedActions());
    }

    private ErrorClass determineClass(ToolExitStatus exitStatus, String stderr, GateResult gate) {
        if (gate.outcome() == GateOutcome.SCOPE_VIOLATION) {
            return ErrorClass.SCOPE_VIOLATION;
        }
        if (gate.outcome() == GateOutcome.CONTRACT_VIOLATION) {
            return ErrorClass.CONTRACT_VIOLATION;
        }

        switch (exitStatus) {
            case TIMEOUT:
                return ErrorClass.TRANSIENT;
            case MISSING_BINARY:
                return ErrorClass.TOOLING;
            case MISSING_INPUT:
                return SIZE_LIMIT.matcher(stderr).find() ? ErrorClass.PROMPT_TOO_LARGE : ErrorClass.TOOLING;
            case INPUT_TOO_LARGE:
                return ErrorClass.PROMPT_TOO_LARGE;
            default:
                break;
        }

        if (AUTH.matcher(stderr).find()) {
            return ErrorClass.AUTH;
        }
        if (CONTEXT_SIZE.matcher(stderr).find()) {
            return ErrorClass.PROMPT_TOO_LARGE;
        }
        if (NETWORK.matcher(stderr).find()) {
            return ErrorClass.TRANSIENT;
        }
        if (MISSING_BINARY.matcher(stderr).find()) {
            return ErrorClass.TOOLING;
        }
        return ErrorClass.UNKNOWN;
    }

    private static String head(String stderr) {
        if (stderr == null || stderr.isEmpty()) {
            return "";
        }
        return Arrays.stream(stderr.split("\n", -1))
                .limit(MAX_STDERR_LINES)
                .collect(Collectors.joining("\n"));
    }
}
