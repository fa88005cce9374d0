package com.agentcollab.core.session;

/**
 * A resumed call did not continue the phase baseline. Never retried: the pipeline stops and
 * the recovery document describes the manual steps.
 */
public class SessionMismatchException extends RuntimeException {

    private final String phase;
    private final String tool;
    private final String stage;
    private final String expectedSessionId;
    private final String actualSessionId;

    public SessionMismatchException(String phase, String tool, String stage,
                                    String expectedSessionId, String actualSessionId, String reason) {
        super(reason + " (phase=" + phase + ", tool=" + tool + ", stage=" + stage
                + ", expected=" + expectedSessionId + ", actual=" + actualSessionId + ")");
        this.phase = phase;
        this.tool = tool;
        this.stage = stage;
        this.expectedSessionId = expectedSessionId;
        this.actualSessionId = actualSessionId;
    }

    public String getPhase() { return phase; }
    public String getTool() { return tool; }
    public String getStage() { return stage; }
    public String getExpectedSessionId() { return expectedSessionId; }
    public String getActualSessionId() { return actualSessionId; }
}
