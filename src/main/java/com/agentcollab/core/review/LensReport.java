package com.agentcollab.core.review;

/**
 * What a lens produced.
 *
 * @param lens     lens name
 * @param stageId  stage that ran the lens
 * @param status   completed or degraded
 * @param output   findings markdown, the degraded placeholder when the lens failed
 * @param exitCode exit code of the lens tool, -1 when the tool was not reached
 */
public record LensReport(String lens, String stageId, LensStatus status, String output, int exitCode) {

    public static LensReport completed(String lens, String stageId, String output) {
        return new LensReport(lens, stageId, LensStatus.COMPLETED, output == null ? "" : output, 0);
    }

    public static LensReport degraded(String lens, String stageId, int exitCode) {
        return new LensReport(lens, stageId, LensStatus.DEGRADED,
                LensPrompts.degradedPlaceholder(lens, exitCode), exitCode);
    }

    public boolean isDegraded() {
        return status == LensStatus.DEGRADED;
    }
}
