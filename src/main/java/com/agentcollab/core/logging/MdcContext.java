package com.agentcollab.core.logging;

import org.slf4j.MDC;

/**
 * MDC keys used by the log pattern: task, phase, stage, tool and review lens.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setTask(String taskId) {
        MDC.put("taskId", taskId);
    }

    public static void setStage(String phase, String stageId, String tool) {
        MDC.put("phase", phase);
        MDC.put("stage", stageId);
        MDC.put("tool", tool);
    }

    public static void setLens(String phase, String lens) {
        MDC.put("phase", phase);
        MDC.put("lens", lens);
    }

    public static void clearStage() {
        MDC.remove("stage");
        MDC.remove("tool");
    }

    public static void clear() {
        MDC.remove("taskId");
        MDC.remove("phase");
        MDC.remove("lens");
        clearStage();
    }
}
