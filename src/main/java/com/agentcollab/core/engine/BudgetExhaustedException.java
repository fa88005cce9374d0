package com.agentcollab.core.engine;

/**
 * The task has used its paid-call budget; no further adapter call may be made.
 */
public class BudgetExhaustedException extends RuntimeException {

    private final String stageId;

    public BudgetExhaustedException(String stageId, int used, int budget) {
        super("Paid call budget exhausted before stage " + stageId + " (" + used + "/" + budget + ")");
        this.stageId = stageId;
    }

    public String getStageId() {
        return stageId;
    }
}
