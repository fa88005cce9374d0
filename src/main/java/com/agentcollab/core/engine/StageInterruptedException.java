package com.agentcollab.core.engine;

/**
 * A stage's tool call was interrupted, typically by the review join-barrier watchdog.
 * The thread's interrupt flag is restored before this is thrown.
 */
public class StageInterruptedException extends RuntimeException {

    public StageInterruptedException(String stageId, InterruptedException cause) {
        super("Stage " + stageId + " was interrupted", cause);
    }
}
