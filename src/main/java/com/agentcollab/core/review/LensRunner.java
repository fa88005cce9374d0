package com.agentcollab.core.review;

import com.agentcollab.core.engine.StageContext;

/**
 * Runs one review lens to completion on the calling thread.
 */
public interface LensRunner {

    /**
     * @param lens    lens name
     * @param round   0 for the parallel review, N for the Nth security re-review
     * @param context phase and base attachments; lens focus is added by the runner
     * @return the lens report; failures are reported as degraded, never thrown
     */
    LensReport run(String lens, int round, StageContext context);
}
