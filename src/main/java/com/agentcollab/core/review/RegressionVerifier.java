package com.agentcollab.core.review;

import com.agentcollab.core.engine.StageContext;

/**
 * Checks that the code still passes its acceptance checks after a fix round.
 */
public interface RegressionVerifier {

    /**
     * @return true when verification passed
     */
    boolean verify(int round, StageContext context);
}
