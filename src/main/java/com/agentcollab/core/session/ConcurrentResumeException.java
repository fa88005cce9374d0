package com.agentcollab.core.session;

/**
 * A second caller tried to use the session of a (phase, tool) pair while another call held it.
 */
public class ConcurrentResumeException extends RuntimeException {

    public ConcurrentResumeException(String phase, String tool, String holder, String requester) {
        super("Session for phase=" + phase + ", tool=" + tool + " is in use by stage " + holder
                + "; concurrent use by stage " + requester + " is not allowed");
    }
}
