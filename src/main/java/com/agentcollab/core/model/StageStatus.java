package com.agentcollab.core.model;

import java.util.Locale;

public enum StageStatus {
    DONE,
    /** The done-marker already existed; nothing was invoked. */
    SKIPPED_DONE,
    FAILED;

    public boolean isSuccess() {
        return this != FAILED;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
