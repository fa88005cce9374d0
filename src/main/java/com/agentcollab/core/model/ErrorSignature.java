package com.agentcollab.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Cumulative counter for one normalized failure signature across the lifetime of a task.
 *
 * @param errorClass the class the signature was first recorded under
 * @param signature  normalized signature, {@code <class>:sig:<hex>}
 * @param count      number of failures observed with this signature
 * @param firstSeen  first occurrence
 * @param lastSeen   most recent occurrence
 */
public record ErrorSignature(
    ErrorClass errorClass,
    String signature,
    int count,
    Instant firstSeen,
    Instant lastSeen
) implements Serializable {

    public static ErrorSignature first(ErrorClass errorClass, String signature, Instant at) {
        return new ErrorSignature(errorClass, signature, 1, at, at);
    }

    public ErrorSignature recordOccurrence(Instant at) {
        return new ErrorSignature(errorClass, signature, count + 1, firstSeen, at);
    }
}
