package com.lorekeeper.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * How an open dispute was closed.
 *
 * @param outcome               which side won
 * @param resolvedBy            operator or agent id
 * @param note                  free-text rationale
 * @param resultingCanonVersion canon version installed when the incoming claim was accepted, else {@code null}
 * @param resolvedAt            resolution time
 */
public record DisputeResolution(
    Outcome outcome,
    String resolvedBy,
    String note,
    Long resultingCanonVersion,
    Instant resolvedAt
) implements Serializable {

    public enum Outcome {
        ACCEPTED_INCOMING,
        KEPT_CANON
    }
}
