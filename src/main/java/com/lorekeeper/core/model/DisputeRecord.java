package com.lorekeeper.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A recorded conflict between a buffer claim and the Canon version it was checked against.
 *
 * @param id                   dispute id
 * @param taskId               task whose curation raised it
 * @param bufferEntryId        the disputed buffer entry
 * @param canonKey             key in conflict
 * @param incomingClaim        claim from the buffer entry
 * @param incomingConfidence   confidence of the incoming claim
 * @param existingCanonVersion canon version the claim conflicted with
 * @param existingCanonValue   value of that version
 * @param disagreement         measured disagreement in [0,1]
 * @param createdAt            creation time
 * @param status               OPEN until resolved
 * @param resolution           present once RESOLVED
 */
public record DisputeRecord(
    String id,
    String taskId,
    String bufferEntryId,
    String canonKey,
    String incomingClaim,
    double incomingConfidence,
    long existingCanonVersion,
    String existingCanonValue,
    double disagreement,
    Instant createdAt,
    DisputeStatus status,
    DisputeResolution resolution
) implements Serializable {

    public DisputeRecord resolve(DisputeResolution resolution) {
        return new DisputeRecord(id, taskId, bufferEntryId, canonKey, incomingClaim, incomingConfidence,
                existingCanonVersion, existingCanonValue, disagreement, createdAt,
                DisputeStatus.RESOLVED, resolution);
    }
}
