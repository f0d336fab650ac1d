package com.lorekeeper.core.curator;

import com.lorekeeper.core.error.IllegalStatusTransitionException;
import com.lorekeeper.core.memory.MemoryLayers;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.CanonEntry;
import com.lorekeeper.core.model.CanonWrite;
import com.lorekeeper.core.model.DisputeRecord;
import com.lorekeeper.core.model.DisputeResolution;
import com.lorekeeper.core.model.DisputeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Operator-driven closing of open disputes.
 * <p>
 * Accepting the incoming claim is a conditional Canon write against the version the dispute
 * was raised on. If Canon has moved since, the write fails with
 * {@link com.lorekeeper.core.error.CanonVersionConflictException} and the dispute stays open.
 */
@Service
public class DisputeResolver {

    private static final Logger log = LoggerFactory.getLogger(DisputeResolver.class);

    private final MemoryLayers layers;

    public DisputeResolver(MemoryLayers layers) {
        this.layers = layers;
    }

    public DisputeRecord resolve(String disputeId, DisputeResolution.Outcome outcome, String resolvedBy, String note) {
        var lookup = AgentHandle.system(resolvedBy, AgentRole.CURATOR, "operator");
        DisputeRecord dispute = layers.dispute(disputeId, lookup)
                .orElseThrow(() -> new IllegalStatusTransitionException("Unknown dispute " + disputeId));
        if (dispute.status() != DisputeStatus.OPEN) {
            throw new IllegalStatusTransitionException("Dispute " + disputeId + " is already resolved");
        }
        var operator = AgentHandle.system(resolvedBy, AgentRole.CURATOR, dispute.taskId());

        Long installedVersion = null;
        if (outcome == DisputeResolution.Outcome.ACCEPTED_INCOMING) {
            CanonEntry installed = layers.writeCanon(new CanonWrite(dispute.canonKey(), dispute.incomingClaim(),
                    dispute.incomingConfidence(), dispute.existingCanonVersion(),
                    List.of(dispute.bufferEntryId())), operator);
            installedVersion = installed.version();
        }

        var resolution = new DisputeResolution(outcome, resolvedBy, note == null ? "" : note,
                installedVersion, Instant.now());
        DisputeRecord resolved = layers.markDisputeResolved(disputeId, resolution, operator);
        log.info("Dispute {} resolved by {}: {}{}", disputeId, resolvedBy, outcome,
                installedVersion == null ? "" : " (canon '" + dispute.canonKey() + "' v" + installedVersion + ")");
        return resolved;
    }
}
