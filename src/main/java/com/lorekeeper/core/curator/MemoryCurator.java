package com.lorekeeper.core.curator;

import com.lorekeeper.core.access.CanonScope;
import com.lorekeeper.core.error.CanonVersionConflictException;
import com.lorekeeper.core.error.IllegalStatusTransitionException;
import com.lorekeeper.core.error.StorageFailureException;
import com.lorekeeper.core.events.EventBus;
import com.lorekeeper.core.events.LoreEvent;
import com.lorekeeper.core.memory.MemoryLayers;
import com.lorekeeper.core.metrics.LoreMetrics;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.BufferEntry;
import com.lorekeeper.core.model.BufferStatus;
import com.lorekeeper.core.model.CanonEntry;
import com.lorekeeper.core.model.CanonWrite;
import com.lorekeeper.core.model.DisputeRecord;
import com.lorekeeper.core.model.DisputeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Promotes corroborated buffer claims into Canon once a task session closes.
 * <p>
 * Pending entries for the task are grouped by Canon key and clustered by agreement. Each
 * cluster is scored by its members' confidence plus a corroboration boost per distinct agent.
 * Low scorers are dismissed. A surviving cluster installs a single Canon version when Canon is
 * absent or agrees with it, and opens one dispute per member when Canon disagrees.
 * <p>
 * Re-running over the same buffer is idempotent: a cluster whose ids are already listed as
 * sources of the current Canon version is marked promoted without another install.
 */
@Service
public class MemoryCurator {

    private static final Logger log = LoggerFactory.getLogger(MemoryCurator.class);

    private final MemoryLayers layers;
    private final AgreementPolicy agreement;
    private final CuratorProperties properties;
    private final EventBus eventBus;
    private final LoreMetrics metrics;

    public MemoryCurator(MemoryLayers layers, AgreementPolicy agreement, CuratorProperties properties,
                         EventBus eventBus, LoreMetrics metrics) {
        this.layers = layers;
        this.agreement = agreement;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Runs one curation pass over the task's PENDING buffer entries.
     */
    public CurationReport curate(String taskId) {
        var curator = AgentHandle.system("curator", AgentRole.CURATOR, taskId);
        List<BufferEntry> pending = layers.readBuffer(taskId, BufferStatus.PENDING, curator).entries();
        if (pending.isEmpty()) {
            log.info("Curator: no pending buffer entries for task {}", taskId);
            return CurationReport.empty(taskId);
        }
        log.info("Curator: reviewing {} pending entries for task {}", pending.size(), taskId);

        var pass = new Pass(taskId, curator, pending);
        Map<String, List<BufferEntry>> byKey = pending.stream()
                .collect(Collectors.groupingBy(BufferEntry::canonKey, LinkedHashMap::new, Collectors.toList()));
        for (var group : byKey.entrySet()) {
            curateKey(group.getKey(), group.getValue(), pass);
        }

        var report = pass.report();
        metrics.recordCuration("promoted", report.promoted().size());
        metrics.recordCuration("dismissed", report.dismissed().size());
        metrics.recordCuration("disputed", report.disputed().size());
        metrics.recordCuration("pending", report.leftPending().size());
        eventBus.publish(LoreEvent.of(LoreEvent.CURATION_COMPLETED, taskId, curator.id(), Map.of(
                "promoted", report.promoted().size(),
                "dismissed", report.dismissed().size(),
                "disputed", report.disputed().size(),
                "pending", report.leftPending().size())));
        log.info("Curator: task {} {}", taskId, report.summary());
        return report;
    }

    private void curateKey(String key, List<BufferEntry> entries, Pass pass) {
        List<Cluster> clusters = cluster(entries);
        for (Cluster c : clusters) {
            c.score(properties.getCorroborationBoost());
        }
        clusters.sort(Comparator.comparingDouble(Cluster::bestScore).reversed());

        for (Cluster c : clusters) {
            List<BufferEntry> survivors = new ArrayList<>();
            for (BufferEntry e : c.members) {
                if (c.scores.get(e.id()) < properties.getConfidenceFloor()) {
                    mark(e, BufferStatus.DISMISSED, pass, pass.dismissed);
                } else {
                    survivors.add(e);
                }
            }
            if (!survivors.isEmpty()) {
                promoteOrDispute(key, c, survivors, pass);
            }
        }
    }

    private void promoteOrDispute(String key, Cluster cluster, List<BufferEntry> survivors, Pass pass) {
        BufferEntry representative = survivors.stream()
                .max(Comparator.comparingDouble(e -> cluster.scores.get(e.id())))
                .orElseThrow();
        double score = cluster.scores.get(representative.id());
        List<String> ids = survivors.stream().map(BufferEntry::id).toList();

        try {
            for (int attempt = 1; attempt <= properties.getMaxPromotionAttempts(); attempt++) {
                CanonEntry current = layers.readCanonSlice(Set.of(key), pass.curator, CanonScope.unrestricted())
                        .get(key);

                if (current != null && ids.stream().anyMatch(current::promotedFrom)) {
                    log.debug("Canon '{}' v{} already holds cluster {}", key, current.version(), ids);
                    markAll(survivors, BufferStatus.PROMOTED, pass, pass.promoted);
                    return;
                }

                if (current != null && agreement.disagreement(current.value(), representative.claim())
                        > properties.getAgreementTolerance()) {
                    openDisputes(current, survivors, pass);
                    return;
                }

                long observed = current == null ? 0L : current.version();
                try {
                    CanonEntry installed = layers.writeCanon(
                            new CanonWrite(key, representative.claim(), Math.min(1.0, score), observed, ids),
                            pass.curator);
                    pass.installed.add(installed.key() + "@" + installed.version());
                    markAll(survivors, BufferStatus.PROMOTED, pass, pass.promoted);
                    return;
                } catch (CanonVersionConflictException e) {
                    metrics.recordCanonRetry();
                    log.info("Curator: {} (attempt {}/{}), re-checking", e.getMessage(), attempt,
                            properties.getMaxPromotionAttempts());
                }
            }
            log.warn("Curator: giving up on '{}' after {} conflicting attempts", key,
                    properties.getMaxPromotionAttempts());
        } catch (StorageFailureException e) {
            log.warn("Curator: storage failure promoting '{}', leaving unmarked ids of {} pending: {}",
                    key, ids, e.getMessage());
        }
    }

    private void openDisputes(CanonEntry current, List<BufferEntry> survivors, Pass pass) {
        Set<String> alreadyDisputed = layers.readDisputes(DisputeStatus.OPEN, pass.curator).stream()
                .map(DisputeRecord::bufferEntryId)
                .collect(Collectors.toSet());
        for (BufferEntry e : survivors) {
            if (alreadyDisputed.contains(e.id())) {
                // a previous pass opened it but failed before marking the entry
                log.info("Curator: {} already has an open dispute, marking it", e.id());
                mark(e, BufferStatus.DISPUTED, pass, pass.disputed);
                continue;
            }
            double disagreement = agreement.disagreement(current.value(), e.claim());
            var record = new DisputeRecord("dsp-" + UUID.randomUUID().toString().substring(0, 8),
                    pass.taskId, e.id(), current.key(), e.claim(), e.confidence(),
                    current.version(), current.value(), disagreement, Instant.now(),
                    DisputeStatus.OPEN, null);
            layers.openDispute(record, pass.curator);
            pass.disputeIds.add(record.id());
            mark(e, BufferStatus.DISPUTED, pass, pass.disputed);
        }
    }

    private void markAll(List<BufferEntry> entries, BufferStatus status, Pass pass, List<String> sink) {
        for (BufferEntry e : entries) {
            mark(e, status, pass, sink);
        }
    }

    private void mark(BufferEntry entry, BufferStatus status, Pass pass, List<String> sink) {
        try {
            layers.transitionBuffer(entry.id(), status, pass.curator);
            sink.add(entry.id());
        } catch (IllegalStatusTransitionException | StorageFailureException e) {
            log.warn("Curator: could not mark {} as {}: {}", entry.id(), status, e.getMessage());
        }
    }

    /**
     * Single-link clustering against each cluster's first member, in append order.
     */
    List<Cluster> cluster(List<BufferEntry> entries) {
        List<Cluster> clusters = new ArrayList<>();
        for (BufferEntry e : entries) {
            Cluster home = null;
            for (Cluster c : clusters) {
                if (agreement.disagreement(c.members.get(0).claim(), e.claim())
                        <= properties.getAgreementTolerance()) {
                    home = c;
                    break;
                }
            }
            if (home == null) {
                home = new Cluster();
                clusters.add(home);
            }
            home.members.add(e);
        }
        return clusters;
    }

    static final class Cluster {
        final List<BufferEntry> members = new ArrayList<>();
        final Map<String, Double> scores = new HashMap<>();

        void score(double boost) {
            long agents = members.stream().map(BufferEntry::agentId).distinct().count();
            for (BufferEntry e : members) {
                scores.put(e.id(), Math.min(1.0, e.confidence() + boost * (agents - 1)));
            }
        }

        double bestScore() {
            return scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        }
    }

    private static final class Pass {
        final String taskId;
        final AgentHandle curator;
        final List<String> promoted = new ArrayList<>();
        final List<String> dismissed = new ArrayList<>();
        final List<String> disputed = new ArrayList<>();
        final List<String> installed = new ArrayList<>();
        final List<String> disputeIds = new ArrayList<>();

        private final List<BufferEntry> pending;

        Pass(String taskId, AgentHandle curator, List<BufferEntry> pending) {
            this.taskId = taskId;
            this.curator = curator;
            this.pending = pending;
        }

        // whatever this pass did not move out of PENDING, each id once
        CurationReport report() {
            Set<String> moved = new HashSet<>(promoted);
            moved.addAll(dismissed);
            moved.addAll(disputed);
            List<String> leftPending = pending.stream()
                    .map(BufferEntry::id)
                    .filter(id -> !moved.contains(id))
                    .toList();
            return new CurationReport(taskId, promoted, dismissed, disputed, leftPending, installed, disputeIds);
        }
    }
}
