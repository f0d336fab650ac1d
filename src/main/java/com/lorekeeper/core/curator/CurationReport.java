package com.lorekeeper.core.curator;

import java.util.List;

/**
 * Summary of one curation pass over a task's pending buffer entries.
 *
 * @param taskId                task that was curated
 * @param promoted              buffer entry ids marked PROMOTED
 * @param dismissed             buffer entry ids marked DISMISSED
 * @param disputed              buffer entry ids marked DISPUTED
 * @param leftPending           entries left PENDING because promotion could not complete
 * @param canonVersionsInstalled "key@version" for every Canon version installed
 * @param disputeIds            disputes opened
 */
public record CurationReport(
    String taskId,
    List<String> promoted,
    List<String> dismissed,
    List<String> disputed,
    List<String> leftPending,
    List<String> canonVersionsInstalled,
    List<String> disputeIds
) {

    public CurationReport {
        promoted = List.copyOf(promoted);
        dismissed = List.copyOf(dismissed);
        disputed = List.copyOf(disputed);
        leftPending = List.copyOf(leftPending);
        canonVersionsInstalled = List.copyOf(canonVersionsInstalled);
        disputeIds = List.copyOf(disputeIds);
    }

    public static CurationReport empty(String taskId) {
        return new CurationReport(taskId, List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public int processed() {
        return promoted.size() + dismissed.size() + disputed.size();
    }

    public String summary() {
        return "promoted=" + promoted.size() + " dismissed=" + dismissed.size()
                + " disputed=" + disputed.size() + " pending=" + leftPending.size()
                + " canon=" + canonVersionsInstalled;
    }
}
