package com.lorekeeper.core.session;

import com.lorekeeper.core.curator.CurationReport;
import com.lorekeeper.core.model.DispatchOutcome;

/**
 * What a one-shot {@code run} hands back: the answer, how it was produced and what the curator did with it.
 *
 * @param taskId       task id
 * @param prompt       the original request
 * @param outcome      root dispatch outcome, children included
 * @param curation     curation pass run at close
 * @param dispatches   dispatch tree size, declined requests included
 * @param dispatchTree rendered dispatch tree
 * @param elapsedMs    wall time from open to close
 */
public record TaskReport(
    String taskId,
    String prompt,
    DispatchOutcome outcome,
    CurationReport curation,
    int dispatches,
    String dispatchTree,
    long elapsedMs
) {

    public String response() {
        return outcome.completed() ? outcome.response() : "";
    }

    public boolean succeeded() {
        return outcome.completed();
    }
}
