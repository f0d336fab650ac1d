package com.lorekeeper.core.dispatch;

import com.lorekeeper.core.error.DelegationCycleException;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Rejects a delegation that hands an ancestor's own assignment back to the ancestor's role.
 * <p>
 * The ancestor chain is walked through weak parent references; an ancestor that has been
 * collected ends the walk.
 */
@Component
public class DelegationCycleDetector {

    public void check(AgentHandle requester, AgentRole role, String task) {
        String wanted = normalise(task);
        Optional<AgentHandle> cursor = Optional.of(requester);
        while (cursor.isPresent()) {
            AgentHandle ancestor = cursor.get();
            if (ancestor.role() == role && normalise(ancestor.assignment()).equals(wanted)) {
                throw new DelegationCycleException("Delegation of '" + abbreviate(task) + "' to " + role.label()
                        + " repeats the assignment of ancestor " + ancestor.id() + " at depth " + ancestor.depth());
            }
            cursor = ancestor.parent();
        }
    }

    static String normalise(String task) {
        if (task == null) return "";
        return task.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}]+", " ")
                .trim();
    }

    private static String abbreviate(String s) {
        return s.length() <= 60 ? s : s.substring(0, 57) + "...";
    }
}
