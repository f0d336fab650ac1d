package com.lorekeeper.core.access;

import com.lorekeeper.core.error.PermissionDeniedException;
import com.lorekeeper.core.model.AgentRole;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Table-driven permission policy over (layer, operation, role).
 * <p>
 * Every memory-layer operation consults {@link #check} before touching storage.
 * Scratch ownership is enforced separately by the scratch layer; this table only
 * decides which roles may use Scratch at all.
 */
@Service
public class AccessArbiter {

    private final Map<Layer, Map<Operation, Set<AgentRole>>> table;

    public AccessArbiter() {
        this(defaultTable());
    }

    AccessArbiter(Map<Layer, Map<Operation, Set<AgentRole>>> table) {
        this.table = table;
    }

    public AccessDecision permit(Operation operation, Layer layer, AgentRole role) {
        if (operation == null || layer == null || role == null) {
            return AccessDecision.DENY;
        }
        var verbs = table.get(layer);
        if (verbs == null) {
            return AccessDecision.DENY;
        }
        var roles = verbs.get(operation);
        return roles != null && roles.contains(role) ? AccessDecision.ALLOW : AccessDecision.DENY;
    }

    /**
     * @throws PermissionDeniedException when the table denies the operation
     */
    public void check(Operation operation, Layer layer, AgentRole role) {
        if (permit(operation, layer, role) == AccessDecision.DENY) {
            throw new PermissionDeniedException(role + " may not " + operation + " " + layer);
        }
    }

    static Map<Layer, Map<Operation, Set<AgentRole>>> defaultTable() {
        Set<AgentRole> all = EnumSet.allOf(AgentRole.class);
        Set<AgentRole> participants = EnumSet.complementOf(EnumSet.of(AgentRole.CURATOR));

        var table = new EnumMap<Layer, Map<Operation, Set<AgentRole>>>(Layer.class);
        table.put(Layer.CANON, verbs(
                all,
                EnumSet.of(AgentRole.ORCHESTRATOR, AgentRole.CURATOR),
                EnumSet.noneOf(AgentRole.class)));
        table.put(Layer.BUFFER, verbs(
                all,
                all,
                EnumSet.of(AgentRole.CURATOR)));
        table.put(Layer.SCRATCH, verbs(
                participants,
                participants,
                EnumSet.noneOf(AgentRole.class)));
        table.put(Layer.TASK_MEMORY, verbs(
                all,
                participants,
                EnumSet.noneOf(AgentRole.class)));
        table.put(Layer.DISPUTE, verbs(
                all,
                EnumSet.of(AgentRole.CURATOR),
                EnumSet.of(AgentRole.CURATOR, AgentRole.ORCHESTRATOR)));
        return table;
    }

    private static Map<Operation, Set<AgentRole>> verbs(Set<AgentRole> read, Set<AgentRole> write,
                                                        Set<AgentRole> update) {
        var verbs = new EnumMap<Operation, Set<AgentRole>>(Operation.class);
        verbs.put(Operation.READ, Set.copyOf(read));
        verbs.put(Operation.WRITE, Set.copyOf(write));
        verbs.put(Operation.UPDATE, Set.copyOf(update));
        return verbs;
    }
}
