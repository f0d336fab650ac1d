package com.lorekeeper.core.memory;

import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.CanonWrite;
import com.lorekeeper.core.persistence.MemoryStorage;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Installs the baseline identity and standards entries into an empty Canon.
 */
@Component
public class CanonSeeder {

    private static final Logger log = LoggerFactory.getLogger(CanonSeeder.class);

    static final String IDENTITY_KEY = "identity/system";
    static final String RULES_KEY = "standards/memory_rules";

    private final MemoryLayers layers;
    private final MemoryStorage storage;
    private final MemoryProperties properties;

    public CanonSeeder(MemoryLayers layers, MemoryStorage storage, MemoryProperties properties) {
        this.layers = layers;
        this.storage = storage;
        this.properties = properties;
    }

    @PostConstruct
    public void seed() {
        if (!properties.isSeedCanon()) {
            return;
        }
        if (!storage.currentCanon().isEmpty()) {
            log.debug("Canon already populated, skipping seed");
            return;
        }
        var system = AgentHandle.system("system_init", AgentRole.CURATOR, "bootstrap");
        layers.writeCanon(new CanonWrite(IDENTITY_KEY,
                "This is a layered-memory agent hierarchy. Agents: orchestrator, research (web search), "
                        + "code, data and writing specialists. Dispatch depth is limited.",
                1.0, 0L, List.of()), system);
        layers.writeCanon(new CanonWrite(RULES_KEY,
                "Canon is verified truth, writable only by the orchestrator and the curator. "
                        + "Buffer holds unverified claims and is labelled tentative until promoted. "
                        + "Scratch is private to one agent in one task. Task memory holds the current mission.",
                1.0, 0L, List.of()), system);
        log.info("Seeded Canon with {} and {}", IDENTITY_KEY, RULES_KEY);
    }
}
