package com.lorekeeper.core.memory;

import com.lorekeeper.core.access.AccessArbiter;
import com.lorekeeper.core.events.EventBus;
import com.lorekeeper.core.model.AgentHandle;
import com.lorekeeper.core.model.AgentRole;
import com.lorekeeper.core.model.CanonWrite;
import com.lorekeeper.core.persistence.InMemoryMemoryStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CanonSeederTest {

    private InMemoryMemoryStorage storage;
    private MemoryLayers layers;
    private MemoryProperties properties;

    @BeforeEach
    void setUp() {
        storage = new InMemoryMemoryStorage();
        layers = new MemoryLayers(storage, new AccessArbiter(), new EventBus());
        properties = new MemoryProperties();
    }

    @Test
    void seedsIdentityAndRulesIntoEmptyCanon() {
        new CanonSeeder(layers, storage, properties).seed();

        assertEquals(2, storage.currentCanon().size());
        assertEquals(1, storage.currentCanon(CanonSeeder.IDENTITY_KEY).orElseThrow().version());
        assertEquals("system_init", storage.currentCanon(CanonSeeder.RULES_KEY).orElseThrow().lastUpdatedBy());
    }

    @Test
    void seedingTwiceIsHarmless() {
        new CanonSeeder(layers, storage, properties).seed();
        new CanonSeeder(layers, storage, properties).seed();

        assertEquals(1, storage.canonHistory(CanonSeeder.IDENTITY_KEY).size());
    }

    @Test
    void populatedCanonIsLeftAlone() {
        var orchestrator = AgentHandle.root("task-1", AgentRole.ORCHESTRATOR, "x");
        layers.writeCanon(CanonWrite.direct("facts/water", "100C", 1.0), orchestrator);

        new CanonSeeder(layers, storage, properties).seed();

        assertTrue(storage.currentCanon(CanonSeeder.IDENTITY_KEY).isEmpty());
    }

    @Test
    void disabledSeedDoesNothing() {
        properties.setSeedCanon(false);

        new CanonSeeder(layers, storage, properties).seed();

        assertTrue(storage.currentCanon().isEmpty());
    }
}
