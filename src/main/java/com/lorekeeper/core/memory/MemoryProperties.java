package com.lorekeeper.core.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "lorekeeper.memory")
public class MemoryProperties {

    /** Pending buffer entries shown in an agent's context. */
    private int contextBufferLimit = 8;
    /** Own scratch notes shown in an agent's context. */
    private int contextScratchLimit = 5;
    /** Canon entries shown in an agent's context. */
    private int contextCanonLimit = 10;
    /** Characters kept per value when rendering context. */
    private int contextValueChars = 300;
    /** Seed identity and standards entries into an empty Canon at startup. */
    private boolean seedCanon = true;

    public int getContextBufferLimit() {
        return contextBufferLimit;
    }

    public void setContextBufferLimit(int contextBufferLimit) {
        this.contextBufferLimit = contextBufferLimit;
    }

    public int getContextScratchLimit() {
        return contextScratchLimit;
    }

    public void setContextScratchLimit(int contextScratchLimit) {
        this.contextScratchLimit = contextScratchLimit;
    }

    public int getContextCanonLimit() {
        return contextCanonLimit;
    }

    public void setContextCanonLimit(int contextCanonLimit) {
        this.contextCanonLimit = contextCanonLimit;
    }

    public int getContextValueChars() {
        return contextValueChars;
    }

    public void setContextValueChars(int contextValueChars) {
        this.contextValueChars = contextValueChars;
    }

    public boolean isSeedCanon() {
        return seedCanon;
    }

    public void setSeedCanon(boolean seedCanon) {
        this.seedCanon = seedCanon;
    }
}
