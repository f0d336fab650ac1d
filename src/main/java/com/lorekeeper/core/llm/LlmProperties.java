package com.lorekeeper.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Labels for the configured model. The connection itself is configured under {@code spring.ai.openai}.
 */
@Component
@ConfigurationProperties(prefix = "lorekeeper.llm")
public class LlmProperties {

    private String provider = "openai";
    private String model = "";
    /** Characters of raw model output kept in debug logs when parsing fails. */
    private int rawLogChars = 2000;

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getRawLogChars() {
        return rawLogChars;
    }

    public void setRawLogChars(int rawLogChars) {
        this.rawLogChars = rawLogChars;
    }

    public String describe() {
        return model == null || model.isBlank() ? provider : provider + "/" + model;
    }
}
