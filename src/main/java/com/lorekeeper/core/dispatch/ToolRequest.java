package com.lorekeeper.core.dispatch;

import java.util.HashMap;
import java.util.Map;

/**
 * One tool invocation requested by a model turn.
 *
 * @param tool      declared tool name, e.g. {@code research_agent}
 * @param arguments string-valued arguments keyed by parameter name
 */
public record ToolRequest(String tool, Map<String, String> arguments) {

    public ToolRequest {
        arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }

    public static ToolRequest of(String tool, String... keyValues) {
        var args = new HashMap<String, String>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            args.put(keyValues[i], keyValues[i + 1]);
        }
        return new ToolRequest(tool, args);
    }

    public String arg(String name) {
        String value = arguments.get(name);
        return value == null ? "" : value.trim();
    }

    public double doubleArg(String name, double fallback) {
        String value = arg(name);
        if (value.isEmpty()) return fallback;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
