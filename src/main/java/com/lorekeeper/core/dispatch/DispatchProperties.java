package com.lorekeeper.core.dispatch;

import com.lorekeeper.core.access.CanonScope;
import com.lorekeeper.core.model.AgentRole;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "lorekeeper.dispatch")
public class DispatchProperties {

    /** Deepest dispatch allowed; the root dispatch is depth 0. */
    private int maxDepth = 3;
    private int childTimeoutSeconds = 300;
    /** Inference rounds one agent may take before its dispatch fails. */
    private int maxToolRounds = 12;
    /** Role label to Canon key prefixes visible to that role. Missing or empty = every key. */
    private Map<String, List<String>> canonScopes = defaultScopes();

    private static Map<String, List<String>> defaultScopes() {
        var scopes = new LinkedHashMap<String, List<String>>();
        scopes.put("research", List.of("identity", "standards", "facts"));
        scopes.put("code", List.of("identity", "standards", "decisions"));
        scopes.put("data", List.of("identity", "standards", "facts"));
        scopes.put("writing", List.of("identity", "standards"));
        return scopes;
    }

    public CanonScope scopeFor(AgentRole role) {
        List<String> prefixes = canonScopes.get(role.label());
        return prefixes == null ? CanonScope.unrestricted() : new CanonScope(prefixes);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getChildTimeoutSeconds() {
        return childTimeoutSeconds;
    }

    public void setChildTimeoutSeconds(int childTimeoutSeconds) {
        this.childTimeoutSeconds = childTimeoutSeconds;
    }

    public int getMaxToolRounds() {
        return maxToolRounds;
    }

    public void setMaxToolRounds(int maxToolRounds) {
        this.maxToolRounds = maxToolRounds;
    }

    public Map<String, List<String>> getCanonScopes() {
        return canonScopes;
    }

    public void setCanonScopes(Map<String, List<String>> canonScopes) {
        this.canonScopes = canonScopes;
    }
}
