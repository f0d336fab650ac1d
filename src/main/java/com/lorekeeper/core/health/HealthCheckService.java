package com.lorekeeper.core.health;

import com.lorekeeper.core.dispatch.InferenceClient;
import com.lorekeeper.core.error.LorekeeperException;
import com.lorekeeper.core.model.DisputeStatus;
import com.lorekeeper.core.persistence.MemoryStorage;
import com.lorekeeper.core.search.SearchProperties;
import com.lorekeeper.core.search.WebSearchClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final MemoryStorage storage;
    private final InferenceClient inference;
    private final WebSearchClient search;
    private final SearchProperties searchProperties;

    public HealthCheckService(MemoryStorage storage,
                              @Autowired(required = false) InferenceClient inference,
                              @Autowired(required = false) WebSearchClient search,
                              SearchProperties searchProperties) {
        this.storage = storage;
        this.inference = inference;
        this.search = search;
        this.searchProperties = searchProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStorage());
        results.add(checkInference());
        results.add(checkSearch());
        return results;
    }

    HealthStatus checkStorage() {
        try {
            int canon = storage.currentCanon().size();
            long openDisputes = storage.disputes().stream().filter(d -> d.status() == DisputeStatus.OPEN).count();
            var metadata = Map.of("canonKeys", String.valueOf(canon), "openDisputes", String.valueOf(openDisputes));
            if (openDisputes > 0) {
                return new HealthStatus("storage", HealthStatus.Status.DEGRADED,
                        storage.describe() + ", " + openDisputes + " dispute(s) awaiting resolution", metadata);
            }
            return new HealthStatus("storage", HealthStatus.Status.UP, storage.describe(), metadata);
        } catch (LorekeeperException e) {
            log.warn("Storage health check failed: {}", e.getMessage());
            return new HealthStatus("storage", HealthStatus.Status.DOWN,
                    "Storage error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkInference() {
        if (inference == null) {
            return new HealthStatus("inference", HealthStatus.Status.DOWN,
                    "No InferenceClient configured", Map.of());
        }
        return new HealthStatus("inference", HealthStatus.Status.UP,
                "Inference client available (" + inference.describe() + ")", Map.of());
    }

    HealthStatus checkSearch() {
        if (search == null) {
            return new HealthStatus("search", HealthStatus.Status.DOWN, "No WebSearchClient configured", Map.of());
        }
        if (!search.isEnabled()) {
            return new HealthStatus("search", HealthStatus.Status.DEGRADED, "Web search disabled", Map.of());
        }
        return new HealthStatus("search", HealthStatus.Status.UP,
                "Web search via " + searchProperties.getBaseUrl(), Map.of());
    }
}
