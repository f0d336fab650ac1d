package com.lorekeeper.frontend.cli;

import com.lorekeeper.core.health.HealthCheckService;
import com.lorekeeper.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: lorekeeper health [--component storage|inference|search]
 * <p>
 * Exits 1 when any reported component is DOWN. A DEGRADED component (open disputes,
 * search disabled) still exits 0 so scripts can keep running on reduced capability.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check storage, inference and search")
@Component
public class HealthCommand implements Callable<Integer> {

    static final int EXIT_DOWN = 1;
    static final int EXIT_UNAVAILABLE = 2;

    @Option(names = {"--component", "-c"}, description = "Only report this component (storage, inference, search)")
    private String component;

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return EXIT_UNAVAILABLE;
        }

        List<HealthStatus> checks = healthCheckService.checkAll().stream()
                .filter(check -> component == null || check.component().equalsIgnoreCase(component))
                .toList();
        if (checks.isEmpty()) {
            ConsoleOutput.error("Unknown component: " + component);
            return EXIT_UNAVAILABLE;
        }

        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.info(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            check.metadata().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> System.out.println("    " + e.getKey() + " = " + e.getValue()));
        }

        List<String> down = named(checks, HealthStatus.Status.DOWN);
        List<String> degraded = named(checks, HealthStatus.Status.DEGRADED);

        System.out.println(ConsoleOutput.RULE);
        if (down.isEmpty() && degraded.isEmpty()) {
            ConsoleOutput.success("Overall: all components operational");
            return 0;
        }
        if (!down.isEmpty()) {
            ConsoleOutput.error("Overall: down " + down + (degraded.isEmpty() ? "" : ", degraded " + degraded));
            return EXIT_DOWN;
        }
        ConsoleOutput.info("Overall: degraded " + degraded);
        return 0;
    }

    private static List<String> named(List<HealthStatus> checks, HealthStatus.Status status) {
        return checks.stream().filter(c -> c.status() == status).map(HealthStatus::component).toList();
    }
}
