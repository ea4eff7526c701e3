package com.air.dispatch.cli;

import com.air.core.health.HealthCheckService;
import com.air.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: air health
 * <p>
 * Exit code 0 when git, the results directory and the work tree pool are all up,
 * 1 otherwise.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check git, results path and work trees")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String line = describe(check);
            if (check.status() == HealthStatus.Status.UP) {
                ConsoleOutput.success(line);
            } else if (check.status() == HealthStatus.Status.DEGRADED) {
                ConsoleOutput.info(line);
            } else {
                ConsoleOutput.error(line);
            }
        }

        boolean healthy = checks.stream().allMatch(c -> c.status() == HealthStatus.Status.UP);
        System.out.println("──────────────────────────────────");
        if (healthy) {
            ConsoleOutput.success("Overall: ready to review");
            return 0;
        }
        ConsoleOutput.error("Overall: one or more components degraded or down");
        return 1;
    }

    private static String describe(HealthStatus check) {
        String line = check.component() + ": " + check.detail();
        if (check.metadata() == null || check.metadata().isEmpty()) {
            return line;
        }
        return line + check.metadata().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .sorted()
                .collect(Collectors.joining(", ", " (", ")"));
    }
}
