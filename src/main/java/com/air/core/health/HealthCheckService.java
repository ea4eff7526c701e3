package com.air.core.health;

import com.air.config.AirProperties;
import com.air.worktree.GitRunner;
import com.air.worktree.WorkTreePool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private static final Duration GIT_CHECK_TIMEOUT = Duration.ofSeconds(10);

    private final AirProperties properties;
    private final GitRunner gitRunner;
    private final WorkTreePool workTreePool;

    public HealthCheckService(AirProperties properties,
                              @Autowired(required = false) GitRunner gitRunner,
                              @Autowired(required = false) WorkTreePool workTreePool) {
        this.properties = properties;
        this.gitRunner = gitRunner;
        this.workTreePool = workTreePool;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGit());
        results.add(checkResultsPath());
        results.add(checkWorkTrees());
        return results;
    }

    HealthStatus checkGit() {
        if (gitRunner == null) {
            return new HealthStatus("git", HealthStatus.Status.DOWN, "No GitRunner configured", Map.of());
        }
        var result = gitRunner.run(Path.of("."), GIT_CHECK_TIMEOUT, List.of("git", "--version"));
        if (result.succeeded()) {
            return new HealthStatus("git", HealthStatus.Status.UP, result.stdout().strip(), Map.of());
        }
        log.warn("git health check failed: {}", result.diagnostic());
        return new HealthStatus("git", HealthStatus.Status.DOWN, result.diagnostic(), Map.of());
    }

    HealthStatus checkResultsPath() {
        Path results = Path.of(properties.getResultsPath());
        try {
            Files.createDirectories(results);
            Path probe = Files.createTempFile(results, ".health", ".tmp");
            Files.delete(probe);
            return new HealthStatus("results", HealthStatus.Status.UP,
                    "Writable: " + results.toAbsolutePath(), Map.of());
        } catch (IOException e) {
            log.warn("Results path health check failed: {}", e.getMessage());
            return new HealthStatus("results", HealthStatus.Status.DOWN,
                    "Not writable: " + results.toAbsolutePath() + " (" + e.getMessage() + ")", Map.of());
        }
    }

    HealthStatus checkWorkTrees() {
        Path base = Path.of(properties.getGitTree());
        if (!Files.isDirectory(base.resolve(".git")) && !Files.isRegularFile(base.resolve("HEAD"))) {
            return new HealthStatus("worktrees", HealthStatus.Status.DOWN,
                    "Base repository not found: " + base.toAbsolutePath(), Map.of());
        }
        if (workTreePool == null) {
            return new HealthStatus("worktrees", HealthStatus.Status.DEGRADED,
                    "Work tree pool not configured", Map.of());
        }
        Path dir = workTreePool.worktreeDir();
        long present = 0;
        for (int i = 1; i <= workTreePool.size(); i++) {
            if (Files.isDirectory(dir.resolve("wt-" + i).resolve(".git"))) {
                present++;
            }
        }
        var metadata = Map.of("size", String.valueOf(workTreePool.size()), "present", String.valueOf(present));
        if (present < workTreePool.size()) {
            return new HealthStatus("worktrees", HealthStatus.Status.DEGRADED,
                    present + " of " + workTreePool.size() + " work trees created (created on first start)", metadata);
        }
        return new HealthStatus("worktrees", HealthStatus.Status.UP,
                workTreePool.size() + " work trees ready", metadata);
    }
}
