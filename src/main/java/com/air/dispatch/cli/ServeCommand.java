package com.air.dispatch.cli;

import com.air.config.AirProperties;
import com.air.pipeline.PipelineWorkers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: air serve
 * <p>
 * Starts the setup and reviewer workers and processes the durable queue
 * until the process is stopped. Requests queued before a restart are picked
 * up in their original order.
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Run the review pipeline until interrupted")
@Component
public class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    private final PipelineWorkers workers;
    private final AirProperties properties;

    public ServeCommand(PipelineWorkers workers, AirProperties properties) {
        this.workers = workers;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            workers.start();
        } catch (IllegalStateException e) {
            log.error("Pipeline failed to start", e);
            ConsoleOutput.error("Pipeline failed to start: " + e.getMessage());
            return 1;
        }
        ConsoleOutput.info("Pipeline running: " + properties.getSetupConcurrency() + " setup, "
                + properties.getReviewerConcurrency() + " reviewer worker(s)");
        ConsoleOutput.info("Results: " + properties.getResultsPath());
        ConsoleOutput.info("Press Ctrl+C to stop.");

        // the shutdown hook stops the workers when the context closes
        while (workers.isRunning()) {
            try {
                Thread.sleep(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return 0;
    }
}
