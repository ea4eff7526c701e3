package com.air.config;

import com.air.pipeline.FatalErrorHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Logs the failure and closes the application with exit code 2. The exit
 * runs on its own thread because closing the context stops the worker
 * that reported the failure.
 */
public class ExitingFatalErrorHandler implements FatalErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(ExitingFatalErrorHandler.class);

    static final int EXIT_CODE = 2;

    private final ApplicationContext context;
    private final AtomicBoolean exiting = new AtomicBoolean();

    public ExitingFatalErrorHandler(ApplicationContext context) {
        this.context = context;
    }

    @Override
    public void onFatal(String what, Throwable error) {
        log.error("Fatal error in {}, shutting down", what, error);
        if (!exiting.compareAndSet(false, true)) {
            return;
        }
        var exit = new Thread(() -> System.exit(SpringApplication.exit(context, () -> EXIT_CODE)), "air-fatal-exit");
        exit.start();
    }
}
