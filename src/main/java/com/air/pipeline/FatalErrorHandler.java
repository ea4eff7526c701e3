package com.air.pipeline;

/**
 * Receives failures the process cannot continue past, such as a result
 * that could not be made durable.
 */
@FunctionalInterface
public interface FatalErrorHandler {

    void onFatal(String context, Throwable error);
}
