package com.air.reviewer;

/**
 * Runs the external reviewer once against a snapshot.
 */
public interface ReviewerInvoker {

    /**
     * @param attempt 1-based attempt number, used to name diagnostics of failed attempts
     * @throws ReviewTimeoutException   if the reviewer exceeded its timeout
     * @throws ReviewExecutionException if it could not be started or exited unsuccessfully
     */
    ReviewOutcome review(ReviewJob job, int attempt) throws ReviewFailureException;
}
