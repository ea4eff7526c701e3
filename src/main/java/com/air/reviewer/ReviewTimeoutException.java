package com.air.reviewer;

import java.time.Duration;

public class ReviewTimeoutException extends ReviewFailureException {

    public ReviewTimeoutException(Duration timeout) {
        super("Reviewer timed out after " + timeout.toSeconds() + "s");
    }
}
