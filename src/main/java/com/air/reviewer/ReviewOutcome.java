package com.air.reviewer;

import java.nio.file.Path;
import java.time.Duration;

/**
 * A successful reviewer attempt.
 *
 * @param document main review document written to the output directory
 * @param elapsed  wall time of the attempt
 */
public record ReviewOutcome(Path document, Duration elapsed) {}
