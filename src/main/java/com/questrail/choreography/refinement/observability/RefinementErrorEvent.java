package com.questrail.choreography.refinement.observability;

import java.time.Instant;

/**
 * Record representing a fatal failure of a refinement check.
 */
public record RefinementErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
