package dev.rosterwatch.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Consecutive scrape failures and the time of the last operator escalation.
 * Owned and mutated only by the escalation service.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FailureState {
    private int consecutiveFailures;
    private Instant lastEscalationTime;
}
