package com.cra.policy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * The prior requests of a session as seen by rate limiting, together with the
 * engine instant the current request is evaluated at. Both are stamped by the
 * engine's clock, never taken from the agent, and passed in by the caller so
 * evaluation stays a pure function of its inputs.
 */
public record UsageSnapshot(Instant evaluatedAt, List<Usage> history) {

    public UsageSnapshot {
        Objects.requireNonNull(evaluatedAt, "evaluatedAt");
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static UsageSnapshot empty(Instant evaluatedAt) {
        return new UsageSnapshot(evaluatedAt, List.of());
    }

    public record Usage(Instant timestamp, List<String> capabilities) {
        public Usage {
            capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        }
    }

    /** Requests in the window {@code (evaluatedAt - window, evaluatedAt]}. */
    public long countWithin(Duration window) {
        return countWithin(window, usage -> true);
    }

    public long countWithin(Duration window, Predicate<Usage> filter) {
        Instant from = evaluatedAt.minus(window);
        return history.stream()
            .filter(u -> u.timestamp().isAfter(from) && !u.timestamp().isAfter(evaluatedAt))
            .filter(filter)
            .count();
    }

    public UsageSnapshot plus(Usage usage) {
        List<Usage> next = new ArrayList<>(history);
        next.add(usage);
        return new UsageSnapshot(evaluatedAt, next);
    }
}
