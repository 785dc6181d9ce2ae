package com.cra.trace;

import com.cra.trace.ChainVerification.ErrorType;

import java.util.List;
import java.util.OptionalInt;

/**
 * Read-only verification of a session timeline against a genesis seed.
 * Checks, event by event: linkage to the previous hash (or genesis),
 * contiguous sequence numbers from zero, and the recomputed event hash.
 */
public final class ChainVerifier {

    private ChainVerifier() {
    }

    public static ChainVerification verify(List<TraceEvent> events, String genesisSeed) {
        String expectedPrevious = genesisSeed;
        for (int i = 0; i < events.size(); i++) {
            TraceEvent event = events.get(i);
            if (!expectedPrevious.equals(event.previousEventHash())) {
                ErrorType type = i == 0 ? ErrorType.INVALID_GENESIS : ErrorType.CHAIN_BROKEN;
                String message = i == 0
                    ? "first event does not start at the genesis seed"
                    : "previous_event_hash of event " + i + " does not match hash of event " + (i - 1);
                return ChainVerification.broken(events.size(), i, type, message, expectedPrevious);
            }
            if (event.sequence() != i) {
                return ChainVerification.broken(events.size(), i, ErrorType.SEQUENCE_GAP,
                    "expected sequence " + i + " but found " + event.sequence(), expectedPrevious);
            }
            String recomputed = TraceHasher.hash(event);
            if (!recomputed.equals(event.eventHash())) {
                return ChainVerification.broken(events.size(), i, ErrorType.HASH_MISMATCH,
                    "event_hash of event " + i + " does not match its content", expectedPrevious);
            }
            expectedPrevious = event.eventHash();
        }
        return ChainVerification.ok(events.size(), expectedPrevious);
    }

    /**
     * First index at which two timelines differ by event hash. When one is a
     * prefix of the other the shorter length is returned; identical timelines
     * yield empty.
     */
    public static OptionalInt findDivergence(List<TraceEvent> a, List<TraceEvent> b) {
        int common = Math.min(a.size(), b.size());
        for (int i = 0; i < common; i++) {
            if (!a.get(i).eventHash().equals(b.get(i).eventHash())) {
                return OptionalInt.of(i);
            }
        }
        return a.size() == b.size() ? OptionalInt.empty() : OptionalInt.of(common);
    }

    /** True when {@code extension} starts with every event of {@code base}. */
    public static boolean isExtension(List<TraceEvent> base, List<TraceEvent> extension) {
        if (extension.size() < base.size()) {
            return false;
        }
        return findDivergence(base, extension.subList(0, base.size())).isEmpty();
    }
}
