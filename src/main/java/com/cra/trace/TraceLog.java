package com.cra.trace;

import java.util.Collection;
import java.util.List;

/**
 * Storage for per-session hash chains. Only the trace worker appends;
 * readers always receive immutable snapshots.
 */
public interface TraceLog {

    String genesisSeed();

    /** Current tip of the session chain, opening the chain at genesis if needed. */
    ChainTip tip(String sessionId);

    /**
     * Appends an event that must sit exactly on the current tip.
     *
     * @throws IllegalStateException if the event does not extend the tip or the chain is frozen
     */
    void append(TraceEvent event);

    /** Marks a chain as ended; nothing more is appended to it. */
    void freeze(String sessionId);

    boolean hasSession(String sessionId);

    List<TraceEvent> events(String sessionId);

    Collection<String> sessionIds();
}
