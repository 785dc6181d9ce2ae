package com.cra.trace;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemoryTraceLog implements TraceLog {

    private final String genesisSeed;
    private final Map<String, SessionChain> chains = new ConcurrentHashMap<>();

    public InMemoryTraceLog(String genesisSeed) {
        this.genesisSeed = genesisSeed;
    }

    @Override
    public String genesisSeed() {
        return genesisSeed;
    }

    @Override
    public ChainTip tip(String sessionId) {
        SessionChain chain = chains.computeIfAbsent(sessionId, id -> new SessionChain(genesisSeed));
        synchronized (chain) {
            return new ChainTip(chain.tipHash, chain.events.size(), chain.frozen);
        }
    }

    @Override
    public void append(TraceEvent event) {
        SessionChain chain = chains.computeIfAbsent(event.sessionId(), id -> new SessionChain(genesisSeed));
        synchronized (chain) {
            if (chain.frozen) {
                throw new IllegalStateException("chain for session " + event.sessionId() + " is frozen");
            }
            if (event.sequence() != chain.events.size() || !chain.tipHash.equals(event.previousEventHash())) {
                throw new IllegalStateException("event " + event.eventId() + " does not extend the tip of session "
                    + event.sessionId() + " at sequence " + chain.events.size());
            }
            chain.events.add(event);
            chain.tipHash = event.eventHash();
        }
    }

    @Override
    public void freeze(String sessionId) {
        SessionChain chain = chains.get(sessionId);
        if (chain != null) {
            synchronized (chain) {
                chain.frozen = true;
            }
        }
    }

    @Override
    public boolean hasSession(String sessionId) {
        return chains.containsKey(sessionId);
    }

    @Override
    public List<TraceEvent> events(String sessionId) {
        SessionChain chain = chains.get(sessionId);
        return chain == null ? List.of() : List.copyOf(chain.events);
    }

    @Override
    public Collection<String> sessionIds() {
        return Collections.unmodifiableSet(chains.keySet());
    }

    private static final class SessionChain {
        private final CopyOnWriteArrayList<TraceEvent> events = new CopyOnWriteArrayList<>();
        private String tipHash;
        private boolean frozen;

        private SessionChain(String genesis) {
            this.tipHash = genesis;
        }
    }
}
