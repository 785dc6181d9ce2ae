package com.cra.resolver;

import com.cra.policy.UsageSnapshot;
import com.cra.protocol.CarpResolution;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One agent session. {@code CREATED} until the first resolution,
 * {@code ACTIVE} while resolving, {@code ENDED} for good once ended.
 * Mutated only by the {@link Resolver}.
 */
public class Session {

    private final String sessionId;
    private final String agentId;
    private final String goal;
    private final String traceId;
    private final String rootSpanId;
    private final Instant createdAt;
    private final List<UsageSnapshot.Usage> history = new ArrayList<>();
    private final Map<String, CarpResolution> resolutions = new HashMap<>();

    private SessionState state = SessionState.CREATED;
    private Instant endedAt;
    private int resolutionCount;
    private int actionCount;

    Session(String sessionId, String agentId, String goal, String traceId, String rootSpanId, Instant createdAt) {
        this.sessionId = sessionId;
        this.agentId = agentId;
        this.goal = goal;
        this.traceId = traceId;
        this.rootSpanId = rootSpanId;
        this.createdAt = createdAt;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getAgentId() {
        return agentId;
    }

    public String getGoal() {
        return goal;
    }

    public String getTraceId() {
        return traceId;
    }

    String getRootSpanId() {
        return rootSpanId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Optional<Instant> getEndedAt() {
        return Optional.ofNullable(endedAt);
    }

    public SessionState getState() {
        return state;
    }

    public boolean isEnded() {
        return state == SessionState.ENDED;
    }

    public int getResolutionCount() {
        return resolutionCount;
    }

    public int getActionCount() {
        return actionCount;
    }

    /** Prior requests as of {@code evaluatedAt}, an engine-clock instant. */
    public UsageSnapshot usage(Instant evaluatedAt) {
        return new UsageSnapshot(evaluatedAt, history);
    }

    public Optional<CarpResolution> getResolution(String resolutionId) {
        return Optional.ofNullable(resolutions.get(resolutionId));
    }

    public Duration duration(Instant now) {
        return Duration.between(createdAt, endedAt != null ? endedAt : now);
    }

    void recordResolution(UsageSnapshot.Usage usage, CarpResolution resolution) {
        history.add(usage);
        resolutions.put(resolution.resolutionId(), resolution);
        resolutionCount++;
        state = SessionState.ACTIVE;
    }

    void recordAction() {
        actionCount++;
    }

    void end(Instant at) {
        endedAt = at;
        state = SessionState.ENDED;
    }
}
