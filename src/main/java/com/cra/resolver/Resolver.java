package com.cra.resolver;

import com.cra.atlas.AtlasManifest;
import com.cra.atlas.AtlasRegistry;
import com.cra.atlas.AtlasView;
import com.cra.config.CraProperties;
import com.cra.context.ContextRegistry;
import com.cra.context.EvaluationContext;
import com.cra.context.LoadedContext;
import com.cra.context.MatchResult;
import com.cra.error.ActionDeniedException;
import com.cra.error.AlreadyExistsException;
import com.cra.error.BackpressureException;
import com.cra.error.CraException;
import com.cra.error.ErrorCode;
import com.cra.error.InvalidStateException;
import com.cra.error.NotFoundException;
import com.cra.error.ValidationException;
import com.cra.policy.ActionClassification;
import com.cra.policy.PolicyEvaluation;
import com.cra.policy.PolicyEvaluator;
import com.cra.policy.UsageSnapshot;
import com.cra.protocol.CarpRequest;
import com.cra.protocol.CarpResolution;
import com.cra.protocol.Constraint;
import com.cra.protocol.ContextBlock;
import com.cra.protocol.Decision;
import com.cra.protocol.DeniedAction;
import com.cra.trace.ChainVerification;
import com.cra.trace.ChainVerifier;
import com.cra.trace.EventType;
import com.cra.trace.InMemoryTraceLog;
import com.cra.trace.RawEvent;
import com.cra.trace.TraceEvent;
import com.cra.trace.TraceHasher;
import com.cra.trace.TraceProcessor;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for every transport.
 *
 * Owns the sessions and drives each resolution: validate, record
 * {@code carp.request.received}, evaluate policy and match context, then
 * record {@code policy.evaluated}, one {@code context.injected} per block and
 * {@code carp.resolution.completed}, in that order. Rate-limit windows are
 * measured on the engine clock; the agent's request timestamp plays no part
 * in policy. Not safe for concurrent mutation; callers serialize access.
 */
public class Resolver implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Resolver.class);

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    static final String RESOLUTION_EXPIRED = "resolution.expired";
    static final String RESOLUTION_SCOPE = "resolution.scope";

    private final AtlasRegistry atlasRegistry;
    private final ContextRegistry contextRegistry;
    private final PolicyEvaluator policyEvaluator;
    private final TraceProcessor traceProcessor;
    private final CraProperties properties;
    private final Clock clock;
    private final ExecutorService executor;
    private final Map<String, Session> sessions = new LinkedHashMap<>();

    public Resolver(AtlasRegistry atlasRegistry,
                    ContextRegistry contextRegistry,
                    PolicyEvaluator policyEvaluator,
                    TraceProcessor traceProcessor,
                    CraProperties properties,
                    Clock clock) {
        this.atlasRegistry = atlasRegistry;
        this.contextRegistry = contextRegistry;
        this.policyEvaluator = policyEvaluator;
        this.traceProcessor = traceProcessor;
        this.properties = properties;
        this.clock = clock;
        this.executor = properties.resolution().parallelEvaluation() ? newExecutor() : null;
    }

    /** A fully wired resolver over in-memory registries and trace log, for use outside Spring. */
    public static Resolver create(CraProperties properties) {
        TraceProcessor processor = new TraceProcessor(
            new InMemoryTraceLog(properties.trace().genesisSeed()), properties.trace());
        return new Resolver(new AtlasRegistry(), new ContextRegistry(),
            PolicyEvaluator.standard(properties.policy()), processor, properties, Clock.systemUTC());
    }

    public AtlasManifest loadAtlas(AtlasManifest manifest) {
        AtlasManifest loaded = atlasRegistry.load(manifest);
        loaded.contextPacks().forEach(pack -> contextRegistry.addContext(LoadedContext.fromPack(loaded.atlasId(), pack)));
        return loaded;
    }

    public AtlasManifest reloadAtlas(AtlasManifest manifest) {
        AtlasManifest reloaded = atlasRegistry.reload(manifest);
        contextRegistry.removeSource(reloaded.atlasId());
        reloaded.contextPacks().forEach(pack -> contextRegistry.addContext(LoadedContext.fromPack(reloaded.atlasId(), pack)));
        return reloaded;
    }

    /**
     * Removes an atlas and its context packs. Resolutions already issued keep
     * their content; later executions of its actions fail as unknown.
     */
    public AtlasManifest unloadAtlas(String atlasId) {
        AtlasManifest removed = atlasRegistry.unload(atlasId);
        contextRegistry.removeSource(removed.atlasId());
        return removed;
    }

    public Collection<String> listAtlases() {
        return atlasRegistry.list();
    }

    public Session createSession(String agentId, String goal) {
        return createSession(UUID.randomUUID().toString(), agentId, goal);
    }

    public Session createSession(String sessionId, String agentId, String goal) {
        requireText(sessionId, "session_id");
        requireText(agentId, "agent_id");
        requireText(goal, "goal");
        if (sessions.containsKey(sessionId)) {
            throw new AlreadyExistsException("session", sessionId);
        }

        Session session = new Session(sessionId, agentId, goal, UUID.randomUUID().toString(),
            RawEvent.newSpanId(), now());
        ObjectNode payload = JSON.objectNode();
        payload.put("agent_id", agentId);
        payload.put("goal", goal);
        ArrayNode atlasIds = payload.putArray("atlas_ids");
        atlasRegistry.list().forEach(atlasIds::add);
        traceProcessor.record(new RawEvent(sessionId, session.getTraceId(), UUID.randomUUID().toString(),
            session.getRootSpanId(), null, EventType.SESSION_STARTED, payload, session.getCreatedAt()));

        sessions.put(sessionId, session);
        log.info("Session {} created for agent={}", sessionId, agentId);
        return session;
    }

    public Optional<Session> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public CarpResolution resolve(String sessionId, String agentId, CarpRequest request) {
        Session session = requireSession(sessionId);
        if (session.isEnded()) {
            throw new InvalidStateException("session " + sessionId + " has ended");
        }
        if (request == null) {
            throw new ValidationException("request is required");
        }
        request.validate();
        if (!sessionId.equals(request.sessionId())) {
            throw new ValidationException("request session_id " + request.sessionId()
                + " does not match session " + sessionId);
        }
        if (!session.getAgentId().equals(agentId) || !agentId.equals(request.agentId())) {
            throw new ValidationException("agent " + request.agentId() + " is not the owner of session " + sessionId);
        }
        AtlasView atlas = atlasRegistry.view(request.atlasIds());

        ObjectNode received = JSON.objectNode();
        received.put("request_id", request.requestId());
        received.put("operation", request.operation().getValue());
        received.put("goal", request.goal());
        received.put("agent_id", request.agentId());
        ArrayNode capabilities = received.putArray("required_capabilities");
        request.task().requiredCapabilities().forEach(capabilities::add);
        RawEvent receivedEvent = event(session, EventType.REQUEST_RECEIVED, received, session.getRootSpanId());
        String requestSpan = receivedEvent.spanId();

        Instant evaluatedAt = now();
        Evaluated evaluated;
        try {
            evaluated = evaluate(request, atlas, session.usage(evaluatedAt));
        } catch (RuntimeException ex) {
            recordFailure(session, receivedEvent, ex);
            throw ex;
        }
        List<RawEvent> events = new ArrayList<>();
        events.add(receivedEvent);

        PolicyEvaluation policy = evaluated.policy();
        ObjectNode policyPayload = JSON.objectNode();
        policyPayload.put("policy_id", policy.policyId() != null ? policy.policyId() : PolicyEvaluation.DEFAULT_CATEGORY);
        policyPayload.put("category", policy.categoryId());
        policyPayload.put("result", policy.decision().type());
        reasonOf(policy.decision()).ifPresent(reason -> policyPayload.put("reason", reason));
        events.add(event(session, EventType.POLICY_EVALUATED, policyPayload, requestSpan));

        List<ContextBlock> blocks = new ArrayList<>();
        for (MatchResult match : evaluated.matches()) {
            if (blocks.size() >= properties.resolution().maxContextBlocks()) {
                break;
            }
            LoadedContext entry = match.entry();
            ContextBlock block = new ContextBlock(entry.packId(), entry.source(), entry.contentType(),
                entry.priority(), match.score(), entry.content());
            ObjectNode injected = JSON.objectNode();
            injected.put("context_id", block.blockId());
            injected.put("source_atlas", block.source());
            injected.put("priority", block.priority());
            injected.put("content_type", block.contentType());
            injected.put("match_score", block.score());
            events.add(event(session, EventType.CONTEXT_INJECTED, injected, requestSpan));
            blocks.add(block);
        }

        ActionClassification actions = evaluated.actions();
        List<Constraint> constraints = new ArrayList<>(actions.constraints());
        if (policy.decision() instanceof Decision.RequiresApproval approval) {
            constraints.add(new Constraint("approval_required",
                "approval from " + approval.approver() + " within " + approval.timeoutSeconds() + "s"));
        }

        long ttl = properties.resolution().defaultTtlSeconds();
        CarpResolution resolution = new CarpResolution(
            CarpRequest.CARP_VERSION,
            UUID.randomUUID().toString(),
            request.requestId(),
            sessionId,
            evaluatedAt,
            policy.decision(),
            blocks,
            actions.allowed(),
            actions.denied(),
            constraints,
            ttl,
            session.getTraceId()
        );

        ObjectNode completed = JSON.objectNode();
        completed.put("resolution_id", resolution.resolutionId());
        completed.put("decision_type", policy.decision().type());
        completed.put("allowed_count", resolution.allowedActions().size());
        completed.put("denied_count", resolution.deniedActions().size());
        completed.put("context_count", blocks.size());
        completed.put("ttl_seconds", ttl);
        events.add(event(session, EventType.RESOLUTION_COMPLETED, completed, requestSpan));

        // the whole chain segment is queued or none of it is; usage counts only once it is
        try {
            traceProcessor.recordAll(events);
        } catch (BackpressureException ex) {
            log.warn("Dropped resolution of request {} in session {}: {}",
                request.requestId(), sessionId, ex.getMessage());
            throw ex;
        }
        session.recordResolution(
            new UsageSnapshot.Usage(evaluatedAt, request.task().requiredCapabilities()), resolution);

        log.info("Resolved request {} in session {}: decision={} allowed={} denied={} context={}",
            request.requestId(), sessionId, policy.decision().type(), resolution.allowedActions().size(),
            resolution.deniedActions().size(), blocks.size());
        return resolution;
    }

    /**
     * Runs one action under a resolution the session received earlier.
     *
     * Records {@code action.requested}, then either {@code action.denied} and
     * an {@link ActionDeniedException}, or {@code action.approved} and
     * {@code action.executed}. Policy is checked again against the atlases
     * loaded now, so an atlas change since the resolution takes effect.
     *
     * @throws NotFoundException if the session, resolution or action is unknown
     * @throws ActionDeniedException if policy, expiry or the resolution's scope refuses the action
     */
    public ActionExecution execute(String sessionId, String resolutionId, String actionId, JsonNode parameters) {
        Session session = requireSession(sessionId);
        if (session.isEnded()) {
            throw new InvalidStateException("session " + sessionId + " has ended");
        }
        requireText(resolutionId, "resolution_id");
        requireText(actionId, "action_id");
        CarpResolution resolution = session.getResolution(resolutionId)
            .orElseThrow(() -> new NotFoundException("resolution", resolutionId));

        Instant requestedAt = now();
        String executionId = UUID.randomUUID().toString();
        ObjectNode requested = JSON.objectNode();
        requested.put("action_id", actionId);
        requested.put("resolution_id", resolutionId);
        requested.put("execution_id", executionId);
        requested.put("parameters_hash", TraceHasher.hashJson(parameters));
        RawEvent requestedEvent = event(session, EventType.ACTION_REQUESTED, requested, session.getRootSpanId());

        Optional<DeniedAction> refusal;
        try {
            refusal = refusal(resolution, actionId, requestedAt);
        } catch (RuntimeException ex) {
            recordFailure(session, requestedEvent, ex);
            throw ex;
        }
        if (refusal.isPresent()) {
            DeniedAction denial = refusal.get();
            ObjectNode denied = JSON.objectNode();
            denied.put("action_id", actionId);
            denied.put("reason", denial.reason());
            denied.put("policy_id", denial.policyId());
            traceProcessor.recordAll(List.of(requestedEvent,
                event(session, EventType.ACTION_DENIED, denied, requestedEvent.spanId())));
            log.info("Denied action {} in session {} by {}: {}", actionId, sessionId, denial.policyId(),
                denial.reason());
            throw new ActionDeniedException(actionId, denial.policyId(), denial.reason());
        }

        ObjectNode approved = JSON.objectNode();
        approved.put("action_id", actionId);
        approved.put("resolution_id", resolutionId);
        RawEvent approvedEvent = event(session, EventType.ACTION_APPROVED, approved, requestedEvent.spanId());

        ObjectNode result = JSON.objectNode();
        result.put("status", "success");
        result.put("action_id", actionId);
        result.put("message", "action " + actionId + " approved for execution");
        long durationMs = Duration.between(requestedAt, now()).toMillis();
        ObjectNode executed = JSON.objectNode();
        executed.put("action_id", actionId);
        executed.put("execution_id", executionId);
        executed.put("duration_ms", durationMs);
        executed.put("result_hash", TraceHasher.hashJson(result));

        traceProcessor.recordAll(List.of(requestedEvent, approvedEvent,
            event(session, EventType.ACTION_EXECUTED, executed, requestedEvent.spanId())));
        session.recordAction();
        log.info("Executed action {} in session {} under resolution {}", actionId, sessionId, resolutionId);
        return new ActionExecution(executionId, resolutionId, actionId, durationMs, result);
    }

    public Session endSession(String sessionId) {
        Session session = requireSession(sessionId);
        if (session.isEnded()) {
            throw new InvalidStateException("session " + sessionId + " has already ended");
        }
        Instant endedAt = now();
        ObjectNode payload = JSON.objectNode();
        payload.put("reason", "completed");
        payload.put("duration_ms", session.duration(endedAt).toMillis());
        payload.put("resolution_count", session.getResolutionCount());
        payload.put("action_count", session.getActionCount());
        emit(session, EventType.SESSION_ENDED, payload, session.getRootSpanId());
        session.end(endedAt);
        log.info("Session {} ended after {} resolutions", sessionId, session.getResolutionCount());
        return session;
    }

    /** The session's chained events in sequence order, once everything recorded so far is chained. */
    public List<TraceEvent> getTrace(String sessionId) {
        requireSession(sessionId);
        traceProcessor.flush(properties.trace().flushTimeout());
        return traceProcessor.traceLog().events(sessionId);
    }

    public ChainVerification verifyChain(String sessionId) {
        List<TraceEvent> events = getTrace(sessionId);
        return ChainVerifier.verify(events, traceProcessor.traceLog().genesisSeed());
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdown();
        }
        traceProcessor.close();
    }

    private Evaluated evaluate(CarpRequest request, AtlasView atlas, UsageSnapshot usage) {
        EvaluationContext context = EvaluationContext.from(request);
        if (executor == null) {
            return new Evaluated(policyEvaluator.assess(request, atlas, usage),
                contextRegistry.query(context), policyEvaluator.classifyActions(atlas));
        }
        CompletableFuture<PolicyEvaluation> policy =
            CompletableFuture.supplyAsync(() -> policyEvaluator.assess(request, atlas, usage), executor);
        CompletableFuture<List<MatchResult>> matches =
            CompletableFuture.supplyAsync(() -> contextRegistry.query(context), executor);
        ActionClassification actions = policyEvaluator.classifyActions(atlas);
        try {
            return new Evaluated(policy.join(), matches.join(), actions);
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw ex;
        }
    }

    private Optional<DeniedAction> refusal(CarpResolution resolution, String actionId, Instant at) {
        Optional<DeniedAction> byPolicy = policyEvaluator.checkAction(atlasRegistry.view(List.of()), actionId);
        if (byPolicy.isPresent()) {
            return byPolicy;
        }
        if (resolution.isExpired(at)) {
            return Optional.of(new DeniedAction(actionId, RESOLUTION_EXPIRED,
                "resolution " + resolution.resolutionId() + " expired at " + resolution.expiresAt()));
        }
        if (!resolution.isActionAllowed(actionId)) {
            return Optional.of(new DeniedAction(actionId, RESOLUTION_SCOPE, resolution.denialReason(actionId)
                .orElse("not allowed by resolution " + resolution.resolutionId())));
        }
        return Optional.empty();
    }

    private RawEvent event(Session session, EventType type, ObjectNode payload, String parentSpanId) {
        return RawEvent.of(session.getSessionId(), session.getTraceId(), type, payload, parentSpanId);
    }

    private void emit(Session session, EventType type, ObjectNode payload, String parentSpanId) {
        traceProcessor.record(event(session, type, payload, parentSpanId));
    }

    /** Records the opening event of a failed call followed by {@code error.occurred}. */
    private void recordFailure(Session session, RawEvent opening, RuntimeException error) {
        ObjectNode payload = JSON.objectNode();
        ErrorCode code = error instanceof CraException cra ? cra.getErrorCode() : ErrorCode.INTERNAL_ERROR;
        payload.put("error_code", code.code());
        payload.put("message", String.valueOf(error.getMessage()));
        try {
            traceProcessor.recordAll(List.of(opening,
                event(session, EventType.ERROR_OCCURRED, payload, opening.spanId())));
        } catch (CraException traceFailure) {
            error.addSuppressed(traceFailure);
        }
        log.warn("{} failed in session {}: {}", opening.eventType().getValue(), session.getSessionId(),
            error.getMessage());
    }

    private Session requireSession(String sessionId) {
        Session session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) {
            throw new NotFoundException("session", sessionId);
        }
        return session;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static Optional<String> reasonOf(Decision decision) {
        if (decision instanceof Decision.Deny deny) {
            return Optional.ofNullable(deny.reason());
        }
        if (decision instanceof Decision.Partial partial) {
            return Optional.ofNullable(partial.reason());
        }
        return Optional.empty();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
    }

    private static ExecutorService newExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "cra-resolver-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private record Evaluated(PolicyEvaluation policy, List<MatchResult> matches, ActionClassification actions) {
    }
}
