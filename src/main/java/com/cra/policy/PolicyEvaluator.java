package com.cra.policy;

import com.cra.atlas.AtlasManifest.ActionDefinition;
import com.cra.atlas.AtlasManifest.PolicyDefinition;
import com.cra.atlas.AtlasView;
import com.cra.atlas.PolicyType;
import com.cra.config.CraProperties;
import com.cra.error.NotFoundException;
import com.cra.protocol.AllowedAction;
import com.cra.protocol.CarpRequest;
import com.cra.protocol.Constraint;
import com.cra.protocol.Decision;
import com.cra.protocol.DeniedAction;
import com.cra.protocol.RiskTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deterministic policy evaluation.
 *
 * Runs a fixed, ordered list of {@link PolicyCategory} stages (deny, approval,
 * rate limit) and returns the first decision any of them produces; a request
 * no stage objects to is allowed. The same request, atlas view and usage
 * always yield the same decision.
 */
public class PolicyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PolicyEvaluator.class);

    private final List<PolicyCategory> categories;
    private final CraProperties.Policy settings;

    public PolicyEvaluator(List<PolicyCategory> categories, CraProperties.Policy settings) {
        this.categories = List.copyOf(categories);
        this.settings = settings;
    }

    /** The standard chain: deny, then approval, then rate limit. */
    public static PolicyEvaluator standard(CraProperties.Policy settings) {
        return new PolicyEvaluator(List.of(
            new DenyCategory(settings.riskCeiling()),
            new ApprovalCategory(settings.approvalThreshold(), settings.defaultApprover(),
                settings.defaultApprovalTimeoutSeconds()),
            new RateLimitCategory(settings.sessionRateLimit())
        ), settings);
    }

    public List<PolicyCategory> categories() {
        return categories;
    }

    public Decision evaluate(CarpRequest request, AtlasView atlas, UsageSnapshot usage) {
        return assess(request, atlas, usage).decision();
    }

    public PolicyEvaluation assess(CarpRequest request, AtlasView atlas, UsageSnapshot usage) {
        for (PolicyCategory category : categories) {
            PolicyCategory.CategoryVerdict verdict = category.evaluate(request, atlas, usage);
            if (verdict instanceof PolicyCategory.CategoryVerdict.Decide decide) {
                log.debug("Request {} decided by {}/{}: {}",
                    request.requestId(), category.categoryId(), decide.policyId(), decide.decision().type());
                return new PolicyEvaluation(decide.decision(), category.categoryId(), decide.policyId());
            }
        }
        log.debug("Request {} passed all {} categories", request.requestId(), categories.size());
        return PolicyEvaluation.allowed();
    }

    /**
     * Splits every action of the view into allowed and denied. Actions that
     * would need approval are listed as denied with the approval reason.
     */
    public ActionClassification classifyActions(AtlasView atlas) {
        List<AllowedAction> allowed = new ArrayList<>();
        List<DeniedAction> denied = new ArrayList<>();
        List<Constraint> constraints = new ArrayList<>();
        List<PolicyDefinition> policies = atlas.policies();

        for (ActionDefinition action : atlas.actions()) {
            Optional<DeniedAction> denial = denialFor(action, policies);
            if (denial.isPresent()) {
                denied.add(denial.get());
                continue;
            }
            allowed.add(new AllowedAction(action.actionId(), action.name(), action.description(),
                action.parametersSchema(), action.riskTier()));
            for (PolicyDefinition policy : policies) {
                if (policy.type() == PolicyType.RATE_LIMIT && policy.parameters().maxCalls() != null
                    && ActionPatterns.matchesAny(policy.actions(), action.actionId())) {
                    constraints.add(new Constraint(policy.policyId() + ":" + action.actionId(),
                        "at most " + policy.parameters().maxCalls() + " calls per "
                            + windowOf(policy) + "s for " + action.actionId()));
                }
            }
        }
        return new ActionClassification(allowed, denied, constraints);
    }

    /**
     * Whether policy in {@code atlas} currently refuses {@code actionId}, by the
     * same rules as {@link #classifyActions}.
     *
     * @throws NotFoundException if the view defines no such action
     */
    public Optional<DeniedAction> checkAction(AtlasView atlas, String actionId) {
        ActionDefinition action = atlas.action(actionId)
            .orElseThrow(() -> new NotFoundException("action", actionId));
        return denialFor(action, atlas.policies());
    }

    private Optional<DeniedAction> denialFor(ActionDefinition action, List<PolicyDefinition> policies) {
        String id = action.actionId();
        for (PolicyDefinition policy : policies) {
            if (policy.type() == PolicyType.DENY && ActionPatterns.matchesAny(policy.actions(), id)) {
                String reason = policy.reason() != null ? policy.reason() : "denied by policy " + policy.policyId();
                return Optional.of(new DeniedAction(id, policy.policyId(), reason));
            }
        }
        RiskTier risk = action.riskTier();
        if (risk.isAbove(settings.riskCeiling())) {
            return Optional.of(new DeniedAction(id, DenyCategory.RISK_CEILING,
                "risk tier " + risk.getValue() + " exceeds ceiling " + settings.riskCeiling().getValue()));
        }
        for (PolicyDefinition policy : policies) {
            if (policy.type() == PolicyType.REQUIRES_APPROVAL && ActionPatterns.matchesAny(policy.actions(), id)) {
                String approver = policy.parameters().approver() != null
                    ? policy.parameters().approver()
                    : settings.defaultApprover();
                return Optional.of(new DeniedAction(id, policy.policyId(), "requires approval from " + approver));
            }
        }
        boolean preApproved = policies.stream()
            .anyMatch(p -> p.type() == PolicyType.ALLOW && ActionPatterns.matchesAny(p.actions(), id));
        if (risk.isAtLeast(settings.approvalThreshold()) && !preApproved) {
            return Optional.of(new DeniedAction(id, ApprovalCategory.APPROVAL_THRESHOLD,
                "requires approval from " + settings.defaultApprover()));
        }
        return Optional.empty();
    }

    private static long windowOf(PolicyDefinition policy) {
        return policy.parameters().windowSeconds() != null ? policy.parameters().windowSeconds() : 60;
    }
}
