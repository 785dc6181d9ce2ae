package com.cra.policy;

import com.cra.atlas.AtlasManifest.PolicyDefinition;
import com.cra.atlas.AtlasView;
import com.cra.atlas.PolicyType;
import com.cra.config.CraProperties.SessionRateLimit;
import com.cra.protocol.CarpRequest;
import com.cra.protocol.Decision;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Throttling over the session's prior requests. Windows end at the engine
 * instant carried by the {@link UsageSnapshot}; the agent-supplied request
 * timestamp plays no part, so back- or future-dating a request cannot dodge a
 * limit.
 * Throttled requests are denied, or answered with a partial decision when
 * only some requested capabilities are over their limit.
 */
public class RateLimitCategory implements PolicyCategory {

    public static final String SESSION_RATE_LIMIT = "session-rate-limit";

    private final SessionRateLimit sessionLimit;

    public RateLimitCategory(SessionRateLimit sessionLimit) {
        this.sessionLimit = sessionLimit;
    }

    @Override
    public String categoryId() {
        return "rate_limit";
    }

    @Override
    public CategoryVerdict evaluate(CarpRequest request, AtlasView atlas, UsageSnapshot usage) {
        if (sessionLimit.enabled()) {
            long recent = usage.countWithin(sessionLimit.window());
            if (recent >= sessionLimit.maxRequests()) {
                return CategoryVerdict.decide(
                    Decision.deny("rate limit exceeded: " + sessionLimit.maxRequests()
                        + " requests per " + sessionLimit.window().toSeconds() + "s"),
                    SESSION_RATE_LIMIT);
            }
        }

        List<String> capabilities = RequestedActions.capabilities(request);
        if (capabilities.isEmpty()) {
            return CategoryVerdict.pass();
        }
        List<String> throttled = new ArrayList<>();
        String firstPolicyId = null;
        for (String capability : capabilities) {
            for (PolicyDefinition policy : atlas.policies()) {
                if (isThrottling(policy, capability, atlas, usage)) {
                    throttled.add(capability);
                    if (firstPolicyId == null) {
                        firstPolicyId = policy.policyId();
                    }
                    break;
                }
            }
        }

        if (throttled.isEmpty()) {
            return CategoryVerdict.pass();
        }
        if (throttled.size() == capabilities.size()) {
            return CategoryVerdict.decide(
                Decision.deny("rate limit exceeded for " + String.join(", ", throttled)),
                firstPolicyId);
        }
        return CategoryVerdict.decide(
            Decision.partial("rate limited: " + String.join(", ", throttled)),
            firstPolicyId);
    }

    private static boolean isThrottling(PolicyDefinition policy, String capability, AtlasView atlas,
                                        UsageSnapshot usage) {
        if (policy.type() != PolicyType.RATE_LIMIT || policy.parameters().maxCalls() == null) {
            return false;
        }
        if (!RequestedActions.matchedBy(policy.actions(), capability, atlas)) {
            return false;
        }
        long windowSeconds = policy.parameters().windowSeconds() != null
            ? policy.parameters().windowSeconds()
            : 60;
        long calls = usage.countWithin(Duration.ofSeconds(windowSeconds),
            prior -> prior.capabilities().stream()
                .anyMatch(c -> RequestedActions.matchedBy(policy.actions(), c, atlas)));
        return calls >= policy.parameters().maxCalls();
    }
}
