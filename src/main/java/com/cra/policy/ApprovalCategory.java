package com.cra.policy;

import com.cra.atlas.AtlasManifest.PolicyDefinition;
import com.cra.atlas.AtlasView;
import com.cra.atlas.PolicyType;
import com.cra.protocol.CarpRequest;
import com.cra.protocol.Decision;
import com.cra.protocol.RiskTier;

import java.util.List;

/**
 * Escalations: capabilities matched by a {@code requires_approval} policy,
 * and requests at or above the approval threshold that no {@code allow}
 * policy pre-approves.
 */
public class ApprovalCategory implements PolicyCategory {

    public static final String APPROVAL_THRESHOLD = "approval-threshold";

    private final RiskTier approvalThreshold;
    private final String defaultApprover;
    private final long defaultTimeoutSeconds;

    public ApprovalCategory(RiskTier approvalThreshold, String defaultApprover, long defaultTimeoutSeconds) {
        this.approvalThreshold = approvalThreshold;
        this.defaultApprover = defaultApprover;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
    }

    @Override
    public String categoryId() {
        return "approval";
    }

    @Override
    public CategoryVerdict evaluate(CarpRequest request, AtlasView atlas, UsageSnapshot usage) {
        List<String> capabilities = RequestedActions.capabilities(request);
        for (PolicyDefinition policy : atlas.policies()) {
            if (policy.type() != PolicyType.REQUIRES_APPROVAL) {
                continue;
            }
            for (String capability : capabilities) {
                if (RequestedActions.matchedBy(policy.actions(), capability, atlas)) {
                    return CategoryVerdict.decide(approvalFor(policy), policy.policyId());
                }
            }
        }

        RiskTier risk = RequestedActions.effectiveRisk(request, atlas);
        if (risk.isAtLeast(approvalThreshold) && !preApproved(capabilities, atlas)) {
            return CategoryVerdict.decide(
                Decision.requiresApproval(defaultApprover, defaultTimeoutSeconds),
                APPROVAL_THRESHOLD);
        }
        return CategoryVerdict.pass();
    }

    Decision approvalFor(PolicyDefinition policy) {
        String approver = policy.parameters().approver() != null
            ? policy.parameters().approver()
            : defaultApprover;
        long timeout = policy.parameters().timeoutSeconds() != null
            ? policy.parameters().timeoutSeconds()
            : defaultTimeoutSeconds;
        return Decision.requiresApproval(approver, timeout);
    }

    /** Every requested capability is covered by an {@code allow} policy. */
    static boolean preApproved(List<String> capabilities, AtlasView atlas) {
        if (capabilities.isEmpty()) {
            return false;
        }
        List<PolicyDefinition> allows = atlas.policies().stream()
            .filter(p -> p.type() == PolicyType.ALLOW)
            .toList();
        return capabilities.stream().allMatch(capability -> allows.stream()
            .anyMatch(p -> RequestedActions.matchedBy(p.actions(), capability, atlas)));
    }
}
