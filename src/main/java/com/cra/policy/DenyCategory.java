package com.cra.policy;

import com.cra.atlas.AtlasManifest.PolicyDefinition;
import com.cra.atlas.AtlasView;
import com.cra.atlas.PolicyType;
import com.cra.protocol.CarpRequest;
import com.cra.protocol.Decision;
import com.cra.protocol.RiskTier;

/**
 * Hard denials: capabilities the visible atlases do not define, capabilities
 * matched by a {@code deny} policy, and requests above the risk ceiling.
 */
public class DenyCategory implements PolicyCategory {

    public static final String UNKNOWN_CAPABILITY = "unknown-capability";
    public static final String RISK_CEILING = "risk-ceiling";

    private final RiskTier riskCeiling;

    public DenyCategory(RiskTier riskCeiling) {
        this.riskCeiling = riskCeiling;
    }

    @Override
    public String categoryId() {
        return "deny";
    }

    @Override
    public CategoryVerdict evaluate(CarpRequest request, AtlasView atlas, UsageSnapshot usage) {
        for (String capability : RequestedActions.capabilities(request)) {
            if (!atlas.knows(capability)) {
                return CategoryVerdict.decide(
                    Decision.deny("capability not provided by any loaded atlas: " + capability),
                    UNKNOWN_CAPABILITY);
            }
        }

        for (PolicyDefinition policy : atlas.policies()) {
            if (policy.type() != PolicyType.DENY) {
                continue;
            }
            for (String capability : RequestedActions.capabilities(request)) {
                if (RequestedActions.matchedBy(policy.actions(), capability, atlas)) {
                    String reason = policy.reason() != null
                        ? policy.reason()
                        : "denied by policy " + policy.policyId();
                    return CategoryVerdict.decide(Decision.deny(reason), policy.policyId());
                }
            }
        }

        RiskTier risk = RequestedActions.effectiveRisk(request, atlas);
        if (risk.isAbove(riskCeiling)) {
            return CategoryVerdict.decide(
                Decision.deny("risk tier " + risk.getValue() + " exceeds ceiling " + riskCeiling.getValue()),
                RISK_CEILING);
        }
        return CategoryVerdict.pass();
    }
}
