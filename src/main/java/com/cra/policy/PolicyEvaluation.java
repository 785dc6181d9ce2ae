package com.cra.policy;

import com.cra.protocol.Decision;

/**
 * A decision together with the category and policy that produced it.
 * Allowed requests carry the {@value #DEFAULT_CATEGORY} category and no policy id.
 */
public record PolicyEvaluation(Decision decision, String categoryId, String policyId) {

    public static final String DEFAULT_CATEGORY = "default";

    public static PolicyEvaluation allowed() {
        return new PolicyEvaluation(Decision.allow(), DEFAULT_CATEGORY, null);
    }
}
