package com.cra.policy;

import com.cra.atlas.AtlasView;
import com.cra.protocol.CarpRequest;
import com.cra.protocol.Decision;

/**
 * One stage of the ordered policy chain. Categories are deterministic rules
 * over their inputs; the first one that does not pass decides the request.
 */
public interface PolicyCategory {

    /** Stable identifier, e.g. "deny". */
    String categoryId();

    CategoryVerdict evaluate(CarpRequest request, AtlasView atlas, UsageSnapshot usage);

    sealed interface CategoryVerdict {

        record Pass() implements CategoryVerdict {}

        record Decide(Decision decision, String policyId) implements CategoryVerdict {}

        static CategoryVerdict pass() {
            return new Pass();
        }

        static CategoryVerdict decide(Decision decision, String policyId) {
            return new Decide(decision, policyId);
        }
    }
}
