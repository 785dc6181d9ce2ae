package com.cra.policy;

import com.cra.atlas.AtlasView;
import com.cra.protocol.CarpRequest;
import com.cra.protocol.RiskTier;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers shared by the categories for reading what a request asks for.
 */
final class RequestedActions {

    private RequestedActions() {
    }

    static List<String> capabilities(CarpRequest request) {
        return request.task() == null ? List.of() : request.task().requiredCapabilities();
    }

    /** The requested id together with the actions it expands to. */
    static Set<String> idsFor(String capability, AtlasView atlas) {
        Set<String> ids = new LinkedHashSet<>();
        ids.add(capability);
        ids.addAll(atlas.expand(capability));
        return ids;
    }

    static boolean matchedBy(List<String> patterns, String capability, AtlasView atlas) {
        return idsFor(capability, atlas).stream().anyMatch(id -> ActionPatterns.matchesAny(patterns, id));
    }

    /**
     * The declared risk tier, raised to the highest tier among the requested
     * actions; {@code low} when neither is known.
     */
    static RiskTier effectiveRisk(CarpRequest request, AtlasView atlas) {
        RiskTier risk = request.task() != null && request.task().riskTier() != null
            ? request.task().riskTier()
            : RiskTier.LOW;
        for (String capability : capabilities(request)) {
            for (String id : atlas.expand(capability)) {
                RiskTier actionRisk = atlas.action(id).map(a -> a.riskTier()).orElse(RiskTier.LOW);
                if (actionRisk.isAbove(risk)) {
                    risk = actionRisk;
                }
            }
        }
        return risk;
    }
}
