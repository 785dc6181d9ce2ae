package com.cra.context;

import com.cra.protocol.CarpRequest;
import com.cra.protocol.RiskTier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * What a context condition may look at: the request's goal and hints, its
 * risk tier, the capabilities it asks for and the files it touches.
 */
public record EvaluationContext(
    String goal,
    List<String> contextHints,
    Optional<RiskTier> riskTier,
    List<String> capabilities,
    List<String> files
) {

    public static final String FILES_KEY = "files";

    public EvaluationContext {
        goal = goal == null ? "" : goal;
        contextHints = contextHints == null ? List.of() : List.copyOf(contextHints);
        riskTier = riskTier == null ? Optional.empty() : riskTier;
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        files = files == null ? List.of() : List.copyOf(files);
    }

    public static EvaluationContext of(String goal, List<String> contextHints) {
        return new EvaluationContext(goal, contextHints, Optional.empty(), List.of(), List.of());
    }

    public static EvaluationContext from(CarpRequest request) {
        CarpRequest.Task task = request.task();
        return new EvaluationContext(
            task.goal(),
            task.contextHints(),
            Optional.ofNullable(task.riskTier()),
            task.requiredCapabilities(),
            filesOf(request)
        );
    }

    private static List<String> filesOf(CarpRequest request) {
        Object raw = request.context().get(FILES_KEY);
        List<String> files = new ArrayList<>();
        if (raw instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null) {
                    files.add(item.toString());
                }
            }
        } else if (raw instanceof String single) {
            files.add(single);
        }
        return files;
    }
}
