package com.cra.context;

/**
 * Predicate deciding whether a context entry is eligible for a request.
 */
@FunctionalInterface
public interface ContextCondition {

    boolean test(EvaluationContext context);

    default ContextCondition and(ContextCondition other) {
        return ctx -> test(ctx) && other.test(ctx);
    }

    static ContextCondition always() {
        return ctx -> true;
    }
}
