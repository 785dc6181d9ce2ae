package com.cra.policy;

import com.cra.protocol.AllowedAction;
import com.cra.protocol.Constraint;
import com.cra.protocol.DeniedAction;

import java.util.List;

public record ActionClassification(
    List<AllowedAction> allowed,
    List<DeniedAction> denied,
    List<Constraint> constraints
) {
    public ActionClassification {
        allowed = List.copyOf(allowed);
        denied = List.copyOf(denied);
        constraints = List.copyOf(constraints);
    }
}
