package com.cra.trace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum EventType {
    SESSION_STARTED("session.started"),
    SESSION_ENDED("session.ended"),
    REQUEST_RECEIVED("carp.request.received"),
    RESOLUTION_COMPLETED("carp.resolution.completed"),
    POLICY_EVALUATED("policy.evaluated"),
    CONTEXT_INJECTED("context.injected"),
    ACTION_REQUESTED("action.requested"),
    ACTION_APPROVED("action.approved"),
    ACTION_DENIED("action.denied"),
    ACTION_EXECUTED("action.executed"),
    ERROR_OCCURRED("error.occurred");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EventType fromValue(String raw) {
        return Arrays.stream(values())
            .filter(v -> v.value.equals(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + raw));
    }
}
