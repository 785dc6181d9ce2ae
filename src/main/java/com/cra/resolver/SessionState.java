package com.cra.resolver;

public enum SessionState {
    CREATED,
    ACTIVE,
    ENDED
}
