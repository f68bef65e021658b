package com.rpagent.lifecycle;

/** Operations applied by {@link LifecycleCoordinator}. */
public enum OperationType {
    ADD,
    UPDATE,
    REMOVE,
    /** Restart of a persisted config at agent startup. */
    RECOVER
}
