package com.rpagent.providerconfig.store;

/** Result of {@link ConfigStore#remove}. */
public enum RemoveOutcome {
    REMOVED,
    NOT_FOUND
}
