package com.rpagent.providerconfig.store;

/** Result of {@link ConfigStore#put}. */
public enum PutOutcome {
    CREATED,
    REPLACED
}
