package com.rpagent.lifecycle;

import com.rpagent.providerconfig.ProviderIdentity;

/** Thrown when adding a config whose identity is already active. */
public final class ConfigConflictException extends RuntimeException {

    private final ProviderIdentity identity;

    public ConfigConflictException(ProviderIdentity identity) {
        super("Resource provider config " + identity + " already exists");
        this.identity = identity;
    }

    public ProviderIdentity getIdentity() {
        return identity;
    }
}
