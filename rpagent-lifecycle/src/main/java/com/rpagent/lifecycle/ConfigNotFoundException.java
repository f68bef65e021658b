package com.rpagent.lifecycle;

import com.rpagent.providerconfig.ProviderIdentity;

/** Thrown when updating or removing a config whose identity is not active. */
public final class ConfigNotFoundException extends RuntimeException {

    private final ProviderIdentity identity;

    public ConfigNotFoundException(ProviderIdentity identity) {
        super("Resource provider config " + identity + " not found");
        this.identity = identity;
    }

    public ProviderIdentity getIdentity() {
        return identity;
    }
}
