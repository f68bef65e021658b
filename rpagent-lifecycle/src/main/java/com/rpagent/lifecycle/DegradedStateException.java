package com.rpagent.lifecycle;

import com.rpagent.providerconfig.ProviderIdentity;

/**
 * Thrown when an update could start neither the new config nor the previous one. The new config
 * stays persisted and no instance runs for the identity until a later update, remove or restart.
 */
public final class DegradedStateException extends RuntimeException {

    private final ProviderIdentity identity;

    public DegradedStateException(ProviderIdentity identity, String message, Throwable cause) {
        super("Resource provider " + identity + " is degraded: " + message, cause);
        this.identity = identity;
    }

    public ProviderIdentity getIdentity() {
        return identity;
    }
}
