package com.rpagent.plugin;

import com.rpagent.providerconfig.ProviderIdentity;

/** Thrown when a plugin process is still alive after SIGTERM, the grace period and a forced kill. */
public final class StopException extends RuntimeException {

    private final ProviderIdentity identity;

    public StopException(ProviderIdentity identity, String message) {
        super("Failed to stop resource provider " + identity + ": " + message);
        this.identity = identity;
    }

    public ProviderIdentity getIdentity() {
        return identity;
    }
}
