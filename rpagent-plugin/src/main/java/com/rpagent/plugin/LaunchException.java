package com.rpagent.plugin;

import com.rpagent.providerconfig.ProviderIdentity;

/**
 * Thrown when a plugin for a resource provider could not be brought up: a process failed to
 * start or exited early, a service never reported ready, or capacity could not be read.
 * Every process started for the attempt has been killed and its working directory removed.
 */
public final class LaunchException extends RuntimeException {

    private final ProviderIdentity identity;

    public LaunchException(ProviderIdentity identity, String message) {
        this(identity, message, null);
    }

    public LaunchException(ProviderIdentity identity, String message, Throwable cause) {
        super("Failed to launch resource provider " + identity + ": " + message, cause);
        this.identity = identity;
    }

    public ProviderIdentity getIdentity() {
        return identity;
    }
}
