package com.rpagent.lifecycle;

import com.rpagent.plugin.Capacity;
import com.rpagent.providerconfig.ResourceProviderConfig;

import java.util.Objects;

/** Snapshot of one configured provider: its persisted config, whether it runs, and its capacity. */
public final class ProviderStatus {

    private final ResourceProviderConfig config;
    private final boolean running;
    private final Capacity capacity;
    private final long version;

    public ProviderStatus(ResourceProviderConfig config, boolean running, Capacity capacity, long version) {
        this.config = Objects.requireNonNull(config, "config");
        this.running = running;
        this.capacity = capacity != null ? capacity : Capacity.EMPTY;
        this.version = version;
    }

    public ResourceProviderConfig getConfig() {
        return config;
    }

    public boolean isRunning() {
        return running;
    }

    public Capacity getCapacity() {
        return capacity;
    }

    public long getVersion() {
        return version;
    }
}
