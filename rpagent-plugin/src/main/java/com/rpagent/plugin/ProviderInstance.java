package com.rpagent.plugin;

import com.rpagent.providerconfig.ProviderIdentity;
import com.rpagent.providerconfig.ResourceProviderConfig;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** A running resource provider: its plugin processes, directories and the capacity captured at start. */
public final class ProviderInstance {

    private final String instanceId;
    private final ResourceProviderConfig config;
    private final Path workDir;
    private final Path endpointDir;
    private final List<PluginProcess> processes;
    private final Capacity capacity;
    private final Instant startedAt;

    ProviderInstance(String instanceId, ResourceProviderConfig config, Path workDir, Path endpointDir,
                     List<PluginProcess> processes, Capacity capacity, Instant startedAt) {
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.config = Objects.requireNonNull(config, "config");
        this.workDir = workDir;
        this.endpointDir = endpointDir;
        this.processes = List.copyOf(processes);
        this.capacity = capacity != null ? capacity : Capacity.EMPTY;
        this.startedAt = startedAt;
    }

    public ProviderIdentity getIdentity() {
        return config.identity();
    }

    public String getInstanceId() {
        return instanceId;
    }

    public ResourceProviderConfig getConfig() {
        return config;
    }

    public Path getWorkDir() {
        return workDir;
    }

    public Path getEndpointDir() {
        return endpointDir;
    }

    public List<PluginProcess> getProcesses() {
        return processes;
    }

    public Capacity getCapacity() {
        return capacity;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public boolean isAlive() {
        return processes.stream().allMatch(PluginProcess::isAlive);
    }

    @Override
    public String toString() {
        return "ProviderInstance{identity=" + getIdentity() + ", instanceId=" + instanceId
                + ", capacity=" + capacity + "}";
    }
}
