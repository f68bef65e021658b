package com.rpagent.plugin;

import com.rpagent.providerconfig.PluginContainer;
import com.rpagent.providerconfig.ProviderIdentity;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/** Everything a {@link PluginLauncher} needs to start one container of a provider instance. */
public final class LaunchRequest {

    /** Directory the plugin publishes readiness and capacity to. */
    public static final String ENV_ENDPOINT_DIR = "PLUGIN_ENDPOINT_DIR";
    /** Private working directory of the instance. */
    public static final String ENV_WORK_DIR = "PLUGIN_WORK_DIR";
    /** Comma-separated services this container serves. */
    public static final String ENV_SERVICES = "PLUGIN_SERVICES";

    private final ProviderIdentity identity;
    private final int containerIndex;
    private final PluginContainer container;
    private final Path workDir;
    private final Path endpointDir;
    private final Map<String, String> environment;

    public LaunchRequest(ProviderIdentity identity, int containerIndex, PluginContainer container,
                         Path workDir, Path endpointDir) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.containerIndex = containerIndex;
        this.container = Objects.requireNonNull(container, "container");
        this.workDir = Objects.requireNonNull(workDir, "workDir");
        this.endpointDir = Objects.requireNonNull(endpointDir, "endpointDir");
        Map<String, String> env = new LinkedHashMap<>(container.getCommand().getEnvironment());
        env.put(ENV_ENDPOINT_DIR, endpointDir.toAbsolutePath().toString());
        env.put(ENV_WORK_DIR, workDir.toAbsolutePath().toString());
        env.put(ENV_SERVICES, container.getServices().stream().map(Enum::name).collect(Collectors.joining(",")));
        this.environment = Collections.unmodifiableMap(env);
    }

    public ProviderIdentity getIdentity() {
        return identity;
    }

    public int getContainerIndex() {
        return containerIndex;
    }

    public PluginContainer getContainer() {
        return container;
    }

    public Path getWorkDir() {
        return workDir;
    }

    public Path getEndpointDir() {
        return endpointDir;
    }

    /** Command environment plus the plugin endpoint variables; the latter win on conflict. */
    public Map<String, String> getEnvironment() {
        return environment;
    }
}
