package com.rpagent.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the resource provider agent.
 * <p>
 * Directories: RP_AGENT_CONFIG_DIR (persisted resource provider configs, one file each) and
 * RP_AGENT_WORK_DIR (plugin working and endpoint directories). HTTP: RP_AGENT_HTTP_PORT.
 * Validation: RP_AGENT_ALLOWED_TYPE_PREFIXES (comma-separated). Plugin lifecycle:
 * RP_AGENT_PLUGIN_READY_TIMEOUT_SECONDS, RP_AGENT_PLUGIN_STOP_GRACE_SECONDS.
 * Request handling: RP_AGENT_OPERATION_THREADS.
 */
public final class AgentConfig {

    private static final String ENV_CONFIG_DIR = "RP_AGENT_CONFIG_DIR";
    private static final String ENV_WORK_DIR = "RP_AGENT_WORK_DIR";
    private static final String ENV_HTTP_PORT = "RP_AGENT_HTTP_PORT";
    private static final String ENV_ALLOWED_TYPE_PREFIXES = "RP_AGENT_ALLOWED_TYPE_PREFIXES";
    private static final String ENV_PLUGIN_READY_TIMEOUT_SECONDS = "RP_AGENT_PLUGIN_READY_TIMEOUT_SECONDS";
    private static final String ENV_PLUGIN_STOP_GRACE_SECONDS = "RP_AGENT_PLUGIN_STOP_GRACE_SECONDS";
    private static final String ENV_OPERATION_THREADS = "RP_AGENT_OPERATION_THREADS";

    private static final String DEFAULT_CONFIG_DIR = "resource_provider_configs";
    private static final String DEFAULT_WORK_DIR = "work";
    private static final int DEFAULT_HTTP_PORT = 5051;
    /** Provider types accepted when RP_AGENT_ALLOWED_TYPE_PREFIXES is unset. */
    public static final List<String> DEFAULT_ALLOWED_TYPE_PREFIXES = List.of("org.apache.mesos.rp.");
    private static final int DEFAULT_PLUGIN_READY_TIMEOUT_SECONDS = 60;
    private static final int DEFAULT_PLUGIN_STOP_GRACE_SECONDS = 10;
    private static final int DEFAULT_OPERATION_THREADS = 8;

    private final Path configDir;
    private final Path workDir;
    private final int httpPort;
    private final List<String> allowedTypePrefixes;
    private final Duration pluginReadyTimeout;
    private final Duration pluginStopGracePeriod;
    private final int operationThreads;

    private AgentConfig(Builder b) {
        this.configDir = b.configDir;
        this.workDir = b.workDir;
        this.httpPort = b.httpPort;
        this.allowedTypePrefixes = Collections.unmodifiableList(new ArrayList<>(b.allowedTypePrefixes));
        this.pluginReadyTimeout = b.pluginReadyTimeout;
        this.pluginStopGracePeriod = b.pluginStopGracePeriod;
        this.operationThreads = b.operationThreads;
    }

    /** Directory holding persisted resource provider configs. Default {@code resource_provider_configs}. */
    public Path getConfigDir() {
        return configDir;
    }

    /** Root of plugin working directories ({@code <workDir>/<type>/<name>/<instanceId>}). Default {@code work}. */
    public Path getWorkDir() {
        return workDir;
    }

    /** Port of the agent HTTP API. 0 binds an ephemeral port. Default 5051. */
    public int getHttpPort() {
        return httpPort;
    }

    /** Resource provider type prefixes accepted by validation. Never empty. */
    public List<String> getAllowedTypePrefixes() {
        return allowedTypePrefixes;
    }

    /** How long a launched plugin may take to report all of its services ready. Default 60s. */
    public Duration getPluginReadyTimeout() {
        return pluginReadyTimeout;
    }

    /** How long a plugin may take to exit after SIGTERM before it is killed. Default 10s. */
    public Duration getPluginStopGracePeriod() {
        return pluginStopGracePeriod;
    }

    /** Threads executing add/update/remove operations on behalf of API calls. Default 8. */
    public int getOperationThreads() {
        return operationThreads;
    }

    public static AgentConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds configuration from the given variables (normally {@link System#getenv()}).
     * Unset, blank or unparsable values fall back to defaults.
     */
    public static AgentConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        List<String> prefixes = parseCommaSeparated(env.get(ENV_ALLOWED_TYPE_PREFIXES));
        if (prefixes.isEmpty()) {
            prefixes = DEFAULT_ALLOWED_TYPE_PREFIXES;
        }
        return builder()
                .configDir(Path.of(getEnv(env, ENV_CONFIG_DIR, DEFAULT_CONFIG_DIR)))
                .workDir(Path.of(getEnv(env, ENV_WORK_DIR, DEFAULT_WORK_DIR)))
                .httpPort(parseInt(env.get(ENV_HTTP_PORT), DEFAULT_HTTP_PORT))
                .allowedTypePrefixes(prefixes)
                .pluginReadyTimeout(Duration.ofSeconds(
                        parsePositive(env.get(ENV_PLUGIN_READY_TIMEOUT_SECONDS), DEFAULT_PLUGIN_READY_TIMEOUT_SECONDS)))
                .pluginStopGracePeriod(Duration.ofSeconds(
                        parsePositive(env.get(ENV_PLUGIN_STOP_GRACE_SECONDS), DEFAULT_PLUGIN_STOP_GRACE_SECONDS)))
                .operationThreads(parseInt(env.get(ENV_OPERATION_THREADS), DEFAULT_OPERATION_THREADS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static int parsePositive(String value, int defaultValue) {
        int parsed = parseInt(value, defaultValue);
        return parsed > 0 ? parsed : defaultValue;
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "AgentConfig{configDir=" + configDir + ", workDir=" + workDir + ", httpPort=" + httpPort
                + ", allowedTypePrefixes=" + allowedTypePrefixes + ", pluginReadyTimeout=" + pluginReadyTimeout
                + ", pluginStopGracePeriod=" + pluginStopGracePeriod + ", operationThreads=" + operationThreads + "}";
    }

    public static final class Builder {
        private Path configDir = Path.of(DEFAULT_CONFIG_DIR);
        private Path workDir = Path.of(DEFAULT_WORK_DIR);
        private int httpPort = DEFAULT_HTTP_PORT;
        private List<String> allowedTypePrefixes = DEFAULT_ALLOWED_TYPE_PREFIXES;
        private Duration pluginReadyTimeout = Duration.ofSeconds(DEFAULT_PLUGIN_READY_TIMEOUT_SECONDS);
        private Duration pluginStopGracePeriod = Duration.ofSeconds(DEFAULT_PLUGIN_STOP_GRACE_SECONDS);
        private int operationThreads = DEFAULT_OPERATION_THREADS;

        public Builder configDir(Path configDir) {
            this.configDir = Objects.requireNonNull(configDir, "configDir");
            return this;
        }

        public Builder workDir(Path workDir) {
            this.workDir = Objects.requireNonNull(workDir, "workDir");
            return this;
        }

        public Builder httpPort(int httpPort) {
            if (httpPort < 0 || httpPort > 65535) {
                throw new IllegalArgumentException("httpPort out of range: " + httpPort);
            }
            this.httpPort = httpPort;
            return this;
        }

        public Builder allowedTypePrefixes(List<String> allowedTypePrefixes) {
            this.allowedTypePrefixes = allowedTypePrefixes != null && !allowedTypePrefixes.isEmpty()
                    ? new ArrayList<>(allowedTypePrefixes)
                    : DEFAULT_ALLOWED_TYPE_PREFIXES;
            return this;
        }

        public Builder pluginReadyTimeout(Duration pluginReadyTimeout) {
            this.pluginReadyTimeout = positive(pluginReadyTimeout, "pluginReadyTimeout");
            return this;
        }

        public Builder pluginStopGracePeriod(Duration pluginStopGracePeriod) {
            this.pluginStopGracePeriod = positive(pluginStopGracePeriod, "pluginStopGracePeriod");
            return this;
        }

        public Builder operationThreads(int operationThreads) {
            this.operationThreads = Math.max(1, operationThreads);
            return this;
        }

        public AgentConfig build() {
            return new AgentConfig(this);
        }

        private static Duration positive(Duration d, String name) {
            Objects.requireNonNull(d, name);
            if (d.isNegative() || d.isZero()) {
                throw new IllegalArgumentException(name + " must be positive: " + d);
            }
            return d;
        }
    }
}
