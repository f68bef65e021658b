package com.rpagent.agent;

import com.rpagent.api.AgentHttpServer;
import com.rpagent.config.AgentConfig;
import com.rpagent.lifecycle.LifecycleCoordinator;
import com.rpagent.lifecycle.LifecycleMetrics;
import com.rpagent.lifecycle.RecoveryReport;
import com.rpagent.plugin.ProviderInstanceManager;
import com.rpagent.plugin.ResourceCleanup;
import com.rpagent.providerconfig.store.ConfigStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Components wired by {@link AgentBootstrap}. The API server is created but not started; call
 * {@link #start()} once recovery has run, and {@link #onExit()} on shutdown.
 */
public final class AgentContext implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(AgentContext.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final AgentConfig config;
    private final ConfigStore store;
    private final ProviderInstanceManager instances;
    private final LifecycleCoordinator coordinator;
    private final LifecycleMetrics metrics;
    private final RecoveryReport recoveryReport;
    private final ExecutorService operations;
    private final AgentHttpServer server;
    private final AtomicBoolean exited = new AtomicBoolean();

    AgentContext(AgentConfig config, ConfigStore store, ProviderInstanceManager instances,
                 LifecycleCoordinator coordinator, LifecycleMetrics metrics, RecoveryReport recoveryReport,
                 ExecutorService operations, AgentHttpServer server) {
        this.config = config;
        this.store = store;
        this.instances = instances;
        this.coordinator = coordinator;
        this.metrics = metrics;
        this.recoveryReport = recoveryReport;
        this.operations = operations;
        this.server = server;
    }

    public AgentConfig getConfig() {
        return config;
    }

    public ConfigStore getStore() {
        return store;
    }

    public ProviderInstanceManager getInstances() {
        return instances;
    }

    public LifecycleCoordinator getCoordinator() {
        return coordinator;
    }

    public LifecycleMetrics getMetrics() {
        return metrics;
    }

    public RecoveryReport getRecoveryReport() {
        return recoveryReport;
    }

    public AgentHttpServer getServer() {
        return server;
    }

    /** Starts serving the API. */
    public void start() throws Exception {
        server.start();
    }

    /**
     * Stops accepting calls, lets in-flight operations finish, then stops every plugin. Persisted
     * records are kept so the next start recovers them. Runs once; later calls return at once.
     */
    @Override
    public void onExit() {
        if (!exited.compareAndSet(false, true)) {
            return;
        }
        try {
            server.close();
        } catch (Exception e) {
            log.error("Error stopping API server: {}", e.getMessage(), e);
        }
        operations.shutdown();
        try {
            if (!operations.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Operations still running after {}s; stopping plugins anyway", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        instances.onExit();
    }
}
