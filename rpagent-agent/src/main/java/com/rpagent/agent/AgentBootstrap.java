package com.rpagent.agent;

import com.rpagent.api.AgentApiServlet;
import com.rpagent.api.AgentHttpServer;
import com.rpagent.api.CallDispatcher;
import com.rpagent.config.AgentConfig;
import com.rpagent.lifecycle.LifecycleCoordinator;
import com.rpagent.lifecycle.LifecycleMetrics;
import com.rpagent.lifecycle.RecoveryReport;
import com.rpagent.lifecycle.RecoveryScanner;
import com.rpagent.lifecycle.offer.AllocatorClient;
import com.rpagent.lifecycle.offer.TotalResourcesPublisher;
import com.rpagent.plugin.FileSystemPluginEndpoint;
import com.rpagent.plugin.PluginLauncher;
import com.rpagent.plugin.ProcessPluginLauncher;
import com.rpagent.plugin.ProviderInstanceManager;
import com.rpagent.providerconfig.store.ConfigStore;
import com.rpagent.providerconfig.validation.ConfigValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the agent from its {@link AgentConfig}: opens the config store, creates the plugin
 * manager and lifecycle coordinator, runs startup recovery, and prepares the API server.
 * Recovery completes before the returned context can serve any call.
 */
public final class AgentBootstrap {

    private static final Logger log = LoggerFactory.getLogger(AgentBootstrap.class);

    private AgentBootstrap() {
    }

    /** Bootstrap with plugins launched as OS processes. */
    public static AgentContext initialize(AgentConfig config, AllocatorClient allocator) {
        return initialize(config, allocator, new ProcessPluginLauncher());
    }

    static AgentContext initialize(AgentConfig config, AllocatorClient allocator, PluginLauncher launcher) {
        log.info("Bootstrap: {}", config);
        ConfigStore store = new ConfigStore(config.getConfigDir());
        ProviderInstanceManager instances = new ProviderInstanceManager(config.getWorkDir(), launcher,
                FileSystemPluginEndpoint::new, config.getPluginReadyTimeout(), config.getPluginStopGracePeriod());
        LifecycleMetrics metrics = new LifecycleMetrics(new SimpleMeterRegistry());
        LifecycleCoordinator coordinator = new LifecycleCoordinator(store, instances,
                new TotalResourcesPublisher(allocator), metrics);
        ConfigValidator validator = new ConfigValidator(config.getAllowedTypePrefixes());

        log.info("Bootstrap: recovering persisted resource providers from {}", config.getConfigDir().toAbsolutePath());
        RecoveryReport report = new RecoveryScanner(store, instances, coordinator, validator).recover();
        if (!report.getFailed().isEmpty()) {
            log.warn("Bootstrap: {} resource provider(s) failed to recover: {}", report.getFailed().size(),
                    report.getFailed().keySet());
        }

        ExecutorService operations = Executors.newFixedThreadPool(config.getOperationThreads(),
                namedThreads("rpagent-operation-"));
        CallDispatcher dispatcher = new CallDispatcher(validator, coordinator, operations);
        AgentHttpServer server = new AgentHttpServer(config.getHttpPort(), new AgentApiServlet(dispatcher));
        return new AgentContext(config, store, instances, coordinator, metrics, report, operations, server);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + counter.incrementAndGet());
            t.setDaemon(false);
            return t;
        };
    }
}
