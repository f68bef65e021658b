package com.rpagent.agent;

import com.rpagent.config.AgentConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agent entry point. Configuration comes from {@code RP_AGENT_*} environment variables.
 * Persisted resource providers are recovered before the API starts listening; the main thread
 * then blocks until shutdown (e.g. Ctrl+C), when plugins are stopped and records kept.
 */
public final class AgentApplication {

    private static final Logger log = LoggerFactory.getLogger(AgentApplication.class);

    private AgentApplication() {
    }

    public static void main(String[] args) throws Exception {
        AgentConfig config = AgentConfig.fromEnvironment();
        AgentContext ctx = AgentBootstrap.initialize(config, new LoggingAllocatorClient());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down agent...");
            ctx.onExit();
        }, "rpagent-shutdown"));

        ctx.start();
        log.info("Agent started | configDir: {} | workDir: {} | port: {} | recovered: {}",
                config.getConfigDir().toAbsolutePath(), config.getWorkDir().toAbsolutePath(),
                ctx.getServer().getPort(), ctx.getRecoveryReport().getRecovered().size());

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down agent...");
            ctx.onExit();
        }
    }
}
