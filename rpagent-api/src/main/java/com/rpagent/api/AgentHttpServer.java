package com.rpagent.api;

import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/** Embedded Jetty hosting {@link AgentApiServlet} at {@value #API_PATH}. */
public final class AgentHttpServer implements AutoCloseable {

    public static final String API_PATH = "/api/v1";

    private static final Logger log = LoggerFactory.getLogger(AgentHttpServer.class);

    private final Server server;
    private final ServerConnector connector;

    /**
     * @param port listening port; 0 picks a free one (see {@link #getPort()} after start)
     */
    public AgentHttpServer(int port, AgentApiServlet servlet) {
        Objects.requireNonNull(servlet, "servlet");
        server = new Server();
        connector = new ServerConnector(server);
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler();
        context.setContextPath("/");
        context.addServlet(new ServletHolder("agent-api", servlet), API_PATH);
        server.setHandler(context);
        server.setStopAtShutdown(false);
    }

    public void start() throws Exception {
        server.start();
        log.info("Agent API listening on port {} at {}", getPort(), API_PATH);
    }

    /** Actual listening port, or -1 before start. */
    public int getPort() {
        return connector.getLocalPort();
    }

    public boolean isRunning() {
        return server.isRunning();
    }

    @Override
    public void close() throws Exception {
        if (server.isRunning() || server.isStarting()) {
            server.stop();
            log.info("Agent API stopped");
        }
    }
}
