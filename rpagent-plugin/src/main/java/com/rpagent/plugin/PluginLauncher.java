package com.rpagent.plugin;

import java.io.IOException;

/** Starts plugin container processes. */
public interface PluginLauncher {

    /**
     * Starts the container described by the request. Returns once the process exists; readiness
     * is checked separately through the endpoint.
     *
     * @throws IOException when the process cannot be started
     */
    PluginProcess launch(LaunchRequest request) throws IOException;
}
