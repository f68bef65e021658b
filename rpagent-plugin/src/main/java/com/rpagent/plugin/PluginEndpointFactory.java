package com.rpagent.plugin;

import java.nio.file.Path;

/** Opens the endpoint of a plugin instance given its endpoint directory. */
@FunctionalInterface
public interface PluginEndpointFactory {

    PluginEndpoint open(Path endpointDir);
}
