package com.rpagent.plugin;

import com.rpagent.providerconfig.ServiceRole;

import java.io.IOException;
import java.util.Set;

/** Communication endpoint of a launched plugin: service readiness and advertised capacity. */
public interface PluginEndpoint {

    /** Services that have reported ready so far. */
    Set<ServiceRole> readyServices() throws IOException;

    /**
     * Capacity the plugin currently advertises.
     *
     * @throws IOException when the plugin has not published capacity or it cannot be read
     */
    Capacity queryCapacity() throws IOException;
}
