package com.rpagent.plugin;

import com.rpagent.providerconfig.ServiceRole;
import com.rpagent.providerconfig.codec.PayloadFormat;
import com.rpagent.providerconfig.codec.ProviderConfigCodec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Endpoint backed by the instance's endpoint directory. A plugin reports a service ready by
 * creating {@code <SERVICE>.ready} (e.g. {@code NODE_SERVICE.ready}) and publishes capacity as
 * {@code capacity.json}, an object of source id to bytes or size string. Capacity must be written
 * before the last ready marker.
 */
public final class FileSystemPluginEndpoint implements PluginEndpoint {

    public static final String CAPACITY_FILE = "capacity.json";
    public static final String READY_SUFFIX = ".ready";

    private final Path endpointDir;

    public FileSystemPluginEndpoint(Path endpointDir) {
        this.endpointDir = Objects.requireNonNull(endpointDir, "endpointDir");
    }

    public static Path readyFile(Path endpointDir, ServiceRole service) {
        return endpointDir.resolve(service.name() + READY_SUFFIX);
    }

    @Override
    public Set<ServiceRole> readyServices() {
        Set<ServiceRole> ready = EnumSet.noneOf(ServiceRole.class);
        for (ServiceRole service : ServiceRole.values()) {
            if (Files.exists(readyFile(endpointDir, service))) {
                ready.add(service);
            }
        }
        return ready;
    }

    @Override
    public Capacity queryCapacity() throws IOException {
        byte[] bytes = Files.readAllBytes(endpointDir.resolve(CAPACITY_FILE));
        try {
            return ProviderConfigCodec.read(bytes, PayloadFormat.JSON, Capacity.class);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}
