package com.rpagent.providerconfig.store;

import com.rpagent.providerconfig.ProviderIdentity;
import com.rpagent.providerconfig.ResourceProviderConfig;

import java.nio.file.Path;
import java.util.Objects;

/** A persisted config together with the file it was read from. */
public final class StoredRecord {

    private final Path path;
    private final ResourceProviderConfig config;

    public StoredRecord(Path path, ResourceProviderConfig config) {
        this.path = Objects.requireNonNull(path, "path");
        this.config = Objects.requireNonNull(config, "config");
    }

    public Path getPath() {
        return path;
    }

    public ResourceProviderConfig getConfig() {
        return config;
    }

    public ProviderIdentity getIdentity() {
        return config.identity();
    }

    @Override
    public String toString() {
        return "StoredRecord{path=" + path.getFileName() + ", identity=" + getIdentity() + "}";
    }
}
