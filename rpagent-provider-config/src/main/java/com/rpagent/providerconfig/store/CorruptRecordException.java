package com.rpagent.providerconfig.store;

import java.nio.file.Path;

/**
 * Thrown when a persisted record cannot be parsed as a resource provider config, or its content
 * no longer carries the identity it is indexed under.
 */
public final class CorruptRecordException extends RuntimeException {

    private final Path path;

    public CorruptRecordException(Path path, String message, Throwable cause) {
        super("Corrupt resource provider record " + path + ": " + message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
