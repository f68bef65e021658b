package com.rpagent.providerconfig.store;

/** I/O failure reading or writing the config directory. */
public final class ConfigStoreException extends RuntimeException {

    public ConfigStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
