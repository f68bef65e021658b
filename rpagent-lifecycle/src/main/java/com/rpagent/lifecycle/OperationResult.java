package com.rpagent.lifecycle;

import com.rpagent.plugin.Capacity;
import com.rpagent.providerconfig.ProviderIdentity;

import java.util.Objects;

/**
 * Outcome of an applied operation. {@code version} increases by one on every applied operation
 * for the identity.
 */
public final class OperationResult {

    private final ProviderIdentity identity;
    private final OperationType operation;
    private final long version;
    private final Capacity oldCapacity;
    private final Capacity newCapacity;

    public OperationResult(ProviderIdentity identity, OperationType operation, long version,
                           Capacity oldCapacity, Capacity newCapacity) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.version = version;
        this.oldCapacity = oldCapacity != null ? oldCapacity : Capacity.EMPTY;
        this.newCapacity = newCapacity != null ? newCapacity : Capacity.EMPTY;
    }

    public ProviderIdentity getIdentity() {
        return identity;
    }

    public OperationType getOperation() {
        return operation;
    }

    public long getVersion() {
        return version;
    }

    public Capacity getOldCapacity() {
        return oldCapacity;
    }

    public Capacity getNewCapacity() {
        return newCapacity;
    }

    @Override
    public String toString() {
        return "OperationResult{" + operation + " " + identity + " v" + version + ", " + oldCapacity + " -> " + newCapacity + "}";
    }
}
