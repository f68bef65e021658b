package com.rpagent.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.rpagent.lifecycle.OperationResult;
import com.rpagent.lifecycle.OperationType;
import com.rpagent.plugin.Capacity;

/** 200 body of add, update and remove calls. */
@JsonPropertyOrder({"type", "name", "operation", "version", "old_capacity", "new_capacity"})
public final class OperationResponse {

    private final String type;
    private final String name;
    private final OperationType operation;
    private final long version;
    private final Capacity oldCapacity;
    private final Capacity newCapacity;

    @JsonCreator
    public OperationResponse(
            @JsonProperty("type") String type,
            @JsonProperty("name") String name,
            @JsonProperty("operation") OperationType operation,
            @JsonProperty("version") long version,
            @JsonProperty("old_capacity") Capacity oldCapacity,
            @JsonProperty("new_capacity") Capacity newCapacity) {
        this.type = type;
        this.name = name;
        this.operation = operation;
        this.version = version;
        this.oldCapacity = oldCapacity != null ? oldCapacity : Capacity.EMPTY;
        this.newCapacity = newCapacity != null ? newCapacity : Capacity.EMPTY;
    }

    static OperationResponse of(OperationResult result) {
        return new OperationResponse(result.getIdentity().getType(), result.getIdentity().getName(),
                result.getOperation(), result.getVersion(), result.getOldCapacity(), result.getNewCapacity());
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public OperationType getOperation() {
        return operation;
    }

    public long getVersion() {
        return version;
    }

    @JsonProperty("old_capacity")
    public Capacity getOldCapacity() {
        return oldCapacity;
    }

    @JsonProperty("new_capacity")
    public Capacity getNewCapacity() {
        return newCapacity;
    }
}
