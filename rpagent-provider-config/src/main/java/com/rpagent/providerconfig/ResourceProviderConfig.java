package com.rpagent.providerconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Definition of one resource provider on the agent: identity (type, name), the reservations
 * applied to everything it advertises, and the storage plugin that backs it.
 * Immutable; equality is structural so a persisted copy compares equal to what was written.
 */
@JsonPropertyOrder({"type", "name", "default_reservations", "storage"})
public final class ResourceProviderConfig {

    private final String type;
    private final String name;
    private final List<Reservation> defaultReservations;
    private final StorageSpec storage;

    @JsonCreator
    public ResourceProviderConfig(
            @JsonProperty("type") String type,
            @JsonProperty("name") String name,
            @JsonProperty("default_reservations") List<Reservation> defaultReservations,
            @JsonProperty("storage") StorageSpec storage) {
        this.type = type;
        this.name = name;
        this.defaultReservations = defaultReservations != null ? List.copyOf(defaultReservations) : List.of();
        this.storage = storage;
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    /** Identity of this config. Requires type and name to be set (i.e. after validation). */
    @JsonIgnore
    public ProviderIdentity identity() {
        return new ProviderIdentity(type, name);
    }

    @JsonProperty("default_reservations")
    public List<Reservation> getDefaultReservations() {
        return defaultReservations;
    }

    public StorageSpec getStorage() {
        return storage;
    }

    /** Plugin spec under {@code storage.plugin}, or null when absent. */
    @JsonIgnore
    public PluginSpec getPlugin() {
        return storage != null ? storage.getPlugin() : null;
    }

    /** Returns a copy with the given storage spec (identity and reservations kept). */
    public ResourceProviderConfig withStorage(StorageSpec storage) {
        return new ResourceProviderConfig(type, name, defaultReservations, storage);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ResourceProviderConfig that = (ResourceProviderConfig) o;
        return Objects.equals(type, that.type) && Objects.equals(name, that.name)
                && Objects.equals(defaultReservations, that.defaultReservations)
                && Objects.equals(storage, that.storage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, defaultReservations, storage);
    }

    @Override
    public String toString() {
        return "ResourceProviderConfig{type=" + type + ", name=" + name + ", defaultReservations="
                + defaultReservations + ", storage=" + storage + "}";
    }
}
