package com.rpagent.providerconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Storage plugin backing a resource provider: plugin type and name, and the containers
 * (processes) to launch. Each container serves one or more {@link ServiceRole}s.
 */
@JsonPropertyOrder({"type", "name", "containers"})
public final class PluginSpec {

    private final String type;
    private final String name;
    private final List<PluginContainer> containers;

    @JsonCreator
    public PluginSpec(
            @JsonProperty("type") String type,
            @JsonProperty("name") String name,
            @JsonProperty("containers") List<PluginContainer> containers) {
        this.type = type;
        this.name = name;
        this.containers = containers != null ? List.copyOf(containers) : List.of();
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public List<PluginContainer> getContainers() {
        return containers;
    }

    /** All services declared across containers, in declaration order. */
    @JsonIgnore
    public Set<ServiceRole> getServices() {
        Set<ServiceRole> services = new LinkedHashSet<>();
        for (PluginContainer container : containers) {
            services.addAll(container.getServices());
        }
        return services;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginSpec that = (PluginSpec) o;
        return Objects.equals(type, that.type) && Objects.equals(name, that.name)
                && Objects.equals(containers, that.containers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, containers);
    }

    @Override
    public String toString() {
        return "PluginSpec{type=" + type + ", name=" + name + ", containers=" + containers + "}";
    }
}
