package com.rpagent.providerconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** One plugin process: the services it serves and the command that launches it. */
@JsonPropertyOrder({"services", "command"})
public final class PluginContainer {

    private final List<ServiceRole> services;
    private final CommandSpec command;

    @JsonCreator
    public PluginContainer(
            @JsonProperty("services") List<ServiceRole> services,
            @JsonProperty("command") CommandSpec command) {
        this.services = services != null ? List.copyOf(services) : List.of();
        this.command = command;
    }

    public List<ServiceRole> getServices() {
        return services;
    }

    public CommandSpec getCommand() {
        return command;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PluginContainer that = (PluginContainer) o;
        return Objects.equals(services, that.services) && Objects.equals(command, that.command);
    }

    @Override
    public int hashCode() {
        return Objects.hash(services, command);
    }

    @Override
    public String toString() {
        return "PluginContainer{services=" + services + ", command=" + command + "}";
    }
}
