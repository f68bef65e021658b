package com.rpagent.providerconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Storage section of a resource provider config; holds the plugin launch spec. */
public final class StorageSpec {

    private final PluginSpec plugin;

    @JsonCreator
    public StorageSpec(@JsonProperty("plugin") PluginSpec plugin) {
        this.plugin = plugin;
    }

    public PluginSpec getPlugin() {
        return plugin;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(plugin, ((StorageSpec) o).plugin);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(plugin);
    }

    @Override
    public String toString() {
        return "StorageSpec{plugin=" + plugin + "}";
    }
}
