package com.rpagent.providerconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Command launching a plugin container.
 * <ul>
 *   <li>{@code shell=true}: {@code value} is run through {@code /bin/sh -c}; arguments are ignored.</li>
 *   <li>{@code shell=false}: {@code value} is the executable and {@code arguments} is its full argv,
 *       so {@code arguments[0]} is argv[0] (conventionally the executable path again).</li>
 * </ul>
 */
@JsonPropertyOrder({"shell", "value", "arguments", "environment"})
public final class CommandSpec {

    private final boolean shell;
    private final String value;
    private final List<String> arguments;
    private final Map<String, String> environment;

    @JsonCreator
    public CommandSpec(
            @JsonProperty("shell") Boolean shell,
            @JsonProperty("value") String value,
            @JsonProperty("arguments") List<String> arguments,
            @JsonProperty("environment") Map<String, String> environment) {
        this.shell = shell != null && shell;
        this.value = value;
        this.arguments = arguments != null ? List.copyOf(arguments) : List.of();
        this.environment = environment != null && !environment.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(environment))
                : Map.of();
    }

    /** Non-shell command with the given executable and argv. */
    public static CommandSpec exec(String value, List<String> arguments) {
        return new CommandSpec(false, value, arguments, null);
    }

    public boolean isShell() {
        return shell;
    }

    public String getValue() {
        return value;
    }

    public List<String> getArguments() {
        return arguments;
    }

    /** Extra environment for the plugin process; never null. */
    public Map<String, String> getEnvironment() {
        return environment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CommandSpec that = (CommandSpec) o;
        return shell == that.shell && Objects.equals(value, that.value)
                && Objects.equals(arguments, that.arguments) && Objects.equals(environment, that.environment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shell, value, arguments, environment);
    }

    @Override
    public String toString() {
        return "CommandSpec{shell=" + shell + ", value=" + value + ", arguments=" + arguments + "}";
    }
}
