package com.rpagent.providerconfig.validation;

import com.rpagent.providerconfig.PluginContainer;
import com.rpagent.providerconfig.PluginSpec;
import com.rpagent.providerconfig.Reservation;
import com.rpagent.providerconfig.ResourceProviderConfig;
import com.rpagent.providerconfig.ServiceRole;
import com.rpagent.providerconfig.codec.PayloadFormat;
import com.rpagent.providerconfig.codec.ProviderConfigCodec;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a resource provider config before anything is persisted or launched.
 * Checks run in a fixed order so the first error is deterministic:
 * required fields, type prefix, provider name, plugin identity, containers, service roles,
 * reservations.
 */
public final class ConfigValidator {

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9._-]+");

    private final List<String> allowedTypePrefixes;

    public ConfigValidator(List<String> allowedTypePrefixes) {
        Objects.requireNonNull(allowedTypePrefixes, "allowedTypePrefixes");
        if (allowedTypePrefixes.isEmpty()) {
            throw new IllegalArgumentException("allowedTypePrefixes must not be empty");
        }
        this.allowedTypePrefixes = List.copyOf(allowedTypePrefixes);
    }

    /**
     * Decodes and validates a raw payload.
     *
     * @return the validated config
     * @throws ConfigValidationException when the payload does not parse or a check fails
     */
    public ResourceProviderConfig validate(byte[] payload, PayloadFormat format) {
        ResourceProviderConfig config;
        try {
            config = ProviderConfigCodec.decode(payload, format);
        } catch (UncheckedIOException e) {
            throw new ConfigValidationException("Malformed " + format + " config: " + rootMessage(e), e);
        }
        return requireValid(config);
    }

    /** Validates an already decoded config; throws with the first error. */
    public ResourceProviderConfig requireValid(ResourceProviderConfig config) {
        ValidationResult result = validate(config);
        if (!result.isValid()) {
            throw new ConfigValidationException(result);
        }
        return config;
    }

    public ValidationResult validate(ResourceProviderConfig config) {
        if (config == null) {
            return ValidationResult.failure("Config is missing");
        }
        List<String> errors = new ArrayList<>();
        if (isBlank(config.getType())) {
            errors.add("Missing 'type'");
        }
        if (isBlank(config.getName())) {
            errors.add("Missing 'name'");
        }
        PluginSpec plugin = config.getPlugin();
        if (plugin == null) {
            errors.add("Missing 'storage.plugin'");
        }
        if (!errors.isEmpty()) {
            return ValidationResult.failure(errors);
        }

        if (allowedTypePrefixes.stream().noneMatch(p -> config.getType().startsWith(p))) {
            errors.add("Type '" + config.getType() + "' does not start with an allowed prefix " + allowedTypePrefixes);
        }
        if (!isSafeName(config.getName())) {
            errors.add("Name '" + config.getName() + "' must match [A-Za-z0-9._-]+ and not be '.' or '..'");
        }

        if (isBlank(plugin.getType())) {
            errors.add("Missing 'storage.plugin.type'");
        }
        if (isBlank(plugin.getName())) {
            errors.add("Missing 'storage.plugin.name'");
        } else if (!isSafeName(plugin.getName())) {
            errors.add("Plugin name '" + plugin.getName() + "' must match [A-Za-z0-9._-]+ and not be '.' or '..'");
        }

        checkContainers(plugin, errors);

        List<Reservation> reservations = config.getDefaultReservations();
        for (int i = 0; i < reservations.size(); i++) {
            Reservation r = reservations.get(i);
            if (r == null || isBlank(r.getRole())) {
                errors.add("default_reservations[" + i + "] is missing 'role'");
            }
        }

        return errors.isEmpty() ? ValidationResult.success() : ValidationResult.failure(errors);
    }

    /** Null containers and unknown service names are rejected while decoding, before these checks. */
    private static void checkContainers(PluginSpec plugin, List<String> errors) {
        List<PluginContainer> containers = plugin.getContainers();
        if (containers.isEmpty()) {
            errors.add("Plugin '" + plugin.getName() + "' declares no containers");
            return;
        }
        List<String> duplicates = new ArrayList<>();
        Set<ServiceRole> seen = EnumSet.noneOf(ServiceRole.class);
        for (int i = 0; i < containers.size(); i++) {
            PluginContainer c = containers.get(i);
            if (c.getCommand() == null || isBlank(c.getCommand().getValue())) {
                errors.add("containers[" + i + "] is missing 'command.value'");
            }
            if (c.getServices().isEmpty()) {
                errors.add("containers[" + i + "] declares no services");
            }
            for (ServiceRole role : c.getServices()) {
                if (!seen.add(role)) {
                    duplicates.add("Service " + role + " is declared more than once");
                }
            }
        }
        errors.addAll(duplicates);
    }

    static boolean isSafeName(String name) {
        return name != null && SAFE_NAME.matcher(name).matches() && !".".equals(name) && !"..".equals(name);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String rootMessage(Throwable t) {
        Throwable cur = t;
        while (cur.getCause() != null && cur.getCause() != cur) {
            cur = cur.getCause();
        }
        String msg = cur.getMessage();
        if (msg == null) {
            return cur.getClass().getSimpleName();
        }
        int nl = msg.indexOf('\n');
        return nl > 0 ? msg.substring(0, nl) : msg;
    }
}
