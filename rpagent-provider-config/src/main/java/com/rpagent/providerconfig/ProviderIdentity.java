package com.rpagent.providerconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a resource provider config: the (type, name) pair. Unique among all active
 * configs on an agent. Never derived from a storage filename.
 */
public final class ProviderIdentity implements Comparable<ProviderIdentity> {

    private static final Comparator<ProviderIdentity> ORDER =
            Comparator.comparing(ProviderIdentity::getType).thenComparing(ProviderIdentity::getName);

    private final String type;
    private final String name;

    @JsonCreator
    public ProviderIdentity(
            @JsonProperty("type") String type,
            @JsonProperty("name") String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = Objects.requireNonNull(name, "name");
    }

    public static ProviderIdentity of(String type, String name) {
        return new ProviderIdentity(type, name);
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    @Override
    public int compareTo(ProviderIdentity o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderIdentity that = (ProviderIdentity) o;
        return type.equals(that.type) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name);
    }

    /** {@code type:name}, as used in log lines. */
    @Override
    public String toString() {
        return type + ":" + name;
    }
}
