package com.rpagent.providerconfig;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Default reservation applied to resources advertised by a provider: type, role, optional principal. */
@JsonPropertyOrder({"type", "role", "principal"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Reservation {

    private final ReservationType type;
    private final String role;
    private final String principal;

    @JsonCreator
    public Reservation(
            @JsonProperty("type") ReservationType type,
            @JsonProperty("role") String role,
            @JsonProperty("principal") String principal) {
        this.type = type;
        this.role = role;
        this.principal = principal;
    }

    public static Reservation dynamic(String role) {
        return new Reservation(ReservationType.DYNAMIC, role, null);
    }

    public ReservationType getType() {
        return type;
    }

    public String getRole() {
        return role;
    }

    /** Principal the reservation is made on behalf of; null when unset. */
    public String getPrincipal() {
        return principal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Reservation that = (Reservation) o;
        return type == that.type && Objects.equals(role, that.role) && Objects.equals(principal, that.principal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, role, principal);
    }

    @Override
    public String toString() {
        return "Reservation{type=" + type + ", role=" + role + (principal != null ? ", principal=" + principal : "") + "}";
    }
}
