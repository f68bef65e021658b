package com.rpagent.lifecycle.offer;

import com.rpagent.plugin.Capacity;
import com.rpagent.providerconfig.ProviderIdentity;

import java.util.Objects;

/**
 * Change of one provider's advertised capacity caused by an applied operation. Outstanding
 * offers built on {@code oldCapacity} must be rescinded before {@code newCapacity} is offered.
 * Transient; never persisted.
 */
public final class OfferImpact {

    private final ProviderIdentity identity;
    private final Capacity oldCapacity;
    private final Capacity newCapacity;

    public OfferImpact(ProviderIdentity identity, Capacity oldCapacity, Capacity newCapacity) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.oldCapacity = oldCapacity != null ? oldCapacity : Capacity.EMPTY;
        this.newCapacity = newCapacity != null ? newCapacity : Capacity.EMPTY;
    }

    public ProviderIdentity getIdentity() {
        return identity;
    }

    public Capacity getOldCapacity() {
        return oldCapacity;
    }

    public Capacity getNewCapacity() {
        return newCapacity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OfferImpact that = (OfferImpact) o;
        return identity.equals(that.identity) && oldCapacity.equals(that.oldCapacity)
                && newCapacity.equals(that.newCapacity);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identity, oldCapacity, newCapacity);
    }

    @Override
    public String toString() {
        return "OfferImpact{identity=" + identity + ", old=" + oldCapacity + ", new=" + newCapacity + "}";
    }
}
