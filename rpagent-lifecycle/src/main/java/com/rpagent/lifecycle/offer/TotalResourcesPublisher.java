package com.rpagent.lifecycle.offer;

import com.rpagent.plugin.Capacity;
import com.rpagent.providerconfig.ProviderIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Keeps the node's per-provider totals and drives the {@link AllocatorClient}: offers on the old
 * capacity version are always rescinded before the new total is announced, so at most one offer
 * version per provider is outstanding. Allocator failures are logged; they never undo the change.
 */
public final class TotalResourcesPublisher implements ResourceUpdatePublisher {

    private static final Logger log = LoggerFactory.getLogger(TotalResourcesPublisher.class);

    private final AllocatorClient allocator;
    private final Map<ProviderIdentity, Versioned> totals = new TreeMap<>();

    public TotalResourcesPublisher(AllocatorClient allocator) {
        this.allocator = Objects.requireNonNull(allocator, "allocator");
    }

    @Override
    public synchronized void publish(OfferImpact impact) {
        ProviderIdentity identity = impact.getIdentity();
        Versioned current = totals.get(identity);
        long nextVersion = current != null ? current.version + 1 : 1;
        if (current != null) {
            try {
                allocator.rescindOffers(identity, current.capacity, current.version);
            } catch (RuntimeException e) {
                log.error("Failed to rescind offers of {} version {}: {}", identity, current.version, e.getMessage(), e);
            }
        }
        totals.put(identity, new Versioned(impact.getNewCapacity(), nextVersion));
        try {
            allocator.updateTotalResources(identity, impact.getNewCapacity(), nextVersion);
        } catch (RuntimeException e) {
            log.error("Failed to update total resources of {} to {}: {}", identity, impact.getNewCapacity(),
                    e.getMessage(), e);
        }
        log.info("Published {} (offer version {})", impact, nextVersion);
    }

    /** Current capacity per provider, including providers that were removed (as empty). */
    public synchronized Map<ProviderIdentity, Capacity> totals() {
        Map<ProviderIdentity, Capacity> out = new TreeMap<>();
        totals.forEach((id, v) -> out.put(id, v.capacity));
        return Collections.unmodifiableMap(out);
    }

    /** Latest offer version of the provider, 0 when never published. */
    public synchronized long version(ProviderIdentity identity) {
        Versioned v = totals.get(identity);
        return v != null ? v.version : 0;
    }

    private static final class Versioned {
        final Capacity capacity;
        final long version;

        Versioned(Capacity capacity, long version) {
            this.capacity = capacity;
            this.version = version;
        }
    }
}
