package com.rpagent.agent;

import com.rpagent.lifecycle.offer.AllocatorClient;
import com.rpagent.plugin.Capacity;
import com.rpagent.providerconfig.ProviderIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Allocator client for an agent running without a master connection: records each rescission
 * and total-resources update in the log.
 */
public final class LoggingAllocatorClient implements AllocatorClient {

    private static final Logger log = LoggerFactory.getLogger(LoggingAllocatorClient.class);

    @Override
    public void rescindOffers(ProviderIdentity identity, Capacity capacity, long version) {
        log.info("Rescind offers of {} version {} ({})", identity, version, capacity);
    }

    @Override
    public void updateTotalResources(ProviderIdentity identity, Capacity capacity, long version) {
        log.info("Total resources of {} version {}: {}", identity, version, capacity);
    }
}
