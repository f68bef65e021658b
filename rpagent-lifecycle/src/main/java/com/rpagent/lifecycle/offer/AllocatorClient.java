package com.rpagent.lifecycle.offer;

import com.rpagent.plugin.Capacity;
import com.rpagent.providerconfig.ProviderIdentity;

/** Upstream allocator as seen by the agent: offer rescission and total resource updates. */
public interface AllocatorClient {

    /** Rescinds every outstanding offer built on the given capacity version of the provider. */
    void rescindOffers(ProviderIdentity identity, Capacity capacity, long version);

    /** Reports the provider's new total; {@link Capacity#EMPTY} once it is removed. */
    void updateTotalResources(ProviderIdentity identity, Capacity capacity, long version);
}
