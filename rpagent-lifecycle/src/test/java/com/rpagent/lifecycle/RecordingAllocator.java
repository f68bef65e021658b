package com.rpagent.lifecycle;

import com.rpagent.lifecycle.offer.AllocatorClient;
import com.rpagent.plugin.Capacity;
import com.rpagent.providerconfig.ProviderIdentity;

import java.util.ArrayList;
import java.util.List;

/** Allocator that records calls as {@code "rescind <identity> v<version> <capacity>"} lines. */
final class RecordingAllocator implements AllocatorClient {

    final List<String> calls = new ArrayList<>();

    @Override
    public synchronized void rescindOffers(ProviderIdentity identity, Capacity capacity, long version) {
        calls.add("rescind " + identity.getName() + " v" + version + " " + capacity);
    }

    @Override
    public synchronized void updateTotalResources(ProviderIdentity identity, Capacity capacity, long version) {
        calls.add("update " + identity.getName() + " v" + version + " " + capacity);
    }

    synchronized List<String> drain() {
        List<String> out = new ArrayList<>(calls);
        calls.clear();
        return out;
    }
}
