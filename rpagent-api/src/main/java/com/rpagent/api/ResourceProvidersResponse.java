package com.rpagent.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rpagent.lifecycle.ProviderStatus;
import com.rpagent.plugin.Capacity;
import com.rpagent.providerconfig.ResourceProviderConfig;

import java.util.List;
import java.util.stream.Collectors;

/** 200 body of {@code GET_RESOURCE_PROVIDERS}. */
public final class ResourceProvidersResponse {

    private final List<Entry> resourceProviders;

    @JsonCreator
    public ResourceProvidersResponse(@JsonProperty("resource_providers") List<Entry> resourceProviders) {
        this.resourceProviders = resourceProviders != null ? List.copyOf(resourceProviders) : List.of();
    }

    static ResourceProvidersResponse of(List<ProviderStatus> statuses) {
        return new ResourceProvidersResponse(statuses.stream()
                .map(s -> new Entry(s.getConfig(), s.isRunning(), s.getCapacity(), s.getVersion()))
                .collect(Collectors.toList()));
    }

    @JsonProperty("resource_providers")
    public List<Entry> getResourceProviders() {
        return resourceProviders;
    }

    public static final class Entry {

        private final ResourceProviderConfig info;
        private final boolean running;
        private final Capacity capacity;
        private final long version;

        @JsonCreator
        public Entry(
                @JsonProperty("info") ResourceProviderConfig info,
                @JsonProperty("running") boolean running,
                @JsonProperty("capacity") Capacity capacity,
                @JsonProperty("version") long version) {
            this.info = info;
            this.running = running;
            this.capacity = capacity != null ? capacity : Capacity.EMPTY;
            this.version = version;
        }

        public ResourceProviderConfig getInfo() {
            return info;
        }

        public boolean isRunning() {
            return running;
        }

        public Capacity getCapacity() {
            return capacity;
        }

        public long getVersion() {
            return version;
        }
    }
}
