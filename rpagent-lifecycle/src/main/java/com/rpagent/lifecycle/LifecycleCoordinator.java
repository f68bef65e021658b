package com.rpagent.lifecycle;

import com.rpagent.lifecycle.offer.OfferImpact;
import com.rpagent.lifecycle.offer.ResourceUpdatePublisher;
import com.rpagent.plugin.Capacity;
import com.rpagent.plugin.LaunchException;
import com.rpagent.plugin.ProviderInstance;
import com.rpagent.plugin.ProviderInstanceManager;
import com.rpagent.plugin.StopException;
import com.rpagent.providerconfig.ProviderIdentity;
import com.rpagent.providerconfig.ResourceProviderConfig;
import com.rpagent.providerconfig.store.ConfigStore;
import com.rpagent.providerconfig.store.ConfigStoreException;
import com.rpagent.providerconfig.store.CorruptRecordException;
import com.rpagent.providerconfig.store.PutOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Applies add, update and remove of resource provider configs. For each identity, operations
 * are serialized in arrival order; the persisted record and the running instance change
 * together, and every applied operation publishes one {@link OfferImpact}.
 * <p>
 * Configs passed in must already be validated.
 */
public final class LifecycleCoordinator {

    private static final Logger log = LoggerFactory.getLogger(LifecycleCoordinator.class);

    private final ConfigStore store;
    private final ProviderInstanceManager instances;
    private final ResourceUpdatePublisher publisher;
    private final LifecycleMetrics metrics;
    private final IdentityLocks locks = new IdentityLocks();
    private final Map<ProviderIdentity, Long> versions = new ConcurrentHashMap<>();

    public LifecycleCoordinator(ConfigStore store, ProviderInstanceManager instances,
                                ResourceUpdatePublisher publisher, LifecycleMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.instances = Objects.requireNonNull(instances, "instances");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Persists a new config and starts its plugin.
     *
     * @throws ConfigConflictException when the identity is already active
     * @throws LaunchException when the plugin does not come up (the record is removed again)
     */
    public OperationResult add(ResourceProviderConfig config) {
        ProviderIdentity identity = config.identity();
        return locks.withLock(identity, () -> {
            try {
                OperationResult result = doAdd(identity, config);
                metrics.recordOperation(OperationType.ADD, "success");
                return result;
            } catch (RuntimeException e) {
                metrics.recordOperation(OperationType.ADD, outcome(e));
                throw e;
            }
        });
    }

    /**
     * Replaces an active config and restarts its plugin with the new definition. If the new
     * plugin fails to start, the previous config is restarted and restored.
     *
     * @throws ConfigNotFoundException when the identity is not active
     * @throws LaunchException when the new plugin failed and the previous config was restored
     * @throws DegradedStateException when neither the new nor the previous plugin could start
     * @throws StopException when the running plugin could not be stopped (previous record restored)
     */
    public OperationResult update(ResourceProviderConfig config) {
        ProviderIdentity identity = config.identity();
        return locks.withLock(identity, () -> {
            try {
                OperationResult result = doUpdate(identity, config);
                metrics.recordOperation(OperationType.UPDATE, "success");
                return result;
            } catch (RuntimeException e) {
                metrics.recordOperation(OperationType.UPDATE, outcome(e));
                throw e;
            }
        });
    }

    /**
     * Stops the provider's plugin and deletes its record.
     *
     * @throws ConfigNotFoundException when the identity is not active
     * @throws StopException when the plugin could not be stopped (nothing changed)
     */
    public OperationResult remove(ProviderIdentity identity) {
        return locks.withLock(identity, () -> {
            try {
                OperationResult result = doRemove(identity);
                metrics.recordOperation(OperationType.REMOVE, "success");
                return result;
            } catch (RuntimeException e) {
                metrics.recordOperation(OperationType.REMOVE, outcome(e));
                throw e;
            }
        });
    }

    /**
     * Starts a persisted config found at startup, unless an instance already runs for it.
     *
     * @throws LaunchException when the plugin does not come up (the record is kept)
     */
    public OperationResult recover(ResourceProviderConfig config) {
        ProviderIdentity identity = config.identity();
        return locks.withLock(identity, () -> {
            Optional<ProviderInstance> running = instances.instance(identity);
            if (running.isPresent()) {
                Capacity capacity = running.get().getCapacity();
                return new OperationResult(identity, OperationType.RECOVER, currentVersion(identity), capacity, capacity);
            }
            try {
                ProviderInstance instance = start(config);
                long version = nextVersion(identity);
                publish(new OfferImpact(identity, Capacity.EMPTY, instance.getCapacity()));
                metrics.recordOperation(OperationType.RECOVER, "success");
                return new OperationResult(identity, OperationType.RECOVER, version, Capacity.EMPTY, instance.getCapacity());
            } catch (RuntimeException e) {
                metrics.recordOperation(OperationType.RECOVER, outcome(e));
                throw e;
            }
        });
    }

    /** Every persisted provider with its running state and capacity, ordered by identity. */
    public List<ProviderStatus> describe() {
        List<ProviderStatus> out = new ArrayList<>();
        for (ProviderIdentity identity : store.identities()) {
            try {
                store.get(identity).ifPresent(config -> out.add(new ProviderStatus(config,
                        instances.isRunning(identity), instances.currentResources(identity), currentVersion(identity))));
            } catch (CorruptRecordException e) {
                log.warn("Skipping {} in listing: {}", identity, e.getMessage());
            }
        }
        return out;
    }

    private OperationResult doAdd(ProviderIdentity identity, ResourceProviderConfig config) {
        if (store.contains(identity)) {
            throw new ConfigConflictException(identity);
        }
        PutOutcome outcome = store.put(identity, config);
        if (outcome != PutOutcome.CREATED) {
            log.warn("Record for {} appeared concurrently; replaced it", identity);
        }
        ProviderInstance instance;
        try {
            instance = start(config);
        } catch (LaunchException e) {
            try {
                store.remove(identity);
            } catch (ConfigStoreException removeFailure) {
                e.addSuppressed(removeFailure);
                log.error("Failed to remove record of {} after launch failure; it will be retried at restart",
                        identity, removeFailure);
            }
            throw e;
        }
        long version = nextVersion(identity);
        publish(new OfferImpact(identity, Capacity.EMPTY, instance.getCapacity()));
        log.info("Added resource provider {} (version {})", identity, version);
        return new OperationResult(identity, OperationType.ADD, version, Capacity.EMPTY, instance.getCapacity());
    }

    private OperationResult doUpdate(ProviderIdentity identity, ResourceProviderConfig config) {
        if (!store.contains(identity)) {
            throw new ConfigNotFoundException(identity);
        }
        ResourceProviderConfig previous = readPrevious(identity);
        Capacity oldCapacity = instances.currentResources(identity);

        store.put(identity, config);
        try {
            instances.stop(identity);
        } catch (StopException e) {
            restoreRecord(identity, previous, e);
            throw e;
        }

        try {
            ProviderInstance instance = start(config);
            long version = nextVersion(identity);
            publish(new OfferImpact(identity, oldCapacity, instance.getCapacity()));
            log.info("Updated resource provider {} (version {})", identity, version);
            return new OperationResult(identity, OperationType.UPDATE, version, oldCapacity, instance.getCapacity());
        } catch (LaunchException launchFailure) {
            throw rollBack(identity, previous, oldCapacity, launchFailure);
        }
    }

    /**
     * Restarts the previous config after the new one failed. Returns the exception to throw:
     * the launch failure when the previous state is back, a degraded-state error otherwise.
     */
    private RuntimeException rollBack(ProviderIdentity identity, ResourceProviderConfig previous,
                                      Capacity oldCapacity, LaunchException launchFailure) {
        if (previous == null) {
            nextVersion(identity);
            publish(new OfferImpact(identity, oldCapacity, Capacity.EMPTY));
            return new DegradedStateException(identity, "new config failed to start and no previous config is readable",
                    launchFailure);
        }
        log.warn("New config of {} failed to start; restarting previous config: {}", identity, launchFailure.getMessage());
        ProviderInstance restored;
        try {
            restored = start(previous);
        } catch (LaunchException restartFailure) {
            nextVersion(identity);
            publish(new OfferImpact(identity, oldCapacity, Capacity.EMPTY));
            DegradedStateException degraded = new DegradedStateException(identity,
                    "new config failed to start and previous config failed to restart", launchFailure);
            degraded.addSuppressed(restartFailure);
            log.error("Resource provider {} left without a running instance", identity, degraded);
            return degraded;
        }
        nextVersion(identity);
        publish(new OfferImpact(identity, oldCapacity, restored.getCapacity()));
        try {
            store.put(identity, previous);
        } catch (ConfigStoreException e) {
            DegradedStateException degraded = new DegradedStateException(identity,
                    "previous config restarted but its record could not be restored", launchFailure);
            degraded.addSuppressed(e);
            return degraded;
        }
        return launchFailure;
    }

    private OperationResult doRemove(ProviderIdentity identity) {
        if (!store.contains(identity)) {
            throw new ConfigNotFoundException(identity);
        }
        Capacity oldCapacity = instances.currentResources(identity);
        instances.stop(identity);
        long version = nextVersion(identity);
        publish(new OfferImpact(identity, oldCapacity, Capacity.EMPTY));
        store.remove(identity);
        log.info("Removed resource provider {} (version {})", identity, version);
        return new OperationResult(identity, OperationType.REMOVE, version, oldCapacity, Capacity.EMPTY);
    }

    private ProviderInstance start(ResourceProviderConfig config) {
        return metrics.timeLaunch(() -> instances.start(config));
    }

    private ResourceProviderConfig readPrevious(ProviderIdentity identity) {
        try {
            return store.get(identity).orElse(null);
        } catch (CorruptRecordException e) {
            log.warn("Previous record of {} is unreadable; update cannot roll back: {}", identity, e.getMessage());
            return null;
        }
    }

    private void restoreRecord(ProviderIdentity identity, ResourceProviderConfig previous, RuntimeException failure) {
        if (previous == null) {
            return;
        }
        try {
            store.put(identity, previous);
        } catch (ConfigStoreException e) {
            failure.addSuppressed(e);
            log.error("Failed to restore previous record of {}", identity, e);
        }
    }

    private void publish(OfferImpact impact) {
        try {
            publisher.publish(impact);
        } catch (RuntimeException e) {
            log.error("Failed to publish {}: {}", impact, e.getMessage(), e);
        }
    }

    private long nextVersion(ProviderIdentity identity) {
        return versions.merge(identity, 1L, Long::sum);
    }

    private long currentVersion(ProviderIdentity identity) {
        return versions.getOrDefault(identity, 0L);
    }

    private static String outcome(RuntimeException e) {
        if (e instanceof ConfigConflictException) return "conflict";
        if (e instanceof ConfigNotFoundException) return "not_found";
        if (e instanceof DegradedStateException) return "degraded";
        if (e instanceof LaunchException) return "launch_failed";
        if (e instanceof StopException) return "stop_failed";
        return "error";
    }
}
