package com.rpagent.lifecycle;

import com.rpagent.plugin.ProviderInstanceManager;
import com.rpagent.providerconfig.ProviderIdentity;
import com.rpagent.providerconfig.store.ConfigStore;
import com.rpagent.providerconfig.store.StoredRecord;
import com.rpagent.providerconfig.validation.ConfigValidator;
import com.rpagent.providerconfig.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Brings the agent back to its persisted state at startup, before any request is served:
 * removes temp files and plugin leftovers of the previous run, rebuilds the record index, then
 * starts every persisted config. A record that cannot be parsed, validated or started is logged
 * and reported; it never stops recovery of the others.
 */
public final class RecoveryScanner {

    private static final Logger log = LoggerFactory.getLogger(RecoveryScanner.class);

    private final ConfigStore store;
    private final ProviderInstanceManager instances;
    private final LifecycleCoordinator coordinator;
    private final ConfigValidator validator;

    public RecoveryScanner(ConfigStore store, ProviderInstanceManager instances,
                           LifecycleCoordinator coordinator, ConfigValidator validator) {
        this.store = Objects.requireNonNull(store, "store");
        this.instances = Objects.requireNonNull(instances, "instances");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public RecoveryReport recover() {
        int tempFiles = store.purgeTempFiles();
        int staleDirs = instances.cleanupStaleWorkDirs();
        store.rebuildIndex();

        List<Path> unreadable = new ArrayList<>();
        List<StoredRecord> records = store.listAll(unreadable::add).collect(Collectors.toList());
        List<ProviderIdentity> recovered = new ArrayList<>();
        Map<ProviderIdentity, String> failed = new LinkedHashMap<>();
        for (StoredRecord record : records) {
            ProviderIdentity identity = record.getIdentity();
            Optional<Path> indexed = store.recordPath(identity);
            if (indexed.isEmpty() || !indexed.get().equals(record.getPath())) {
                continue;
            }
            ValidationResult validation = validator.validate(record.getConfig());
            if (!validation.isValid()) {
                log.warn("Not starting resource provider {} from {}: {}", identity, record.getPath().getFileName(),
                        validation.firstError());
                failed.put(identity, validation.firstError());
                continue;
            }
            try {
                coordinator.recover(record.getConfig());
                recovered.add(identity);
            } catch (RuntimeException e) {
                log.warn("Failed to recover resource provider {}: {}", identity, e.getMessage());
                failed.put(identity, e.getMessage());
            }
        }
        RecoveryReport report = new RecoveryReport(tempFiles, staleDirs, recovered, failed, unreadable);
        log.info("Recovery finished: {}", report);
        return report;
    }
}
