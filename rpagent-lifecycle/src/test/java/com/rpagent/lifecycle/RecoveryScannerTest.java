package com.rpagent.lifecycle;

import com.rpagent.lifecycle.offer.TotalResourcesPublisher;
import com.rpagent.plugin.Capacity;
import com.rpagent.plugin.FileSystemPluginEndpoint;
import com.rpagent.plugin.ProviderInstanceManager;
import com.rpagent.providerconfig.ProviderIdentity;
import com.rpagent.providerconfig.ResourceProviderConfig;
import com.rpagent.providerconfig.store.ConfigStore;
import com.rpagent.providerconfig.validation.ConfigValidator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecoveryScannerTest {

    private static final long GB = 1L << 30;

    @TempDir
    Path tempDir;

    @Test
    void recover_restartsPersistedProvidersAndClearsLeftovers() throws Exception {
        Path configDir = tempDir.resolve("configs");
        Path workRoot = tempDir.resolve("work");
        ConfigStore previousRun = new ConfigStore(configDir);
        previousRun.put(ProviderIdentity.of(FakeCsiPlugin.TYPE, "a"), FakeCsiPlugin.config("a", "volume1:1GB"));
        previousRun.put(ProviderIdentity.of(FakeCsiPlugin.TYPE, "b"), FakeCsiPlugin.config("b", "volume1:2GB", "--crash"));
        previousRun.put(ProviderIdentity.of("com.example.rp", "c"),
                new ResourceProviderConfig("com.example.rp", "c", List.of(),
                        FakeCsiPlugin.config("c", "volume1:1GB").getStorage()));
        Files.writeString(configDir.resolve("broken.json"), "{");
        Files.writeString(configDir.resolve(".a.json.0000.tmp"), "{\"type\":");
        Path staleDir = Files.createDirectories(workRoot.resolve(FakeCsiPlugin.TYPE).resolve("a").resolve("old-instance"));
        Files.writeString(staleDir.resolve("pid"), "");

        FakeCsiPlugin plugin = new FakeCsiPlugin();
        RecordingAllocator allocator = new RecordingAllocator();
        ConfigStore store = new ConfigStore(configDir);
        ProviderInstanceManager instances = new ProviderInstanceManager(workRoot, plugin, FileSystemPluginEndpoint::new,
                Duration.ofMillis(500), Duration.ofMillis(100), Duration.ofMillis(5));
        LifecycleCoordinator coordinator = new LifecycleCoordinator(store, instances,
                new TotalResourcesPublisher(allocator), LifecycleMetrics.inMemory());
        RecoveryScanner scanner = new RecoveryScanner(store, instances, coordinator,
                new ConfigValidator(List.of("org.apache.mesos.rp.")));

        RecoveryReport report = scanner.recover();

        ProviderIdentity a = ProviderIdentity.of(FakeCsiPlugin.TYPE, "a");
        assertEquals(List.of(a), report.getRecovered());
        assertEquals(2, report.getFailed().size());
        assertTrue(report.getFailed().containsKey(ProviderIdentity.of(FakeCsiPlugin.TYPE, "b")));
        assertTrue(report.getFailed().containsKey(ProviderIdentity.of("com.example.rp", "c")));
        assertEquals(List.of(configDir.resolve("broken.json")), report.getUnreadable());
        assertEquals(1, report.getTempFilesPurged());
        assertEquals(1, report.getStaleWorkDirsRemoved());
        assertFalse(Files.exists(staleDir));
        assertEquals(Capacity.of("volume1", GB), instances.currentResources(a));
        assertEquals(List.of("update a v1 {volume1=" + GB + "}"), allocator.drain());
        assertEquals(3, store.size());
    }
}
