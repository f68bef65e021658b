package com.rpagent.lifecycle;

import com.rpagent.lifecycle.offer.TotalResourcesPublisher;
import com.rpagent.plugin.Capacity;
import com.rpagent.plugin.FileSystemPluginEndpoint;
import com.rpagent.plugin.LaunchException;
import com.rpagent.plugin.ProviderInstanceManager;
import com.rpagent.providerconfig.ProviderIdentity;
import com.rpagent.providerconfig.ResourceProviderConfig;
import com.rpagent.providerconfig.codec.PayloadFormat;
import com.rpagent.providerconfig.codec.ProviderConfigCodec;
import com.rpagent.providerconfig.store.ConfigStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LifecycleCoordinatorTest {

    private static final ProviderIdentity TEST = ProviderIdentity.of(FakeCsiPlugin.TYPE, "test");
    private static final long GB = 1L << 30;

    @TempDir
    Path tempDir;

    private Path configDir;
    private FakeCsiPlugin plugin;
    private RecordingAllocator allocator;
    private ConfigStore store;
    private ProviderInstanceManager instances;
    private LifecycleMetrics metrics;
    private LifecycleCoordinator coordinator;

    @BeforeEach
    void setUp() {
        configDir = tempDir.resolve("resource_provider_configs");
        plugin = new FakeCsiPlugin();
        allocator = new RecordingAllocator();
        store = new ConfigStore(configDir);
        instances = new ProviderInstanceManager(tempDir.resolve("work"), plugin, FileSystemPluginEndpoint::new,
                Duration.ofMillis(500), Duration.ofMillis(100), Duration.ofMillis(5));
        metrics = LifecycleMetrics.inMemory();
        coordinator = new LifecycleCoordinator(store, instances, new TotalResourcesPublisher(allocator), metrics);
    }

    @Test
    void add_persistsStartsAndPublishesCapacity() throws Exception {
        OperationResult result = coordinator.add(FakeCsiPlugin.config("test", "volume1:4GB"));

        assertEquals(OperationType.ADD, result.getOperation());
        assertEquals(1, result.getVersion());
        assertEquals(Capacity.of("volume1", 4 * GB), result.getNewCapacity());
        assertEquals(1, recordFiles().size());
        assertTrue(instances.isRunning(TEST));
        assertEquals(List.of("update test v1 {volume1=" + 4 * GB + "}"), allocator.drain());
        assertEquals(1.0, metrics.operationCount(OperationType.ADD, "success"));
    }

    @Test
    void add_conflictsWithHandSeededRecordRegardlessOfFilename() throws Exception {
        Files.writeString(configDir.resolve("test.json"),
                new String(ProviderConfigCodec.encode(FakeCsiPlugin.config("test", "volume1:4GB"), PayloadFormat.JSON)));
        store.rebuildIndex();

        assertThrows(ConfigConflictException.class, () -> coordinator.add(FakeCsiPlugin.config("test", "volume1:8GB")));

        assertEquals(0, plugin.launches.get());
        assertEquals(List.of(configDir.resolve("test.json")), recordFiles());
        assertTrue(allocator.drain().isEmpty());
        assertEquals(1.0, metrics.operationCount(OperationType.ADD, "conflict"));
    }

    @Test
    void add_conflictsWithRecordUnderNameWithoutJsonExtension() throws Exception {
        Files.write(configDir.resolve("my-provider.conf"),
                ProviderConfigCodec.encode(FakeCsiPlugin.config("test", "volume1:4GB"), PayloadFormat.JSON));
        LifecycleCoordinator reopened = new LifecycleCoordinator(new ConfigStore(configDir), instances,
                new TotalResourcesPublisher(allocator), metrics);

        assertThrows(ConfigConflictException.class, () -> reopened.add(FakeCsiPlugin.config("test", "volume1:8GB")));

        assertEquals(0, plugin.launches.get());
        assertEquals(List.of(configDir.resolve("my-provider.conf")), recordFiles());
    }

    @Test
    void add_removesRecordWhenPluginFailsToStart() throws Exception {
        assertThrows(LaunchException.class,
                () -> coordinator.add(FakeCsiPlugin.config("test", "volume1:4GB", "--crash")));

        assertEquals(List.of(), recordFiles());
        assertFalse(instances.isRunning(TEST));
        assertTrue(allocator.drain().isEmpty());
        coordinator.add(FakeCsiPlugin.config("test", "volume1:4GB"));
    }

    @Test
    void update_keepsFilenameRestartsPluginAndRescindsOldOffers() throws Exception {
        coordinator.add(FakeCsiPlugin.config("test", "volume1:4GB"));
        List<Path> filesAfterAdd = recordFiles();
        allocator.drain();

        OperationResult result = coordinator.update(FakeCsiPlugin.config("test", "volume1:2GB,volume2:2GB"));

        assertEquals(filesAfterAdd, recordFiles());
        assertEquals(2, result.getVersion());
        assertEquals(Capacity.of("volume1", 4 * GB), result.getOldCapacity());
        assertEquals(Capacity.of(Map.of("volume1", 2 * GB, "volume2", 2 * GB)), result.getNewCapacity());
        assertEquals(Optional.of(FakeCsiPlugin.config("test", "volume1:2GB,volume2:2GB")), store.get(TEST));
        assertEquals(1, plugin.running.get());
        assertEquals(List.of(
                "rescind test v1 {volume1=" + 4 * GB + "}",
                "update test v2 {volume1=" + 2 * GB + ", volume2=" + 2 * GB + "}"), allocator.drain());
    }

    @Test
    void update_withSameConfigStillRestartsAndRescinds() {
        coordinator.add(FakeCsiPlugin.config("test", "volume1:4GB"));
        allocator.drain();

        coordinator.update(FakeCsiPlugin.config("test", "volume1:4GB"));

        assertEquals(2, plugin.launches.get());
        assertEquals(2, allocator.drain().size());
    }

    @Test
    void updateAndRemove_ofUnknownIdentityAreNotFound() {
        assertThrows(ConfigNotFoundException.class,
                () -> coordinator.update(FakeCsiPlugin.config("test", "volume1:4GB")));
        assertThrows(ConfigNotFoundException.class, () -> coordinator.remove(TEST));

        assertEquals(0, plugin.launches.get());
        assertEquals(0, store.size());
    }

    @Test
    void update_rollsBackToPreviousConfigWhenNewPluginFails() {
        ResourceProviderConfig original = FakeCsiPlugin.config("test", "volume1:4GB");
        coordinator.add(original);
        allocator.drain();

        assertThrows(LaunchException.class,
                () -> coordinator.update(FakeCsiPlugin.config("test", "volume1:8GB", "--crash")));

        assertEquals(Optional.of(original), store.get(TEST));
        assertTrue(instances.isRunning(TEST));
        assertEquals(Capacity.of("volume1", 4 * GB), instances.currentResources(TEST));
        assertEquals(1, plugin.running.get());
    }

    @Test
    void update_leavesNewConfigPersistedWhenRollbackAlsoFails() {
        coordinator.add(FakeCsiPlugin.config("test", "volume1:4GB"));
        allocator.drain();
        plugin.failAll.set(true);

        DegradedStateException e = assertThrows(DegradedStateException.class,
                () -> coordinator.update(FakeCsiPlugin.config("test", "volume1:8GB")));

        assertInstanceOf(LaunchException.class, e.getCause());
        assertEquals(Optional.of(FakeCsiPlugin.config("test", "volume1:8GB")), store.get(TEST));
        assertFalse(instances.isRunning(TEST));
        assertEquals(List.of("rescind test v1 {volume1=" + 4 * GB + "}", "update test v2 {}"), allocator.drain());

        plugin.failAll.set(false);
        OperationResult repaired = coordinator.update(FakeCsiPlugin.config("test", "volume1:8GB"));
        assertEquals(Capacity.of("volume1", 8 * GB), repaired.getNewCapacity());
    }

    @Test
    void remove_stopsPluginDeletesRecordAndPublishesEmptyCapacity() throws Exception {
        coordinator.add(FakeCsiPlugin.config("test", "volume1:4GB"));
        allocator.drain();

        OperationResult result = coordinator.remove(TEST);

        assertEquals(Capacity.EMPTY, result.getNewCapacity());
        assertEquals(List.of(), recordFiles());
        assertEquals(0, plugin.running.get());
        assertEquals(List.of("rescind test v1 {volume1=" + 4 * GB + "}", "update test v2 {}"), allocator.drain());
        assertThrows(ConfigNotFoundException.class, () -> coordinator.remove(TEST));
    }

    @Test
    void concurrentAddsOfSameIdentity_exactlyOneWins() throws Exception {
        plugin.startDelay = Duration.ofMillis(20);
        int n = 6;
        ExecutorService pool = Executors.newFixedThreadPool(n);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<OperationResult>> futures = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                futures.add(pool.submit(awaiting(go, () -> coordinator.add(FakeCsiPlugin.config("test", "volume1:4GB")))));
            }
            go.countDown();
            int ok = 0;
            int conflicts = 0;
            for (Future<OperationResult> f : futures) {
                try {
                    f.get(10, TimeUnit.SECONDS);
                    ok++;
                } catch (ExecutionException e) {
                    assertInstanceOf(ConfigConflictException.class, e.getCause());
                    conflicts++;
                }
            }
            assertEquals(1, ok);
            assertEquals(n - 1, conflicts);
            assertEquals(1, plugin.running.get());
            assertEquals(1, recordFiles().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void differentIdentitiesProceedIndependently() throws Exception {
        int n = 8;
        ExecutorService pool = Executors.newFixedThreadPool(n);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<OperationResult>> futures = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                String name = "rp" + i;
                futures.add(pool.submit(awaiting(go, () -> coordinator.add(FakeCsiPlugin.config(name, "volume1:1GB")))));
            }
            go.countDown();
            for (Future<OperationResult> f : futures) {
                assertEquals(1, f.get(10, TimeUnit.SECONDS).getVersion());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(n, store.size());
        assertEquals(n, coordinator.describe().size());
        assertTrue(coordinator.describe().stream().allMatch(ProviderStatus::isRunning));
    }

    @Test
    void recover_startsPersistedConfigOnceAndPublishes() {
        store.put(TEST, FakeCsiPlugin.config("test", "volume1:4GB"));

        OperationResult first = coordinator.recover(FakeCsiPlugin.config("test", "volume1:4GB"));
        OperationResult second = coordinator.recover(FakeCsiPlugin.config("test", "volume1:4GB"));

        assertEquals(1, first.getVersion());
        assertEquals(1, second.getVersion());
        assertEquals(1, plugin.launches.get());
        assertEquals(List.of("update test v1 {volume1=" + 4 * GB + "}"), allocator.drain());
    }

    private static <T> Callable<T> awaiting(CountDownLatch go, Callable<T> action) {
        return () -> {
            go.await();
            return action.call();
        };
    }

    private List<Path> recordFiles() throws Exception {
        try (Stream<Path> files = Files.list(configDir)) {
            return files.filter(p -> !p.getFileName().toString().startsWith(".")).sorted().collect(Collectors.toList());
        }
    }
}
