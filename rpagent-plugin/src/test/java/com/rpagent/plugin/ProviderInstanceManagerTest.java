package com.rpagent.plugin;

import com.rpagent.providerconfig.CommandSpec;
import com.rpagent.providerconfig.PluginContainer;
import com.rpagent.providerconfig.PluginSpec;
import com.rpagent.providerconfig.ProviderIdentity;
import com.rpagent.providerconfig.Reservation;
import com.rpagent.providerconfig.ResourceProviderConfig;
import com.rpagent.providerconfig.ServiceRole;
import com.rpagent.providerconfig.StorageSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderInstanceManagerTest {

    private static final String TYPE = "org.apache.mesos.rp.local.storage";
    private static final ProviderIdentity TEST = ProviderIdentity.of(TYPE, "test");
    private static final long GB = 1L << 30;

    @TempDir
    Path workRoot;

    private FakePluginLauncher launcher;
    private ProviderInstanceManager manager;

    @BeforeEach
    void setUp() {
        launcher = new FakePluginLauncher();
        manager = new ProviderInstanceManager(workRoot, launcher, FileSystemPluginEndpoint::new,
                Duration.ofMillis(300), Duration.ofMillis(100), Duration.ofMillis(10));
    }

    @Test
    void start_waitsForReadinessAndCapturesCapacity() throws Exception {
        ProviderInstance instance = manager.start(config("test", "volume1:4GB"));

        assertEquals(Capacity.of("volume1", 4 * GB), instance.getCapacity());
        assertEquals(Capacity.of("volume1", 4 * GB), manager.currentResources(TEST));
        assertTrue(manager.isRunning(TEST));
        assertEquals(workRoot.resolve(TYPE).resolve("test").resolve(instance.getInstanceId()), instance.getWorkDir());
        assertTrue(Files.isDirectory(instance.getEndpointDir()));
        assertEquals(String.valueOf(instance.getProcesses().get(0).pid()),
                Files.readString(instance.getWorkDir().resolve("pid")).trim());
    }

    @Test
    void start_passesEndpointEnvironmentToPlugin() {
        manager.start(config("test", "volume1:4GB"));

        Map<String, String> env = launcher.requests.get(0).getEnvironment();
        assertEquals("debug", env.get("LOG_LEVEL"));
        assertEquals("CONTROLLER_SERVICE,NODE_SERVICE", env.get(LaunchRequest.ENV_SERVICES));
        assertTrue(env.get(LaunchRequest.ENV_ENDPOINT_DIR).endsWith("endpoint"));
    }

    @Test
    void start_timesOutAndCleansUpWhenServicesNeverReady() {
        launcher.mode = FakePluginLauncher.Mode.NEVER_READY;

        LaunchException e = assertThrows(LaunchException.class, () -> manager.start(config("test", "volume1:4GB")));

        assertTrue(e.getMessage().contains("not ready"));
        assertLeftNothingBehind();
    }

    @Test
    void start_failsWhenPluginExitsEarly() {
        launcher.mode = FakePluginLauncher.Mode.EXIT_EARLY;

        LaunchException e = assertThrows(LaunchException.class, () -> manager.start(config("test", "volume1:4GB")));

        assertTrue(e.getMessage().contains("exited"));
        assertLeftNothingBehind();
    }

    @Test
    void start_failsWhenProcessCannotBeStarted() {
        launcher.mode = FakePluginLauncher.Mode.FAIL_TO_START;

        assertThrows(LaunchException.class, () -> manager.start(config("test", "volume1:4GB")));
        assertLeftNothingBehind();
    }

    @Test
    void start_killsEarlierContainersWhenLaterOneFails() {
        CommandSpec cmd = CommandSpec.exec("/bin/plugin", List.of("/bin/plugin", "--volumes=volume1:1GB"));
        PluginSpec plugin = new PluginSpec("org.apache.mesos.csi.test", "p", List.of(
                new PluginContainer(List.of(ServiceRole.CONTROLLER_SERVICE), cmd),
                new PluginContainer(List.of(ServiceRole.NODE_SERVICE), cmd)));
        ResourceProviderConfig config = new ResourceProviderConfig(TYPE, "test", List.of(), new StorageSpec(plugin));
        PluginLauncher failingSecond = request -> {
            if (request.getContainerIndex() == 1) {
                throw new java.io.IOException("exec failed");
            }
            return launcher.launch(request);
        };
        manager = new ProviderInstanceManager(workRoot, failingSecond, FileSystemPluginEndpoint::new,
                Duration.ofMillis(300), Duration.ofMillis(100), Duration.ofMillis(10));

        assertThrows(LaunchException.class, () -> manager.start(config));

        assertTrue(launcher.launched.get(0).killed);
        assertLeftNothingBehind();
    }

    @Test
    void start_rejectsSecondInstanceForSameIdentity() {
        manager.start(config("test", "volume1:4GB"));

        assertThrows(LaunchException.class, () -> manager.start(config("test", "volume1:4GB")));
        assertEquals(1, launcher.alive().size());
    }

    @Test
    void stop_isIdempotentAndRemovesWorkDir() {
        ProviderInstance instance = manager.start(config("test", "volume1:4GB"));

        manager.stop(TEST);
        manager.stop(TEST);

        assertFalse(manager.isRunning(TEST));
        assertEquals(Capacity.EMPTY, manager.currentResources(TEST));
        assertFalse(Files.exists(instance.getWorkDir()));
        assertTrue(launcher.launched.get(0).terminated);
        assertFalse(launcher.launched.get(0).killed);
    }

    @Test
    void stop_escalatesToKillAfterGracePeriod() {
        launcher.mode = FakePluginLauncher.Mode.IGNORE_SIGTERM;
        manager.start(config("test", "volume1:4GB"));

        manager.stop(TEST);

        assertTrue(launcher.launched.get(0).killed);
        assertFalse(manager.isRunning(TEST));
    }

    @Test
    void stop_failsAndKeepsInstanceWhenProcessSurvivesKill() {
        launcher.mode = FakePluginLauncher.Mode.UNKILLABLE;
        manager.start(config("test", "volume1:4GB"));

        assertThrows(StopException.class, () -> manager.stop(TEST));
        assertTrue(manager.instance(TEST).isPresent());
    }

    @Test
    void restartGetsFreshWorkDir() {
        ProviderInstance first = manager.start(config("test", "volume1:4GB"));
        manager.stop(TEST);
        ProviderInstance second = manager.start(config("test", "volume1:2GB,volume2:2GB"));

        assertFalse(first.getWorkDir().equals(second.getWorkDir()));
        assertEquals(Capacity.of(Map.of("volume1", 2 * GB, "volume2", 2 * GB)), second.getCapacity());
    }

    @Test
    void cleanupStaleWorkDirs_removesDirectoriesNotOwnedByRunningInstances() throws Exception {
        Path stale = Files.createDirectories(workRoot.resolve(TYPE).resolve("old").resolve("dead-instance"));
        Files.writeString(stale.resolve("pid"), "not-a-pid\n");
        ProviderInstance running = manager.start(config("test", "volume1:4GB"));

        assertEquals(1, manager.cleanupStaleWorkDirs());

        assertFalse(Files.exists(stale));
        assertTrue(Files.exists(running.getWorkDir()));
    }

    @Test
    void onExit_stopsEveryInstance() {
        manager.start(config("a", "volume1:1GB"));
        manager.start(config("b", "volume1:1GB"));

        manager.onExit();

        assertTrue(manager.instances().isEmpty());
        assertTrue(launcher.alive().isEmpty());
    }

    private void assertLeftNothingBehind() {
        assertTrue(launcher.alive().isEmpty());
        assertFalse(manager.instance(TEST).isPresent());
        assertFalse(Files.exists(workRoot.resolve(TYPE).resolve("test")));
    }

    static ResourceProviderConfig config(String name, String volumes) {
        CommandSpec command = new CommandSpec(false, "/opt/plugins/test-csi-plugin",
                List.of("/opt/plugins/test-csi-plugin", "--available_capacity=0B", "--volumes=" + volumes),
                Map.of("LOG_LEVEL", "debug"));
        PluginSpec plugin = new PluginSpec("org.apache.mesos.csi.test", "test_csi_plugin",
                List.of(new PluginContainer(List.of(ServiceRole.CONTROLLER_SERVICE, ServiceRole.NODE_SERVICE), command)));
        return new ResourceProviderConfig(TYPE, name, List.of(Reservation.dynamic("storage")), new StorageSpec(plugin));
    }
}
