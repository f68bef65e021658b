package com.rpagent.lifecycle;

import com.rpagent.plugin.FileSystemPluginEndpoint;
import com.rpagent.plugin.LaunchRequest;
import com.rpagent.plugin.PluginLauncher;
import com.rpagent.plugin.PluginProcess;
import com.rpagent.providerconfig.CommandSpec;
import com.rpagent.providerconfig.PluginContainer;
import com.rpagent.providerconfig.PluginSpec;
import com.rpagent.providerconfig.Reservation;
import com.rpagent.providerconfig.ResourceProviderConfig;
import com.rpagent.providerconfig.ServiceRole;
import com.rpagent.providerconfig.StorageSpec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Launcher standing in for the test CSI plugin. Publishes {@code --volumes=name:size,...} as its
 * capacity and reports ready; exits at once when its arguments contain {@code --crash} or when
 * {@link #failAll} is set.
 * <p>
 * Shared with the API and agent tests through this module's test jar.
 */
public final class FakeCsiPlugin implements PluginLauncher {

    public static final String TYPE = "org.apache.mesos.rp.local.storage";

    private static final AtomicLong PIDS = new AtomicLong(20_000);

    public final AtomicBoolean failAll = new AtomicBoolean();
    public final AtomicInteger running = new AtomicInteger();
    public final AtomicInteger launches = new AtomicInteger();
    public volatile Duration startDelay = Duration.ZERO;

    @Override
    public PluginProcess launch(LaunchRequest request) throws IOException {
        launches.incrementAndGet();
        List<String> args = request.getContainer().getCommand().getArguments();
        if (failAll.get() || args.contains("--crash")) {
            return new Process(false);
        }
        sleep(startDelay);
        Path endpoint = request.getEndpointDir();
        StringBuilder json = new StringBuilder("{");
        for (String arg : args) {
            if (arg.startsWith("--volumes=")) {
                for (String v : arg.substring("--volumes=".length()).split(",")) {
                    String[] parts = v.split(":", 2);
                    json.append(json.length() > 1 ? "," : "").append('"').append(parts[0]).append("\":\"")
                            .append(parts[1]).append('"');
                }
            }
        }
        Files.writeString(endpoint.resolve(FileSystemPluginEndpoint.CAPACITY_FILE), json.append('}').toString());
        for (ServiceRole service : request.getContainer().getServices()) {
            Files.createFile(FileSystemPluginEndpoint.readyFile(endpoint, service));
        }
        running.incrementAndGet();
        return new Process(true);
    }

    public static ResourceProviderConfig config(String name, String volumes, String... extraArgs) {
        List<String> args = new ArrayList<>(List.of("/opt/plugins/test-csi-plugin",
                "--available_capacity=0B", "--volumes=" + volumes));
        args.addAll(List.of(extraArgs));
        PluginSpec plugin = new PluginSpec("org.apache.mesos.csi.test", "test_csi_plugin", List.of(
                new PluginContainer(List.of(ServiceRole.CONTROLLER_SERVICE, ServiceRole.NODE_SERVICE),
                        CommandSpec.exec("/opt/plugins/test-csi-plugin", args))));
        return new ResourceProviderConfig(TYPE, name, List.of(Reservation.dynamic("storage")), new StorageSpec(plugin));
    }

    private static void sleep(Duration d) {
        if (d.isZero()) {
            return;
        }
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private final class Process implements PluginProcess {
        private final long pid = PIDS.incrementAndGet();
        private volatile boolean alive;

        Process(boolean alive) {
            this.alive = alive;
        }

        @Override
        public long pid() {
            return pid;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }

        @Override
        public OptionalInt exitCode() {
            return alive ? OptionalInt.empty() : OptionalInt.of(1);
        }

        @Override
        public void terminate() {
            kill();
        }

        @Override
        public void kill() {
            if (alive) {
                alive = false;
                running.decrementAndGet();
            }
        }

        @Override
        public boolean waitFor(Duration timeout) {
            return !alive;
        }
    }
}
