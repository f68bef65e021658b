package com.rpagent.plugin;

import com.rpagent.providerconfig.PluginContainer;
import com.rpagent.providerconfig.ProviderIdentity;
import com.rpagent.providerconfig.ResourceProviderConfig;
import com.rpagent.providerconfig.ServiceRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns the running plugin processes of every resource provider on the agent, at most one
 * {@link ProviderInstance} per identity.
 * <p>
 * Each start gets a fresh working directory {@code <workRoot>/<type>/<name>/<instanceId>/} with
 * an {@code endpoint/} subdirectory and a {@code pid} file listing the container pids. A start
 * that fails at any point kills what it started and removes the directory, leaving nothing behind.
 * <p>
 * Callers serialize start and stop for one identity.
 */
public final class ProviderInstanceManager implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(ProviderInstanceManager.class);

    static final String PID_FILE = "pid";
    static final String ENDPOINT_DIR = "endpoint";
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(50);

    private final Path workRoot;
    private final PluginLauncher launcher;
    private final PluginEndpointFactory endpointFactory;
    private final Duration readyTimeout;
    private final Duration stopGracePeriod;
    private final Duration pollInterval;
    private final Map<ProviderIdentity, ProviderInstance> instances = new ConcurrentHashMap<>();

    public ProviderInstanceManager(Path workRoot, PluginLauncher launcher, PluginEndpointFactory endpointFactory,
                                   Duration readyTimeout, Duration stopGracePeriod) {
        this(workRoot, launcher, endpointFactory, readyTimeout, stopGracePeriod, DEFAULT_POLL_INTERVAL);
    }

    public ProviderInstanceManager(Path workRoot, PluginLauncher launcher, PluginEndpointFactory endpointFactory,
                                   Duration readyTimeout, Duration stopGracePeriod, Duration pollInterval) {
        this.workRoot = Objects.requireNonNull(workRoot, "workRoot");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.readyTimeout = Objects.requireNonNull(readyTimeout, "readyTimeout");
        this.stopGracePeriod = Objects.requireNonNull(stopGracePeriod, "stopGracePeriod");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    /** Manager launching real processes with the file-system endpoint. */
    public static ProviderInstanceManager forProcesses(Path workRoot, Duration readyTimeout, Duration stopGracePeriod) {
        return new ProviderInstanceManager(workRoot, new ProcessPluginLauncher(), FileSystemPluginEndpoint::new,
                readyTimeout, stopGracePeriod);
    }

    public Path getWorkRoot() {
        return workRoot;
    }

    /**
     * Launches every container of the config's plugin, waits until all declared services are
     * ready and captures the advertised capacity.
     *
     * @throws LaunchException on any failure; nothing is left running
     */
    public ProviderInstance start(ResourceProviderConfig config) {
        ProviderIdentity identity = config.identity();
        if (instances.containsKey(identity)) {
            throw new LaunchException(identity, "an instance is already running");
        }
        String instanceId = UUID.randomUUID().toString();
        Path workDir = instanceDir(identity).resolve(instanceId);
        Path endpointDir = workDir.resolve(ENDPOINT_DIR);
        List<PluginProcess> started = new ArrayList<>();
        try {
            Files.createDirectories(endpointDir);
            List<PluginContainer> containers = config.getPlugin().getContainers();
            for (int i = 0; i < containers.size(); i++) {
                PluginProcess process = launcher.launch(new LaunchRequest(identity, i, containers.get(i), workDir, endpointDir));
                started.add(process);
                writePids(workDir, started);
            }
            PluginEndpoint endpoint = endpointFactory.open(endpointDir);
            awaitReady(identity, config.getPlugin().getServices(), endpoint, started);
            Capacity capacity = endpoint.queryCapacity();
            ProviderInstance instance = new ProviderInstance(instanceId, config, workDir, endpointDir, started,
                    capacity, Instant.now());
            instances.put(identity, instance);
            log.info("Resource provider {} started as instance {} with capacity {}", identity, instanceId, capacity);
            return instance;
        } catch (LaunchException e) {
            abort(identity, started, workDir);
            throw e;
        } catch (IOException | RuntimeException e) {
            abort(identity, started, workDir);
            throw new LaunchException(identity, e.getMessage() != null ? e.getMessage() : e.toString(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(identity, started, workDir);
            throw new LaunchException(identity, "interrupted while waiting for readiness", e);
        }
    }

    /**
     * Stops the instance: SIGTERM, wait for the grace period, then force-kill and wait again.
     * Removes the working directory afterwards. No-op when nothing runs for the identity.
     *
     * @throws StopException when a process survives the forced kill (the instance stays registered)
     */
    public void stop(ProviderIdentity identity) {
        ProviderInstance instance = instances.get(identity);
        if (instance == null) {
            log.debug("No running instance for {}; nothing to stop", identity);
            return;
        }
        List<PluginProcess> survivors = terminate(instance.getProcesses());
        if (!survivors.isEmpty()) {
            throw new StopException(identity, survivors.size() + " process(es) still alive after kill, pids "
                    + survivors.stream().map(p -> String.valueOf(p.pid())).collect(Collectors.joining(",")));
        }
        instances.remove(identity, instance);
        deleteRecursively(instance.getWorkDir());
        log.info("Resource provider {} stopped (instance {})", identity, instance.getInstanceId());
    }

    /** Capacity of the running instance, or {@link Capacity#EMPTY}. */
    public Capacity currentResources(ProviderIdentity identity) {
        ProviderInstance instance = instances.get(identity);
        return instance != null ? instance.getCapacity() : Capacity.EMPTY;
    }

    public Optional<ProviderInstance> instance(ProviderIdentity identity) {
        return Optional.ofNullable(instances.get(identity));
    }

    public boolean isRunning(ProviderIdentity identity) {
        ProviderInstance instance = instances.get(identity);
        return instance != null && instance.isAlive();
    }

    /** Running instances, ordered by identity. */
    public List<ProviderInstance> instances() {
        return instances.values().stream()
                .sorted(Comparator.comparing(ProviderInstance::getIdentity))
                .collect(Collectors.toList());
    }

    /**
     * Kills processes recorded in {@code pid} files under the work root and deletes every working
     * directory that no running instance owns. Run before any instance starts, to clear what a
     * previous agent process left behind.
     *
     * @return number of leftover working directories removed
     */
    public int cleanupStaleWorkDirs() {
        if (!Files.isDirectory(workRoot)) {
            return 0;
        }
        Set<Path> owned = instances.values().stream().map(ProviderInstance::getWorkDir).collect(Collectors.toSet());
        List<Path> leftovers;
        try (Stream<Path> walk = Files.walk(workRoot, 3)) {
            leftovers = walk.filter(p -> workRoot.relativize(p).getNameCount() == 3)
                    .filter(Files::isDirectory)
                    .filter(p -> !owned.contains(p))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to scan work root {}: {}", workRoot, e.getMessage());
            return 0;
        }
        for (Path dir : leftovers) {
            killRecordedPids(dir);
            deleteRecursively(dir);
            log.info("Removed leftover plugin working directory {}", dir);
        }
        return leftovers.size();
    }

    /** Stops every running instance; failures are logged so the others still stop. */
    @Override
    public void onExit() {
        for (ProviderInstance instance : instances()) {
            try {
                stop(instance.getIdentity());
            } catch (RuntimeException e) {
                log.error("Failed to stop resource provider {} on exit: {}", instance.getIdentity(), e.getMessage(), e);
            }
        }
    }

    private Path instanceDir(ProviderIdentity identity) {
        return workRoot.resolve(safeSegment(identity.getType())).resolve(safeSegment(identity.getName()));
    }

    private static String safeSegment(String raw) {
        String s = raw.replaceAll("[^A-Za-z0-9._-]", "_");
        return ".".equals(s) || "..".equals(s) ? "_" + s : s;
    }

    private void awaitReady(ProviderIdentity identity, Set<ServiceRole> services, PluginEndpoint endpoint,
                            List<PluginProcess> processes) throws IOException, InterruptedException {
        long deadline = System.nanoTime() + readyTimeout.toNanos();
        while (true) {
            for (PluginProcess p : processes) {
                if (!p.isAlive()) {
                    throw new LaunchException(identity, "plugin process " + p.pid() + " exited with code "
                            + p.exitCode().orElse(-1) + " before becoming ready");
                }
            }
            Set<ServiceRole> ready = endpoint.readyServices();
            if (ready.containsAll(services)) {
                return;
            }
            if (System.nanoTime() - deadline >= 0) {
                Set<ServiceRole> missing = EnumSet.noneOf(ServiceRole.class);
                missing.addAll(services);
                missing.removeAll(ready);
                throw new LaunchException(identity, "services " + missing + " not ready within " + readyTimeout);
            }
            Thread.sleep(pollInterval.toMillis());
        }
    }

    private List<PluginProcess> terminate(List<PluginProcess> processes) {
        for (PluginProcess p : processes) {
            if (p.isAlive()) {
                p.terminate();
            }
        }
        List<PluginProcess> survivors = new ArrayList<>();
        long deadline = System.nanoTime() + stopGracePeriod.toNanos();
        try {
            for (PluginProcess p : processes) {
                long remaining = Math.max(0, deadline - System.nanoTime());
                if (!p.waitFor(Duration.ofNanos(remaining))) {
                    log.warn("Plugin process {} did not exit within {} after SIGTERM; killing", p.pid(), stopGracePeriod);
                    p.kill();
                    if (!p.waitFor(stopGracePeriod)) {
                        survivors.add(p);
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            processes.forEach(PluginProcess::kill);
            return processes.stream().filter(PluginProcess::isAlive).collect(Collectors.toList());
        }
        return survivors;
    }

    private void abort(ProviderIdentity identity, List<PluginProcess> started, Path workDir) {
        for (PluginProcess p : started) {
            p.kill();
        }
        for (PluginProcess p : started) {
            try {
                if (!p.waitFor(stopGracePeriod)) {
                    log.warn("Plugin process {} of failed launch for {} still alive after kill", p.pid(), identity);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        deleteRecursively(workDir);
    }

    private static void writePids(Path workDir, List<PluginProcess> processes) throws IOException {
        String content = processes.stream().map(p -> String.valueOf(p.pid())).collect(Collectors.joining("\n", "", "\n"));
        Files.writeString(workDir.resolve(PID_FILE), content, StandardCharsets.UTF_8);
    }

    private static void killRecordedPids(Path dir) {
        Path pidFile = dir.resolve(PID_FILE);
        if (!Files.isRegularFile(pidFile)) {
            return;
        }
        try {
            for (String line : Files.readAllLines(pidFile, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try {
                    long pid = Long.parseLong(trimmed);
                    ProcessHandle.of(pid).ifPresent(h -> {
                        log.info("Killing leftover plugin process {} recorded in {}", pid, pidFile);
                        h.descendants().forEach(ProcessHandle::destroyForcibly);
                        h.destroyForcibly();
                    });
                } catch (NumberFormatException e) {
                    log.warn("Ignoring invalid pid '{}' in {}", trimmed, pidFile);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", pidFile, e.getMessage());
        }
    }

    static void deleteRecursively(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            log.warn("Failed to delete plugin working directory {}: {}", dir, e.getMessage());
        }
        deleteEmptyParents(dir);
    }

    /** Removes the per-identity directory once its last instance directory is gone. */
    private static void deleteEmptyParents(Path dir) {
        Path parent = dir.getParent();
        if (parent == null) {
            return;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(parent)) {
            if (stream.iterator().hasNext()) {
                return;
            }
        } catch (IOException e) {
            log.debug("Cannot list {}: {}", parent, e.getMessage());
            return;
        }
        try {
            Files.deleteIfExists(parent);
        } catch (IOException e) {
            log.debug("Keeping {}: {}", parent, e.getMessage());
        }
    }
}
