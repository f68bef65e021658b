package com.rpagent.plugin;

import com.rpagent.providerconfig.CommandSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.concurrent.TimeUnit;

/**
 * Launches plugin containers as local OS processes. {@code shell=true} commands run through
 * {@code /bin/sh -c}; other commands run {@code value} with {@code arguments[1..]} (arguments[0]
 * is argv[0]). Output goes to {@code container-<n>.stdout} and {@code .stderr} in the working directory.
 */
public final class ProcessPluginLauncher implements PluginLauncher {

    private static final Logger log = LoggerFactory.getLogger(ProcessPluginLauncher.class);

    @Override
    public PluginProcess launch(LaunchRequest request) throws IOException {
        List<String> argv = commandLine(request.getContainer().getCommand());
        Path workDir = request.getWorkDir();
        String prefix = "container-" + request.getContainerIndex();
        ProcessBuilder builder = new ProcessBuilder(argv)
                .directory(workDir.toFile())
                .redirectOutput(workDir.resolve(prefix + ".stdout").toFile())
                .redirectError(workDir.resolve(prefix + ".stderr").toFile());
        builder.environment().putAll(request.getEnvironment());
        Process process = builder.start();
        log.info("Started plugin container {} of {} (pid {}): {}",
                request.getContainerIndex(), request.getIdentity(), process.pid(), argv);
        return new OsPluginProcess(process);
    }

    static List<String> commandLine(CommandSpec command) {
        List<String> argv = new ArrayList<>();
        if (command.isShell()) {
            argv.add("/bin/sh");
            argv.add("-c");
            argv.add(command.getValue());
        } else {
            argv.add(command.getValue());
            List<String> args = command.getArguments();
            if (args.size() > 1) {
                argv.addAll(args.subList(1, args.size()));
            }
        }
        return argv;
    }

    private static final class OsPluginProcess implements PluginProcess {

        private final Process process;

        OsPluginProcess(Process process) {
            this.process = process;
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public OptionalInt exitCode() {
            return process.isAlive() ? OptionalInt.empty() : OptionalInt.of(process.exitValue());
        }

        @Override
        public void terminate() {
            process.descendants().forEach(ProcessHandle::destroy);
            process.destroy();
        }

        @Override
        public void kill() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }

        @Override
        public boolean waitFor(Duration timeout) throws InterruptedException {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
