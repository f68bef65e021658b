package com.rpagent.plugin;

import java.time.Duration;
import java.util.OptionalInt;

/** Handle to one running plugin container process. */
public interface PluginProcess {

    long pid();

    boolean isAlive();

    /** Exit code once the process has exited; empty while it runs. */
    OptionalInt exitCode();

    /** Requests a graceful exit (SIGTERM). */
    void terminate();

    /** Kills the process and its descendants (SIGKILL). */
    void kill();

    /**
     * Waits up to {@code timeout} for the process to exit.
     *
     * @return true when the process has exited
     */
    boolean waitFor(Duration timeout) throws InterruptedException;
}
