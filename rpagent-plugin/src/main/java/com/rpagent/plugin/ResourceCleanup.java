package com.rpagent.plugin;

/**
 * Contract for resource cleanup when the agent is shutting down.
 * Components that own plugin processes or threads implement this and release them in
 * {@link #onExit()}. The agent invokes {@code onExit()} on every registered component during
 * shutdown, before the process exits.
 */
public interface ResourceCleanup {

    /**
     * Called once when the agent is shutting down. Exceptions should be logged and not rethrown
     * so other components still get a chance to clean up.
     */
    void onExit();
}
