package com.anton.core.session;

/**
 * An opaque agent session. The session owns model calls, tool execution and its own loop
 * detection; the orchestrator only sends prompts and may cancel.
 */
public interface AgentSession extends AutoCloseable {

    /**
     * Sends a prompt and blocks until the agent finishes its turn.
     *
     * @throws ToolLoopException     if the session aborted a repetitive tool-call loop
     * @throws AgentSessionException if the session failed or was cancelled
     */
    AgentReply ask(String prompt);

    /** Cancels an in-flight {@link #ask}. Safe to call from another thread, and when idle. */
    void cancel();

    /** Releases the session's resources. Never throws. */
    @Override
    void close();
}
