package com.anton.core.session;

/**
 * Opens agent sessions; a fresh one is opened for every attempt.
 */
@FunctionalInterface
public interface AgentSessionFactory {

    AgentSession create(SessionConfig config);
}
