package com.anton.core.session;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Base agent-session settings shared by every session the orchestrator opens.
 *
 * @param model model identifier handed to the agent, null for the agent's default
 * @param toolsEnabled whether the base configuration allows tool calls
 * @param writeRoots directories the agent may write to; empty means the project directory
 * @param delegationEnabled whether the agent may spawn sub-agents
 * @param toolServersEnabled whether auxiliary tool servers are attached
 * @param timeout default turn timeout
 */
public record SessionDefaults(
    String model,
    boolean toolsEnabled,
    List<Path> writeRoots,
    boolean delegationEnabled,
    boolean toolServersEnabled,
    Duration timeout
) {

    public SessionDefaults {
        writeRoots = writeRoots == null ? List.of() : List.copyOf(writeRoots);
    }
}
