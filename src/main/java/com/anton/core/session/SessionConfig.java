package com.anton.core.session;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Fully resolved settings for one agent session.
 *
 * @param purpose what the session is for
 * @param workingDir directory the agent runs in
 * @param toolsEnabled whether tool calls are allowed
 * @param writeRoots directories the agent may write to
 * @param maxIterations cap on agent turns
 * @param timeout budget for one ask
 * @param approvalMode approval mode for tool calls
 * @param autoApprove whether confirmations are answered automatically
 * @param delegationEnabled whether sub-agents may be spawned
 * @param toolServersEnabled whether auxiliary tool servers are attached
 * @param model model identifier, null for the agent's default
 */
public record SessionConfig(
    SessionPurpose purpose,
    Path workingDir,
    boolean toolsEnabled,
    List<Path> writeRoots,
    int maxIterations,
    Duration timeout,
    String approvalMode,
    boolean autoApprove,
    boolean delegationEnabled,
    boolean toolServersEnabled,
    String model
) {

    public SessionConfig {
        writeRoots = List.copyOf(writeRoots);
    }
}
