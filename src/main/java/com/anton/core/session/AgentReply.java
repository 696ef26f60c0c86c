package com.anton.core.session;

/**
 * What an agent session returned for one prompt.
 *
 * @param text final assistant output
 * @param turns model turns used
 * @param toolCalls tool calls made
 */
public record AgentReply(String text, int turns, int toolCalls) {
}
