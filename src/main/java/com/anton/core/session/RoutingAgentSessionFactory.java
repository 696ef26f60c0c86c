package com.anton.core.session;

import org.springframework.ai.chat.client.ChatClient;

/**
 * Opens tool-less verification sessions on the chat model when one is configured and everything
 * else through the external agent command.
 */
public class RoutingAgentSessionFactory implements AgentSessionFactory {

    private final AgentCommand command;
    private final ChatClient chatClient;

    /**
     * @param command    agent CLI used for sessions that need tools
     * @param chatClient chat model for diff reviews, or null to use the CLI for those too
     */
    public RoutingAgentSessionFactory(AgentCommand command, ChatClient chatClient) {
        this.command = command;
        this.chatClient = chatClient;
    }

    @Override
    public AgentSession create(SessionConfig config) {
        if (config.purpose() == SessionPurpose.VERIFICATION && !config.toolsEnabled() && chatClient != null) {
            return new ChatAgentSession(chatClient, config);
        }
        return new CommandAgentSession(config, command);
    }
}
