package com.anton.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * Tool-less session backed by a Spring AI {@link ChatClient}. Used for single-turn work such as
 * reviewing a diff, where no repository access is needed.
 */
public class ChatAgentSession implements AgentSession {

    private static final Logger log = LoggerFactory.getLogger(ChatAgentSession.class);

    static final String SYSTEM_PROMPT =
            "You are a strict code reviewer. You cannot call tools. Answer only in the format requested.";

    private final ChatClient chatClient;
    private final SessionConfig config;
    private volatile boolean cancelled;

    public ChatAgentSession(ChatClient chatClient, SessionConfig config) {
        this.chatClient = chatClient;
        this.config = config;
    }

    @Override
    public AgentReply ask(String prompt) {
        if (cancelled) {
            throw AgentSessionException.cancelled();
        }
        long start = System.currentTimeMillis();
        String content;
        try {
            var request = chatClient.prompt().system(SYSTEM_PROMPT).user(prompt);
            if (config.model() != null && !config.model().isBlank()) {
                request = request.options(ChatOptions.builder().model(config.model()).build());
            }
            content = request.call().content();
        } catch (RuntimeException e) {
            throw new AgentSessionException("Chat model call failed: " + e.getMessage(), e);
        }
        if (cancelled) {
            throw AgentSessionException.cancelled();
        }
        log.debug("Chat session ({}) answered in {}ms", config.purpose(), System.currentTimeMillis() - start);
        return new AgentReply(content == null ? "" : content, 1, 0);
    }

    @Override
    public void cancel() {
        cancelled = true;
    }

    @Override
    public void close() {
        // stateless
    }
}
