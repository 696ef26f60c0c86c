package com.anton.config;

import com.anton.core.lock.LockManager;
import com.anton.core.lock.ProcessLiveness;
import com.anton.core.session.AgentCommand;
import com.anton.core.session.AgentSessionFactory;
import com.anton.core.session.RoutingAgentSessionFactory;
import com.anton.core.session.SessionDefaults;
import com.anton.core.verify.AiVerifier;
import com.anton.core.verify.TaskVerifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;

@Configuration
@EnableConfigurationProperties(AntonProperties.class)
public class AntonConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AntonConfiguration.class);

    static final String UNSET_API_KEY = "not-set";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public LockManager lockManager(AntonProperties properties, Clock clock) {
        AntonProperties.Lock lock = properties.getLock();
        return new LockManager(Path.of(lock.getStateDir()), Duration.ofMinutes(lock.getStaleAfterMinutes()), clock,
                ProcessLiveness.system(), ProcessHandle.current().pid());
    }

    @Bean
    public SessionDefaults sessionDefaults(AntonProperties properties) {
        AntonProperties.Session session = properties.getSession();
        List<Path> roots = session.getWriteRoots().stream().map(Path::of).toList();
        return new SessionDefaults(blankToNull(session.getModel()), session.isToolsEnabled(), roots,
                session.isDelegationEnabled(), session.isToolServersEnabled(),
                Duration.ofSeconds(session.getTimeoutSec()));
    }

    @Bean
    public AgentCommand agentCommand(AntonProperties properties) {
        AntonProperties.Agent agent = properties.getAgent();
        return new AgentCommand(agent.getCommand(), agent.getEnvironment(),
                compileOrNull(agent.getLoopPattern()), compileOrNull(agent.getToolCallPattern()));
    }

    /**
     * Tool-less sessions go to the chat model when an API key is configured; otherwise every
     * session runs through the agent CLI.
     */
    @Bean
    public AgentSessionFactory agentSessionFactory(AgentCommand command, AntonProperties properties,
                                                   ObjectProvider<ChatClient.Builder> chatClientBuilder,
                                                   @Value("${spring.ai.openai.api-key:" + UNSET_API_KEY + "}") String apiKey) {
        ChatClient chatClient = null;
        if (properties.getAgent().isUseChatModel() && !UNSET_API_KEY.equals(apiKey)) {
            ChatClient.Builder builder = chatClientBuilder.getIfAvailable();
            if (builder != null) {
                chatClient = builder.build();
                log.info("Tool-less sessions use the configured chat model");
            }
        }
        if (chatClient == null) {
            log.info("Agent sessions run through: {}", String.join(" ", command.arguments()));
        }
        return new RoutingAgentSessionFactory(command, chatClient);
    }

    @Bean
    public TaskVerifier taskVerifier(AgentSessionFactory sessionFactory, SessionDefaults sessionDefaults,
                                     AntonProperties properties) {
        AiVerifier ai = new AiVerifier(sessionFactory, sessionDefaults, blankToNull(properties.getVerifyModel()));
        return new TaskVerifier(ai);
    }

    private static Pattern compileOrNull(String regex) {
        return regex == null || regex.isBlank() ? null : Pattern.compile(regex);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
