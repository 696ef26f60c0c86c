package com.anton.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Runs each prompt through an external agent CLI (goose by default) in the session's working
 * directory.
 *
 * <p>The CLI is stateless between invocations, so follow-up prompts carry the first prompt
 * along. Cancellation destroys the running process.
 */
public class CommandAgentSession implements AgentSession {

    private static final Logger log = LoggerFactory.getLogger(CommandAgentSession.class);

    /** Max output kept per turn. Head and tail are preserved. */
    static final int MAX_OUTPUT_CHARS = 20_000;

    private final SessionConfig config;
    private final AgentCommand command;
    private final Object lock = new Object();
    private Process running;
    private boolean cancelled;
    private String firstPrompt;
    private Path promptFile;

    public CommandAgentSession(SessionConfig config, AgentCommand command) {
        this.config = config;
        this.command = command;
    }

    @Override
    public AgentReply ask(String prompt) {
        synchronized (lock) {
            if (cancelled) {
                throw AgentSessionException.cancelled();
            }
        }
        String instructions = firstPrompt == null
                ? withSessionRules(prompt)
                : withSessionRules(firstPrompt) + "\n\n## Follow-up\n\n" + prompt;
        if (firstPrompt == null) {
            firstPrompt = prompt;
        }

        List<String> cmd;
        try {
            if (promptFile == null) {
                promptFile = Files.createTempFile("anton-prompt-", ".md");
            }
            Files.writeString(promptFile, instructions, StandardCharsets.UTF_8);
            cmd = buildCommand(promptFile);
        } catch (IOException e) {
            throw new AgentSessionException("Failed to write prompt file", e);
        }

        log.debug("Running agent ({}): {}", config.purpose(), cmd);
        String output;
        int exitCode;
        try {
            ProcessBuilder pb = new ProcessBuilder(cmd)
                    .directory(config.workingDir().toFile())
                    .redirectErrorStream(true);
            pb.environment().putAll(environment());
            Process process;
            synchronized (lock) {
                if (cancelled) {
                    throw AgentSessionException.cancelled();
                }
                process = pb.start();
                running = process;
            }
            var sb = new StringBuilder();
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(),
                    StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sb.append(line).append('\n');
                }
            }
            exitCode = process.waitFor();
            output = sb.toString();
        } catch (IOException e) {
            if (isCancelled()) {
                throw AgentSessionException.cancelled();
            }
            throw new AgentSessionException("Agent command failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw new AgentSessionException("Interrupted while waiting for agent", true, e);
        } finally {
            synchronized (lock) {
                running = null;
            }
        }

        if (isCancelled()) {
            throw AgentSessionException.cancelled();
        }
        if (command.loopPattern() != null) {
            Matcher loop = command.loopPattern().matcher(output);
            if (loop.find()) {
                throw new ToolLoopException(lineAt(output, loop.start()), truncate(output));
            }
        }
        if (exitCode != 0) {
            log.warn("Agent exited with code {} ({})", exitCode, config.purpose());
            throw new AgentSessionException("Agent exited with code %d: %s".formatted(exitCode, tail(output)));
        }
        return new AgentReply(truncate(output), 1, countToolCalls(output));
    }

    @Override
    public void cancel() {
        synchronized (lock) {
            cancelled = true;
            if (running != null && running.isAlive()) {
                log.info("Cancelling agent process {}", running.pid());
                running.descendants().forEach(ProcessHandle::destroy);
                running.destroy();
            }
        }
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (running != null && running.isAlive()) {
                running.destroyForcibly();
            }
        }
        if (promptFile != null) {
            try {
                Files.deleteIfExists(promptFile);
            } catch (IOException e) {
                log.debug("Could not delete prompt file {}: {}", promptFile, e.getMessage());
            }
        }
    }

    List<String> buildCommand(Path file) {
        List<String> cmd = new ArrayList<>(command.arguments().size());
        for (String arg : command.arguments()) {
            cmd.add(arg
                    .replace("{promptFile}", file.toString())
                    .replace("{maxIterations}", String.valueOf(config.maxIterations()))
                    .replace("{workingDir}", config.workingDir().toString())
                    .replace("{model}", config.model() == null ? "" : config.model()));
        }
        return cmd;
    }

    Map<String, String> environment() {
        var env = new HashMap<>(command.environment());
        if (config.model() != null && !config.model().isBlank()) {
            env.put("GOOSE_MODEL", config.model());
        }
        env.put("GOOSE_MODE", !config.toolsEnabled() ? "chat" : config.autoApprove() ? "auto" : "approve");
        env.put("ANTON_SESSION_PURPOSE", config.purpose().name().toLowerCase(Locale.ROOT));
        env.put("ANTON_WRITE_ROOTS", String.join(File.pathSeparator,
                config.writeRoots().stream().map(Path::toString).toList()));
        return env;
    }

    private String withSessionRules(String prompt) {
        if (config.purpose() == SessionPurpose.IMPLEMENTATION || config.writeRoots().isEmpty()) {
            return prompt;
        }
        var sb = new StringBuilder("## Session Rules\n\n");
        sb.append("- Working directory: ").append(config.workingDir()).append("\n");
        sb.append("- You may ONLY write files under: ");
        sb.append(String.join(", ", config.writeRoots().stream().map(Path::toString).toList()));
        sb.append("\n- Do not delegate to sub-agents.\n\n");
        return sb.append(prompt).toString();
    }

    private boolean isCancelled() {
        synchronized (lock) {
            return cancelled;
        }
    }

    private int countToolCalls(String output) {
        if (command.toolCallPattern() == null) {
            return 0;
        }
        int count = 0;
        for (String line : output.split("\n")) {
            if (command.toolCallPattern().matcher(line).find()) {
                count++;
            }
        }
        return count;
    }

    private static String lineAt(String output, int index) {
        int start = output.lastIndexOf('\n', index) + 1;
        int end = output.indexOf('\n', index);
        return output.substring(start, end < 0 ? output.length() : end).trim();
    }

    private static String tail(String output) {
        String trimmed = output.trim();
        return trimmed.length() <= 500 ? trimmed : "..." + trimmed.substring(trimmed.length() - 500);
    }

    static String truncate(String output) {
        if (output == null || output.length() <= MAX_OUTPUT_CHARS) {
            return output;
        }
        int half = MAX_OUTPUT_CHARS / 2;
        return output.substring(0, half)
                + "\n\n... [truncated " + (output.length() - MAX_OUTPUT_CHARS) + " chars] ...\n\n"
                + output.substring(output.length() - half);
    }
}
