package com.anton.core.session;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * How to launch an external agent CLI for one prompt.
 *
 * <p>Arguments may contain the placeholders {@code {promptFile}}, {@code {maxIterations}},
 * {@code {workingDir}} and {@code {model}}.
 *
 * @param arguments command line template
 * @param environment extra environment variables
 * @param loopPattern output pattern signalling that the agent aborted a tool-call loop
 * @param toolCallPattern output line pattern counted as one tool call
 */
public record AgentCommand(
    List<String> arguments,
    Map<String, String> environment,
    Pattern loopPattern,
    Pattern toolCallPattern
) {

    public static final List<String> GOOSE = List.of(
            "goose", "run", "--no-session", "--max-turns", "{maxIterations}", "-i", "{promptFile}");

    public AgentCommand {
        arguments = List.copyOf(arguments);
        environment = environment == null ? Map.of() : Map.copyOf(environment);
    }
}
