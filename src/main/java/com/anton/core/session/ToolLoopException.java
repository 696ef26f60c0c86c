package com.anton.core.session;

import com.anton.core.AntonException;

/**
 * The session stopped its turn because the agent kept repeating the same tool call.
 */
public class ToolLoopException extends AntonException {

    private final String partialOutput;

    public ToolLoopException(String message, String partialOutput) {
        super(message);
        this.partialOutput = partialOutput;
    }

    public String getPartialOutput() {
        return partialOutput;
    }
}
