package com.anton.core.prompt;

import com.anton.core.AntonException;

/**
 * A preflight session's reply did not follow the JSON protocol.
 */
public class PreflightParseException extends AntonException {

    public PreflightParseException(String message) {
        super(message);
    }

    public PreflightParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
