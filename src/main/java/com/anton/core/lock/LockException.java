package com.anton.core.lock;

import com.anton.core.AntonException;

/**
 * The lock file could not be read or written.
 */
public class LockException extends AntonException {

    public LockException(String message, Throwable cause) {
        super(message, cause);
    }
}
