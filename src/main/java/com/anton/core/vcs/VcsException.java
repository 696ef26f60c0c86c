package com.anton.core.vcs;

import com.anton.core.AntonException;

/**
 * A git command failed in a way that leaves the tree in an unknown state.
 */
public class VcsException extends AntonException {

    public VcsException(String message) {
        super(message);
    }

    public VcsException(String message, Throwable cause) {
        super(message, cause);
    }
}
