package com.anton.core.vcs;

import com.anton.core.AntonException;

/**
 * The working tree had uncommitted changes when a run was about to start.
 */
public class DirtyWorkingTreeException extends AntonException {

    public DirtyWorkingTreeException(String message) {
        super(message);
    }
}
