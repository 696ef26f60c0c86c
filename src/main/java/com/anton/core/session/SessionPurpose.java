package com.anton.core.session;

/**
 * What a session is for; determines how narrowly it is configured.
 */
public enum SessionPurpose {
    IMPLEMENTATION,
    DISCOVERY,
    REVIEW,
    VERIFICATION
}
