package com.anton.core.progress;

/**
 * Receives progress events on the channel's delivery thread.
 */
@FunctionalInterface
public interface ProgressListener {
    void onProgress(ProgressEvent event);
}
