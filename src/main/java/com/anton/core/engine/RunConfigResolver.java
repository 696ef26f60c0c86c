package com.anton.core.engine;

import com.anton.core.model.RunConfig;

import java.nio.file.Path;

/**
 * Resolves the immutable policy for a run of the given task file.
 */
@FunctionalInterface
public interface RunConfigResolver {
    RunConfig resolve(Path taskFile);
}
