package com.anton.core.engine;

import com.anton.core.model.LoopEvent;
import com.anton.core.model.ProgressSnapshot;
import com.anton.core.model.RunResult;
import com.anton.core.model.RunState;

/**
 * What {@link RunController#status()} reports.
 *
 * @param state         controller state
 * @param snapshot      live progress, empty when no run has started
 * @param lastLoopEvent most recent tool-loop event of the current or last run, null if none
 * @param lastResult    summary of the last finished run, null if none
 */
public record RunStatus(RunState state, ProgressSnapshot snapshot, LoopEvent lastLoopEvent, RunResult lastResult) {
}
