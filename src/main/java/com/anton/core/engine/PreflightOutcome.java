package com.anton.core.engine;

import com.anton.core.model.AttemptStatus;
import com.anton.core.model.PreflightRecord;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of running the preflight stages for one task.
 *
 * @param kind          what the controller should do next
 * @param planFile      vetted plan for implementation, null unless {@link Kind#PLANNED}
 * @param failureStatus attempt status to record, null unless {@link Kind#FAILED}
 * @param reason        failure reason, null unless {@link Kind#FAILED}
 * @param records       one record per stage try, in order
 */
public record PreflightOutcome(
    Kind kind,
    Path planFile,
    AttemptStatus failureStatus,
    String reason,
    List<PreflightRecord> records
) {

    public enum Kind {
        /** Discovery found the task already implemented. */
        ALREADY_COMPLETE,
        /** A plan file is ready for the implementation session. */
        PLANNED,
        /** Preflight could not produce a usable plan. */
        FAILED
    }

    public PreflightOutcome {
        records = List.copyOf(records);
    }

    static PreflightOutcome complete(List<PreflightRecord> records) {
        return new PreflightOutcome(Kind.ALREADY_COMPLETE, null, null, null, records);
    }

    static PreflightOutcome planned(Path planFile, List<PreflightRecord> records) {
        return new PreflightOutcome(Kind.PLANNED, planFile, null, null, records);
    }

    static PreflightOutcome failed(AttemptStatus status, String reason, List<PreflightRecord> records) {
        return new PreflightOutcome(Kind.FAILED, null, status, reason, records);
    }
}
