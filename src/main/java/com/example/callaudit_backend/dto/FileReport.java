package com.example.callaudit_backend.dto;

import com.example.callaudit_backend.model.DetectorOutcome;
import com.example.callaudit_backend.model.FileTask;
import com.example.callaudit_backend.util.DetectorKeys;
import com.example.callaudit_backend.util.FailureReason;
import com.example.callaudit_backend.util.FileTaskStatus;

/**
 * One line of a job report. Every submitted file has exactly one.
 */
public record FileReport(
        String file,
        FileTaskStatus status,
        String agent,
        String phone,
        String timestamp,
        String disposition,
        String releasing,
        String lateHello,
        String rebuttal,
        Double rebuttalConfidence,
        String transcript,
        boolean flagged,
        FailureReason failureReason,
        String failureMessage,
        long elapsedMs
) {

    public static FileReport from(FileTask task) {
        FileTask.State state = task.state();
        DetectorOutcome rebuttal = state.outcomes().get(DetectorKeys.REBUTTAL);
        Object transcript = rebuttal == null ? null : rebuttal.metadata().get("transcript");
        return new FileReport(
                task.getFile().toString(),
                state.status(),
                task.getMetadata().agent(),
                task.getMetadata().phone(),
                task.getMetadata().timestamp(),
                task.getMetadata().disposition(),
                state.value(DetectorKeys.RELEASING),
                state.value(DetectorKeys.LATE_HELLO),
                state.value(DetectorKeys.REBUTTAL),
                rebuttal == null ? null : rebuttal.confidence(),
                transcript == null ? null : transcript.toString(),
                task.isFlagged(),
                state.failure() == null ? null : state.failure().reason(),
                state.failure() == null ? null : state.failure().message(),
                state.elapsedMs()
        );
    }
}
