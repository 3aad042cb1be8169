package com.example.callaudit_backend.model;

import com.example.callaudit_backend.util.DetectorKeys;
import com.example.callaudit_backend.util.FailureReason;
import com.example.callaudit_backend.util.FileTaskStatus;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FileTaskTest {

    private static FileTask task() {
        return new FileTask(0, Path.of("call.mp3"), null);
    }

    private static Map<String, DetectorOutcome> outcomes(String releasing, String lateHello, String rebuttal) {
        return Map.of(
                DetectorKeys.RELEASING, DetectorOutcome.of(releasing, null, Map.of()),
                DetectorKeys.LATE_HELLO, DetectorOutcome.of(lateHello, null, Map.of()),
                DetectorKeys.REBUTTAL, DetectorOutcome.of(rebuttal, 0.9, Map.of()));
    }

    @Test
    void cannotFinishWithoutBeingClaimed() {
        FileTask task = task();

        assertThat(task.markSucceeded(Map.of(), 1)).isFalse();
        assertThat(task.status()).isEqualTo(FileTaskStatus.QUEUED);
        assertThat(task.getMetadata()).isEqualTo(CallMetadata.UNKNOWN);
    }

    @Test
    void firstTerminalStateWins() {
        FileTask task = task();
        assertThat(task.markInFlight()).isTrue();
        assertThat(task.markInFlight()).isFalse();

        assertThat(task.markSucceeded(outcomes("No", "No", "Yes"), 42)).isTrue();
        assertThat(task.markFailed(new FileFailure(FailureReason.REMOTE_ERROR, "late"), Map.of(), 50)).isFalse();
        assertThat(task.abort("cancelled")).isFalse();

        assertThat(task.status()).isEqualTo(FileTaskStatus.SUCCEEDED);
        assertThat(task.state().elapsedMs()).isEqualTo(42);
        assertThat(task.state().failure()).isNull();
    }

    @Test
    void abortFailsQueuedTask() {
        FileTask task = task();

        assertThat(task.abort("job cancelled")).isTrue();

        assertThat(task.status()).isEqualTo(FileTaskStatus.FAILED);
        assertThat(task.state().failure().reason()).isEqualTo(FailureReason.ABORTED);
        assertThat(task.markInFlight()).isFalse();
    }

    @Test
    void flaggedOnlyWhenSucceededWithComplianceIssue() {
        FileTask clean = task();
        clean.markInFlight();
        clean.markSucceeded(outcomes("No", "No", "Yes"), 1);
        assertThat(clean.isFlagged()).isFalse();

        FileTask released = task();
        released.markInFlight();
        released.markSucceeded(outcomes("Yes", "No", "Yes"), 1);
        assertThat(released.isFlagged()).isTrue();

        FileTask noRebuttal = task();
        noRebuttal.markInFlight();
        noRebuttal.markSucceeded(outcomes("No", "No", "No"), 1);
        assertThat(noRebuttal.isFlagged()).isTrue();

        FileTask failed = task();
        failed.markInFlight();
        failed.markFailed(new FileFailure(FailureReason.REMOTE_TIMEOUT, "slow"), outcomes("Yes", "Yes", "No"), 1);
        assertThat(failed.isFlagged()).isFalse();
    }
}
