package com.example.callaudit_backend.model;

import com.example.callaudit_backend.util.DetectorKeys;
import com.example.callaudit_backend.util.FailureReason;
import com.example.callaudit_backend.util.FileTaskStatus;
import org.springframework.lang.Nullable;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Unit of work for one audio file inside an {@link AuditJob}.
 *
 * <p>State moves only {@code QUEUED -> IN_FLIGHT -> SUCCEEDED|FAILED}. Every transition is a
 * compare-and-set on an immutable {@link State}, so the first terminal write wins and a terminal
 * task can no longer change.
 */
public final class FileTask {

    private final int index;
    private final Path file;
    private final CallMetadata metadata;
    private final AtomicReference<State> state = new AtomicReference<>(State.QUEUED);

    public FileTask(int index, Path file, CallMetadata metadata) {
        this.index = index;
        this.file = file;
        this.metadata = metadata == null ? CallMetadata.UNKNOWN : metadata;
    }

    public int getIndex() {
        return index;
    }

    public Path getFile() {
        return file;
    }

    public CallMetadata getMetadata() {
        return metadata;
    }

    public State state() {
        return state.get();
    }

    public FileTaskStatus status() {
        return state.get().status();
    }

    public boolean isTerminal() {
        return status().isTerminal();
    }

    /**
     * Claims a queued task for processing.
     *
     * @return {@code false} when the task was already claimed or aborted
     */
    public boolean markInFlight() {
        return state.compareAndSet(State.QUEUED, State.IN_FLIGHT);
    }

    public boolean markSucceeded(Map<String, DetectorOutcome> outcomes, long elapsedMs) {
        return finish(new State(FileTaskStatus.SUCCEEDED, outcomes, null, elapsedMs));
    }

    public boolean markFailed(FileFailure failure, Map<String, DetectorOutcome> outcomes, long elapsedMs) {
        return finish(new State(FileTaskStatus.FAILED, outcomes, failure, elapsedMs));
    }

    /**
     * Fails a task that has not reached a terminal state yet. A queued task is first moved to
     * in-flight so the transition chain stays legal.
     *
     * @return {@code true} if this call made the task terminal
     */
    public boolean abort(String reason) {
        markInFlight();
        State current = state.get();
        return markFailed(new FileFailure(FailureReason.ABORTED, reason), current.outcomes(), current.elapsedMs());
    }

    private boolean finish(State next) {
        while (true) {
            State current = state.get();
            if (current.status() != FileTaskStatus.IN_FLIGHT) {
                return false;
            }
            if (state.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    /**
     * A succeeded file is flagged when the agent released the call, greeted late or did not rebut.
     */
    public boolean isFlagged() {
        State current = state.get();
        if (current.status() != FileTaskStatus.SUCCEEDED) {
            return false;
        }
        return DetectorKeys.YES.equals(current.value(DetectorKeys.RELEASING))
                || DetectorKeys.YES.equals(current.value(DetectorKeys.LATE_HELLO))
                || DetectorKeys.NO.equals(current.value(DetectorKeys.REBUTTAL));
    }

    /**
     * Immutable view of a task's progress.
     *
     * @param status lifecycle state
     * @param outcomes detector outcomes keyed by {@link DetectorKeys} names
     * @param failure populated for failed tasks
     * @param elapsedMs wall time spent on the file
     */
    public record State(FileTaskStatus status,
                        Map<String, DetectorOutcome> outcomes,
                        @Nullable FileFailure failure,
                        long elapsedMs) {

        static final State QUEUED = new State(FileTaskStatus.QUEUED, Map.of(), null, 0L);
        static final State IN_FLIGHT = new State(FileTaskStatus.IN_FLIGHT, Map.of(), null, 0L);

        public State {
            outcomes = outcomes == null ? Map.of() : Map.copyOf(outcomes);
        }

        @Nullable
        public String value(String key) {
            DetectorOutcome outcome = outcomes.get(key);
            return outcome == null ? null : outcome.value();
        }
    }
}
