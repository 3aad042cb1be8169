package com.example.callaudit_backend.model;

import com.example.callaudit_backend.util.DetectorKeys;
import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Result of one detector for one file. An errored outcome carries the {@code Error} value and the
 * error message; the other fields of the file are unaffected.
 *
 * @param value detector verdict ({@code Yes}, {@code No} or {@code Error})
 * @param confidence optional confidence in {@code [0, 1]}
 * @param metadata detector-specific details (durations, transcript, ...)
 * @param error failure message when the detector errored
 */
public record DetectorOutcome(String value,
                              @Nullable Double confidence,
                              Map<String, Object> metadata,
                              @Nullable String error) {

    public DetectorOutcome {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static DetectorOutcome of(String value, @Nullable Double confidence, Map<String, Object> metadata) {
        return new DetectorOutcome(value, confidence, metadata, null);
    }

    public static DetectorOutcome error(String message) {
        return new DetectorOutcome(DetectorKeys.ERROR, null, Map.of(), message == null ? "unknown" : message);
    }

    public boolean isError() {
        return error != null;
    }
}
