package com.example.callaudit_backend.util;

/**
 * Result keys for the three per-file detectors, as they appear in job reports.
 */
public final class DetectorKeys {
    public static final String RELEASING = "releasing";
    public static final String LATE_HELLO = "late_hello";
    public static final String REBUTTAL = "rebuttal";

    public static final String YES = "Yes";
    public static final String NO = "No";
    public static final String ERROR = "Error";

    private DetectorKeys() {
    }
}
