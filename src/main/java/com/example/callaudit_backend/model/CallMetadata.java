package com.example.callaudit_backend.model;

import org.springframework.lang.Nullable;

/**
 * Call attributes encoded in the recording's file name.
 */
public record CallMetadata(@Nullable String agent,
                           @Nullable String timestamp,
                           @Nullable String phone,
                           @Nullable String disposition) {

    public static final CallMetadata UNKNOWN = new CallMetadata(null, null, null, null);
}
