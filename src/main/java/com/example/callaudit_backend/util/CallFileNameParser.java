package com.example.callaudit_backend.util;

import com.example.callaudit_backend.model.CallMetadata;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Reads call attributes from recording names of the form
 * {@code agent _ timestamp _ phone _ disposition.ext} or {@code agent _ phone.ext}.
 */
public final class CallFileNameParser {
    private static final Pattern SEPARATOR = Pattern.compile(" _ ");
    private static final Pattern AGENT_NOISE = Pattern.compile("[-.]");

    private CallFileNameParser() {
    }

    public static CallMetadata parse(Path file) {
        if (file == null || file.getFileName() == null) {
            return CallMetadata.UNKNOWN;
        }
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        String[] parts = SEPARATOR.split(stem);
        if (parts.length == 4) {
            return new CallMetadata(cleanAgent(parts[0]), blankToNull(parts[1]), blankToNull(parts[2]), blankToNull(parts[3]));
        }
        if (parts.length == 2) {
            return new CallMetadata(cleanAgent(parts[0]), null, blankToNull(parts[1]), null);
        }
        return CallMetadata.UNKNOWN;
    }

    static String cleanAgent(String raw) {
        return blankToNull(AGENT_NOISE.matcher(raw).replaceAll(""));
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String trimmed = s.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
