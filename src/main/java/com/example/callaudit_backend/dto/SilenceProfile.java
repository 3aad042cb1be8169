package com.example.callaudit_backend.dto;

import java.util.List;

/**
 * Silence intervals of one audio channel over the whole call.
 *
 * @param durationMs call length
 * @param silences ordered silence intervals
 */
public record SilenceProfile(long durationMs, List<SilenceEvent> silences) {

    private static final long EDGE_TOLERANCE_MS = 50L;

    public SilenceProfile {
        silences = silences == null ? List.of() : List.copyOf(silences);
    }

    /**
     * Offset of the first non-silent audio.
     *
     * @return milliseconds from call start, or {@code -1} when the channel never leaves silence
     */
    public long firstSpeechMs() {
        long cursor = 0L;
        for (SilenceEvent silence : silences) {
            if (silence.startMs() > cursor + EDGE_TOLERANCE_MS) {
                return cursor;
            }
            cursor = Math.max(cursor, silence.endMs());
        }
        return cursor + EDGE_TOLERANCE_MS < durationMs ? cursor : -1L;
    }

    public boolean hasSpeech() {
        return firstSpeechMs() >= 0;
    }
}
