package com.example.callaudit_backend.engine;

import com.example.callaudit_backend.config.DetectorProperties;
import com.example.callaudit_backend.dto.SilenceProfile;
import com.example.callaudit_backend.engine.Interfaces.SilenceDetector;
import com.example.callaudit_backend.model.DetectorOutcome;
import com.example.callaudit_backend.util.DetectorKeys;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Flags calls where the agent's first words come after the late-hello threshold. A call without
 * any agent speech is left to {@link ReleasingDetector} and reported {@code No} here.
 */
@Component
public class LateHelloDetector extends SilenceBasedDetector {

    public LateHelloDetector(SilenceDetector silenceDetector, DetectorProperties properties) {
        super(silenceDetector, properties);
    }

    @Override
    public String key() {
        return DetectorKeys.LATE_HELLO;
    }

    @Override
    protected DetectorOutcome evaluate(SilenceProfile profile) {
        long firstSpeech = profile.firstSpeechMs();
        if (firstSpeech < 0) {
            return DetectorOutcome.of(DetectorKeys.NO, null, Map.of("agentSpoke", false));
        }
        boolean late = firstSpeech > properties.getLateHelloThreshold().toMillis();
        return DetectorOutcome.of(late ? DetectorKeys.YES : DetectorKeys.NO, null, Map.of("firstSpeechMs", firstSpeech));
    }
}
