package com.example.callaudit_backend.engine;

import com.example.callaudit_backend.config.DetectorProperties;
import com.example.callaudit_backend.dto.SilenceProfile;
import com.example.callaudit_backend.engine.Interfaces.SilenceDetector;
import com.example.callaudit_backend.model.DetectorOutcome;
import com.example.callaudit_backend.util.DetectorKeys;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Flags calls the agent released without saying anything. Calls shorter than the late-hello
 * threshold are too short to judge and count as {@code No}.
 */
@Component
public class ReleasingDetector extends SilenceBasedDetector {

    public ReleasingDetector(SilenceDetector silenceDetector, DetectorProperties properties) {
        super(silenceDetector, properties);
    }

    @Override
    public String key() {
        return DetectorKeys.RELEASING;
    }

    @Override
    protected DetectorOutcome evaluate(SilenceProfile profile) {
        boolean longEnough = profile.durationMs() >= properties.getLateHelloThreshold().toMillis();
        boolean released = longEnough && !profile.hasSpeech();
        return DetectorOutcome.of(released ? DetectorKeys.YES : DetectorKeys.NO, null,
                Map.of("durationMs", profile.durationMs(), "agentSpoke", profile.hasSpeech()));
    }
}
