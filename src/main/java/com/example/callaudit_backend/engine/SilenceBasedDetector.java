package com.example.callaudit_backend.engine;

import com.example.callaudit_backend.config.DetectorProperties;
import com.example.callaudit_backend.dto.SilenceProfile;
import com.example.callaudit_backend.engine.Interfaces.LocalDetector;
import com.example.callaudit_backend.engine.Interfaces.SilenceDetector;
import com.example.callaudit_backend.exception.DetectorException;
import com.example.callaudit_backend.model.DetectorOutcome;

import java.nio.file.Path;

/**
 * Local detector judging the agent channel's silence profile.
 */
abstract class SilenceBasedDetector implements LocalDetector {

    protected final SilenceDetector silenceDetector;
    protected final DetectorProperties properties;

    protected SilenceBasedDetector(SilenceDetector silenceDetector, DetectorProperties properties) {
        this.silenceDetector = silenceDetector;
        this.properties = properties;
    }

    @Override
    public DetectorOutcome detect(Path audio) {
        SilenceProfile profile = silenceDetector.detect(audio, properties.getAgentChannel(), properties.getNoiseDb(), properties.getMinSilenceSec());
        if (profile.durationMs() < properties.getMinCallDuration().toMillis()) {
            throw new DetectorException("audio too short: " + profile.durationMs() + "ms", false);
        }
        return evaluate(profile);
    }

    protected abstract DetectorOutcome evaluate(SilenceProfile profile);
}
