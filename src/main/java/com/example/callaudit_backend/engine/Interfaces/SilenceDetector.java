package com.example.callaudit_backend.engine.Interfaces;

import com.example.callaudit_backend.dto.SilenceProfile;

import java.nio.file.Path;

public interface SilenceDetector {
    SilenceProfile detect(Path audio, int channel, double noiseDb, double minSilenceSec);
}
