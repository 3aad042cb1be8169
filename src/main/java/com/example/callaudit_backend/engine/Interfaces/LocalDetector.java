package com.example.callaudit_backend.engine.Interfaces;

import com.example.callaudit_backend.model.DetectorOutcome;

import java.nio.file.Path;

/**
 * Fast signal-based detector that runs on this host.
 */
public interface LocalDetector {

    /**
     * @return report key this detector fills, see {@link com.example.callaudit_backend.util.DetectorKeys}
     */
    String key();

    DetectorOutcome detect(Path audio) throws Exception;
}
