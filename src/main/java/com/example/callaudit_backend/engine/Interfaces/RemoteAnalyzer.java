package com.example.callaudit_backend.engine.Interfaces;

/**
 * Transcription-backed semantic analysis performed by an external service.
 *
 * <p>Implementations throw {@link com.example.callaudit_backend.exception.RateLimitedException}
 * when the provider throttles, and {@link com.example.callaudit_backend.exception.DetectorException}
 * for everything else.
 */
public interface RemoteAnalyzer {

    Result analyze(Request request);

    record Request(String fileName, byte[] audio, String langHint) {}

    /**
     * @param semanticResult verdict, {@code Yes} or {@code No}
     * @param confidence provider confidence, may be null
     * @param transcript full transcript the verdict was derived from
     */
    record Result(String semanticResult, Double confidence, String transcript) {}
}
