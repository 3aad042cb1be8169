package com.example.callaudit_backend.engine;

import com.example.callaudit_backend.config.DetectorProperties;
import com.example.callaudit_backend.dto.SilenceEvent;
import com.example.callaudit_backend.dto.SilenceProfile;
import com.example.callaudit_backend.engine.Interfaces.SilenceDetector;
import com.example.callaudit_backend.exception.DetectorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs {@code ffmpeg silencedetect} on one channel of a recording and parses the silence
 * intervals from its log.
 */
@Component
public class FfmpegSilenceDetector implements SilenceDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegSilenceDetector.class);
    private static final Pattern START = Pattern.compile("silence_start: (-?[0-9.]+)");
    private static final Pattern END = Pattern.compile("silence_end: ([0-9.]+)");
    private static final Pattern DURATION = Pattern.compile("Duration: (\\d+):(\\d{2}):(\\d{2}(?:\\.\\d+)?)");

    private final DetectorProperties properties;

    public FfmpegSilenceDetector(DetectorProperties properties) {
        this.properties = properties;
    }

    @Override
    public SilenceProfile detect(Path audio, int channel, double noiseDb, double minSilenceSec) {
        String filter = String.format(Locale.ROOT, "pan=mono|c0=c%d,silencedetect=noise=%.1fdB:d=%.2f", channel, noiseDb, minSilenceSec);
        List<String> cmd = List.of(
                properties.getFfmpegBinary(), "-hide_banner", "-nostats",
                "-i", audio.toString(),
                "-af", filter,
                "-f", "null", "-"
        );
        Path log = null;
        Process p = null;
        try {
            log = Files.createTempFile("silencedetect-", ".log");
            p = new ProcessBuilder(cmd).redirectErrorStream(true).redirectOutput(log.toFile()).start();
            if (!p.waitFor(properties.getProcessTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new DetectorException("ffmpeg silencedetect timed out after " + properties.getProcessTimeout().toSeconds() + "s", false);
            }
            List<String> lines = Files.readAllLines(log, StandardCharsets.UTF_8);
            if (p.exitValue() != 0) {
                String tail = lines.isEmpty() ? "" : lines.get(lines.size() - 1);
                throw new DetectorException("ffmpeg silencedetect exit=" + p.exitValue() + " " + tail, false);
            }
            SilenceProfile profile = parse(lines);
            LOGGER.debug("silencedetect file={} channel={} duration={}ms silences={}", audio.getFileName(), channel, profile.durationMs(), profile.silences().size());
            return profile;
        } catch (IOException e) {
            throw new DetectorException("ffmpeg silencedetect failed: " + e.getMessage(), false, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (p != null) {
                p.destroyForcibly();
            }
            throw new DetectorException("ffmpeg silencedetect interrupted", false, e);
        } finally {
            deleteQuietly(log);
        }
    }

    static SilenceProfile parse(List<String> lines) {
        List<Double> starts = new ArrayList<>();
        List<Double> ends = new ArrayList<>();
        long durationMs = 0L;
        for (String line : lines) {
            Matcher d = DURATION.matcher(line);
            if (durationMs == 0L && d.find()) {
                durationMs = Math.round((Integer.parseInt(d.group(1)) * 3600 + Integer.parseInt(d.group(2)) * 60
                        + Double.parseDouble(d.group(3))) * 1000);
            }
            Matcher m1 = START.matcher(line);
            if (m1.find()) starts.add(Math.max(0.0, Double.parseDouble(m1.group(1))));
            Matcher m2 = END.matcher(line);
            if (m2.find()) ends.add(Double.parseDouble(m2.group(1)));
        }

        List<SilenceEvent> out = new ArrayList<>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            long s = Math.round(starts.get(i) * 1000);
            // silence running into end of file has no silence_end line on older ffmpeg builds
            long e = i < ends.size() ? Math.round(ends.get(i) * 1000) : durationMs;
            if (e > s) out.add(new SilenceEvent(s, e));
        }
        return new SilenceProfile(durationMs, out);
    }

    private void deleteQuietly(Path log) {
        if (log == null) {
            return;
        }
        try {
            Files.deleteIfExists(log);
        } catch (IOException e) {
            LOGGER.warn("could not delete ffmpeg log {}: {}", log, e.getMessage());
        }
    }
}
