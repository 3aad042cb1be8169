package com.example.callaudit_backend.service;

import com.example.callaudit_backend.config.BatchEngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds recordings in a folder tree and checks that a single file is usable audio.
 */
@Service
public class AudioFileDiscovery {
    private static final Logger LOGGER = LoggerFactory.getLogger(AudioFileDiscovery.class);

    private final BatchEngineProperties properties;

    public AudioFileDiscovery(BatchEngineProperties properties) {
        this.properties = properties;
    }

    /**
     * Walks {@code folder} recursively and returns the recordings with a supported extension,
     * sorted by path.
     *
     * @throws IllegalArgumentException if {@code folder} is not a directory
     */
    public List<Path> discover(Path folder) {
        if (folder == null || !Files.isDirectory(folder)) {
            throw new IllegalArgumentException("not a directory: " + folder);
        }
        Set<String> extensions = extensions();
        try (Stream<Path> walk = Files.walk(folder)) {
            List<Path> found = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> extensions.contains(extensionOf(p)))
                    .sorted()
                    .toList();
            LOGGER.info("DISCOVER folder={} files={}", folder, found.size());
            return found;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to scan " + folder, e);
        }
    }

    /**
     * @return a human-readable problem, or empty when the file can be processed
     */
    public Optional<String> validate(Path file) {
        if (file == null || !Files.exists(file)) {
            return Optional.of("file not found: " + file);
        }
        if (!Files.isRegularFile(file)) {
            return Optional.of("not a regular file: " + file);
        }
        if (!extensions().contains(extensionOf(file))) {
            return Optional.of("unsupported format: " + file.getFileName());
        }
        try {
            long size = Files.size(file);
            if (size < properties.getMinAudioBytes()) {
                return Optional.of("file too small: " + size + " bytes");
            }
        } catch (IOException e) {
            return Optional.of("cannot stat file: " + e.getMessage());
        }
        return Optional.empty();
    }

    private Set<String> extensions() {
        return properties.getAudioExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
                .collect(Collectors.toSet());
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
