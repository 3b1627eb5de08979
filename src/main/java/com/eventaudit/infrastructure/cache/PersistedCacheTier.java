package com.eventaudit.infrastructure.cache;

import com.eventaudit.domain.exception.CacheCorruptException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Optional;

/**
 * File-backed cache tier: one JSON artifact per key, named by the key digest.
 *
 * Writes go to a temp file in the same directory and are then renamed over
 * the target, so readers see either the old artifact or the new one.
 */
@Slf4j
public class PersistedCacheTier {

    private static final String ARTIFACT_GLOB = "*.json";
    private static final String ARTIFACT_SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public PersistedCacheTier(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    /**
     * Read the artifact for a key.
     *
     * @return empty when no artifact exists or it belongs to a different key
     * @throws CacheCorruptException when the artifact exists but cannot be decoded
     */
    public <T> Optional<CacheEntry> read(CacheKey key, Class<T> type) {
        Path file = artifactPath(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            CacheArtifact artifact = objectMapper.readValue(Files.readAllBytes(file), CacheArtifact.class);
            if (artifact == null || artifact.getCreatedAt() == null || artifact.getPayload() == null) {
                throw new CacheCorruptException("Incomplete cache artifact: " + file, null);
            }
            if (!key.getEncoded().equals(artifact.getKey())) {
                log.warn("Cache artifact {} belongs to a different key, ignoring", file.getFileName());
                return Optional.empty();
            }
            T value = objectMapper.treeToValue(artifact.getPayload(), type);
            return Optional.of(new CacheEntry(
                    key,
                    value,
                    artifact.getCreatedAt(),
                    Duration.ofSeconds(artifact.getTtlSeconds()),
                    CacheTier.PERSISTED));
        } catch (NoSuchFileException e) {
            // removed between the existence check and the read
            return Optional.empty();
        } catch (IOException | IllegalArgumentException e) {
            throw new CacheCorruptException("Unreadable cache artifact: " + file, e);
        }
    }

    public void write(CacheEntry entry) throws IOException {
        CacheArtifact artifact = CacheArtifact.builder()
                .key(entry.getKey().getEncoded())
                .ttlClass(entry.getKey().getQueryClass())
                .createdAt(entry.getCreatedAt())
                .ttlSeconds(entry.getTtl().toSeconds())
                .payload(objectMapper.valueToTree(entry.getValue()))
                .build();

        Files.createDirectories(directory);
        Path target = artifactPath(entry.getKey());
        Path temp = Files.createTempFile(directory, entry.getKey().digest(), TEMP_SUFFIX);
        try {
            Files.write(temp, objectMapper.writeValueAsBytes(artifact));
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Persisted cache artifact for key: {}", entry.getKey());
    }

    /**
     * Delete every artifact (and any leftover temp file).
     *
     * @return number of artifacts removed
     */
    public int clear() {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int removed = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                if (name.endsWith(ARTIFACT_SUFFIX)) {
                    if (Files.deleteIfExists(file)) {
                        removed++;
                    }
                } else if (name.endsWith(TEMP_SUFFIX)) {
                    Files.deleteIfExists(file);
                }
            }
        } catch (IOException e) {
            log.warn("Could not fully clear persisted cache at {}: {}", directory, e.getMessage());
        }
        return removed;
    }

    public int size() {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        int count = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, ARTIFACT_GLOB)) {
            for (Path ignored : files) {
                count++;
            }
        } catch (IOException e) {
            log.warn("Could not list persisted cache at {}: {}", directory, e.getMessage());
        }
        return count;
    }

    Path artifactPath(CacheKey key) {
        return directory.resolve(key.digest() + ARTIFACT_SUFFIX);
    }
}
