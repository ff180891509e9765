package de.bsommerfeld.feedengine.enrichment;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.Optional;

/**
 * On-disk transcript store. One JSON file per (url, quality tier) pair,
 * named after the hex SHA-256 of {@code url|tier}:
 *
 * <pre>
 * {cacheDir}/{sha256(url + "|" + tier)}.json
 *   { "url": ..., "quality": ..., "transcript": ..., "created_at": ... }
 * </pre>
 *
 * <p>
 * Files are written to a temp sibling first and moved into place, so a
 * crashed write never leaves a half-written entry that would count as a hit.
 */
public class TranscriptCache {

    private static final Logger LOG = LoggerFactory.getLogger(TranscriptCache.class);

    private final Path directory;
    private final ObjectMapper mapper = new ObjectMapper();

    public TranscriptCache(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    /** True when a readable entry exists; corrupt files count as missing. */
    public boolean contains(String url, String qualityTier) {
        return get(url, qualityTier).isPresent();
    }

    /**
     * Returns the cached entry, or empty when absent or unreadable.
     */
    public Optional<Entry> get(String url, String qualityTier) {
        Path file = fileFor(url, qualityTier);
        if (!Files.isRegularFile(file))
            return Optional.empty();
        try {
            return Optional.of(mapper.readValue(file.toFile(), Entry.class));
        } catch (IOException e) {
            LOG.warn("Unreadable transcript cache entry {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public Entry put(String url, String qualityTier, String transcript) throws IOException {
        Files.createDirectories(directory);
        Entry entry = new Entry(url, qualityTier, transcript,
                Instant.now().truncatedTo(ChronoUnit.SECONDS).toString());
        Path target = fileFor(url, qualityTier);
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), entry);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOG.debug("Cached transcript for {} ({})", url, qualityTier);
        return entry;
    }

    Path fileFor(String url, String qualityTier) {
        return directory.resolve(key(url, qualityTier) + ".json");
    }

    /** Hex SHA-256 of {@code url + "|" + qualityTier}. */
    public static String key(String url, String qualityTier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((url + "|" + qualityTier).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("SHA-256 not available", e);
        }
    }

    /** Serialized form of one cached transcript. */
    public record Entry(
            @JsonProperty("url") String url,
            @JsonProperty("quality") String quality,
            @JsonProperty("transcript") String transcript,
            @JsonProperty("created_at") String createdAt) {
    }
}
