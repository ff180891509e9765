package de.bsommerfeld.feedengine.core.config;

import de.bsommerfeld.feedengine.core.util.StorageUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Auto-transcription of newly ingested videos.
 */
public class EnrichmentConfig {

    private boolean autoTranscribe = true;
    private String qualityTier = "tiny";
    private String cacheDir = "";
    private int maxPerCycle = 3;

    public boolean isAutoTranscribe() {
        return autoTranscribe;
    }

    public void setAutoTranscribe(boolean autoTranscribe) {
        this.autoTranscribe = autoTranscribe;
    }

    /** Model size handed to the transcriber; part of the cache key. */
    public String getQualityTier() {
        return qualityTier;
    }

    public void setQualityTier(String qualityTier) {
        this.qualityTier = qualityTier;
    }

    public String getCacheDir() {
        return cacheDir;
    }

    public void setCacheDir(String cacheDir) {
        this.cacheDir = cacheDir == null ? "" : cacheDir;
    }

    public int getMaxPerCycle() {
        return maxPerCycle;
    }

    public void setMaxPerCycle(int maxPerCycle) {
        this.maxPerCycle = maxPerCycle;
    }

    /** Returns the configured cache directory, or {@code {appData}/transcripts}. */
    public Path resolveCacheDir() {
        if (cacheDir == null || cacheDir.isBlank()) {
            return StorageUtils.getAppDataDir(StorageUtils.APP_NAME).resolve("transcripts");
        }
        return Paths.get(cacheDir).toAbsolutePath();
    }
}
