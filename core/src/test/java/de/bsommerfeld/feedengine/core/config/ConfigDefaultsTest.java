package de.bsommerfeld.feedengine.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigDefaultsTest {

    @Test
    void globalConfig_shouldInitializeWithDefaults() {
        var config = new GlobalConfig();

        assertNotNull(config.getStore());
        assertNotNull(config.getHttp());
        assertNotNull(config.getIngestion());
        assertNotNull(config.getEnrichment());
    }

    @Test
    void ingestionConfig_shouldHaveReasonableDefaults() {
        var config = new IngestionConfig();

        assertEquals(4, config.getFetchConcurrency());
        assertEquals(8, config.getHackerNewsConcurrency());
        assertEquals(0, config.getDefaultLimit());
        assertEquals(ContentPolicy.SUMMARY_FIRST, config.getContentPolicy());
    }

    @Test
    void enrichmentConfig_shouldDefaultToTinyTier() {
        var config = new EnrichmentConfig();

        assertTrue(config.isAutoTranscribe());
        assertEquals("tiny", config.getQualityTier());
        assertEquals(3, config.getMaxPerCycle());
        assertTrue(config.resolveCacheDir().toString().contains("transcripts"));
    }

    @Test
    void storeConfig_shouldResolveToAppDataWhenUnset() {
        var config = new StoreConfig();
        assertTrue(config.resolvePath().endsWith(StoreConfig.DEFAULT_FILE_NAME));
    }

    @Test
    void storeConfig_shouldUseExplicitPath(@TempDir Path tempDir) {
        Path db = tempDir.resolve("custom.db");
        var config = new StoreConfig(db);
        assertEquals(db.toAbsolutePath(), config.resolvePath());
    }

    @Test
    void httpConfig_shouldDefaultToTwentySecondTimeout() {
        assertEquals(20, new HttpConfig().getTimeoutSeconds());
    }
}
