package de.bsommerfeld.feedengine.app.config;

import com.google.inject.AbstractModule;
import de.bsommerfeld.feedengine.core.config.ApplicationMode;
import de.bsommerfeld.feedengine.core.config.ConfigLoader;
import de.bsommerfeld.feedengine.core.config.EnrichmentConfig;
import de.bsommerfeld.feedengine.core.config.GlobalConfig;
import de.bsommerfeld.feedengine.core.config.HttpConfig;
import de.bsommerfeld.feedengine.core.config.IngestionConfig;
import de.bsommerfeld.feedengine.core.config.StoreConfig;
import de.bsommerfeld.feedengine.core.util.StorageUtils;
import de.bsommerfeld.feedengine.db.DatabaseService;
import de.bsommerfeld.feedengine.db.SqlDatabaseService;
import de.bsommerfeld.feedengine.db.TestDatabaseService;
import de.bsommerfeld.feedengine.enrichment.Transcriber;
import de.bsommerfeld.feedengine.enrichment.UnavailableTranscriber;
import de.bsommerfeld.feedengine.sources.http.HttpFetcher;
import de.bsommerfeld.feedengine.sources.http.JdkHttpFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Guice module wiring the feed engine.
 *
 * <p>
 * Without arguments the configuration is read from {@code config.yml} in the
 * application data directory. The {@link ApplicationMode} decides between the
 * SQLite store and the in-memory TEST store.
 */
public class AppModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(AppModule.class);

    private final GlobalConfig config;
    private final ApplicationMode mode;

    public AppModule() {
        this(loadDefaultConfig(), ApplicationMode.get());
    }

    public AppModule(GlobalConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(GlobalConfig.class).toInstance(config);
        bind(StoreConfig.class).toInstance(config.getStore());
        bind(HttpConfig.class).toInstance(config.getHttp());
        bind(IngestionConfig.class).toInstance(config.getIngestion());
        bind(EnrichmentConfig.class).toInstance(config.getEnrichment());

        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            bind(DatabaseService.class).to(TestDatabaseService.class);
        } else {
            bind(DatabaseService.class).to(SqlDatabaseService.class);
        }

        bind(HttpFetcher.class).to(JdkHttpFetcher.class);
        bind(Transcriber.class).to(UnavailableTranscriber.class);
    }

    private static GlobalConfig loadDefaultConfig() {
        try {
            Path appDataDir = StorageUtils.getAppDataDir(StorageUtils.APP_NAME);
            if (!Files.exists(appDataDir))
                Files.createDirectories(appDataDir);
            return ConfigLoader.load(StorageUtils.getConfigFile(StorageUtils.APP_NAME));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load application configuration", e);
        }
    }
}
