package de.bsommerfeld.lexicon.db;

import com.google.inject.AbstractModule;
import de.bsommerfeld.lexicon.core.config.ConfigLoader;
import de.bsommerfeld.lexicon.core.config.DatabaseConfig;
import de.bsommerfeld.lexicon.core.config.LexiconConfig;
import de.bsommerfeld.lexicon.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice module wiring the configuration and the dictionary store.
 */
public class DatabaseModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseModule.class);

    private final Path configPath;

    public DatabaseModule() {
        this(StorageUtils.getConfigFile());
    }

    public DatabaseModule(Path configPath) {
        this.configPath = configPath;
    }

    @Override
    protected void configure() {
        LOG.info("Loading configuration from: {}", configPath.toAbsolutePath());
        LexiconConfig config = ConfigLoader.load(configPath);

        bind(LexiconConfig.class).toInstance(config);
        bind(DatabaseConfig.class).toInstance(config.getDatabase());

        bind(DictionaryDatabase.class).to(SqlDictionaryDatabase.class);
    }
}
