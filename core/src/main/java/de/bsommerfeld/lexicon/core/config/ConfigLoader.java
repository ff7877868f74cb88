package de.bsommerfeld.lexicon.core.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link LexiconConfig} from a TOML file. A missing file is created
 * with the defaults so users have something to edit; keys unknown to this
 * version are ignored.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private ConfigLoader() {
    }

    /**
     * @param configPath location of config.toml
     * @return the loaded configuration, defaults for absent keys
     * @throws UncheckedIOException if the file exists but cannot be read or
     *                              parsed, or the default file cannot be
     *                              written
     */
    public static LexiconConfig load(Path configPath) {
        try {
            if (!Files.exists(configPath)) {
                LexiconConfig defaults = new LexiconConfig();
                save(defaults, configPath);
                LOG.info("No configuration at {}, wrote defaults.", configPath);
                return defaults;
            }
            LOG.info("Loading configuration from {}", configPath);
            LexiconConfig config = MAPPER.readValue(configPath.toFile(), LexiconConfig.class);
            if (config.getDatabase() == null)
                config.setDatabase(new DatabaseConfig());
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load configuration from " + configPath, e);
        }
    }

    /**
     * Writes the configuration, creating parent directories as needed.
     */
    public static void save(LexiconConfig config, Path configPath) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent))
            Files.createDirectories(parent);
        MAPPER.writeValue(configPath.toFile(), config);
    }
}
