package de.bsommerfeld.lexicon.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of config.toml.
 */
public class LexiconConfig {

    @JsonProperty("database")
    private DatabaseConfig database = new DatabaseConfig();

    public DatabaseConfig getDatabase() {
        return database;
    }

    public void setDatabase(DatabaseConfig database) {
        this.database = database;
    }
}
