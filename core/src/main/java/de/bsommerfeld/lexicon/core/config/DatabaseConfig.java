package de.bsommerfeld.lexicon.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.lexicon.core.util.StorageUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Location and write behavior of the dictionary store. Values are persisted
 * in the {@code [database]} section of config.toml.
 */
public class DatabaseConfig {

    @JsonProperty("directory")
    private String directory = StorageUtils.getAppDataDir().toString();

    @JsonProperty("file-name")
    private String fileName = "dict.sqlite";

    /**
     * Wraps every bulk insert call in one transaction. Disabled, rows inserted
     * before a failing row stay persisted.
     */
    @JsonProperty("transactional-bulk-add")
    private boolean transactionalBulkAdd = true;

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    public boolean isTransactionalBulkAdd() {
        return transactionalBulkAdd;
    }

    public void setTransactionalBulkAdd(boolean transactionalBulkAdd) {
        this.transactionalBulkAdd = transactionalBulkAdd;
    }

    /** Absolute path of the SQLite file. */
    public Path resolveDatabaseFile() {
        return Paths.get(directory).resolve(fileName).toAbsolutePath();
    }
}
