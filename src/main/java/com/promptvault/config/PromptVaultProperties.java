package com.promptvault.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration properties for PromptVault.
 */
@Data
@Component
@ConfigurationProperties(prefix = "promptvault")
public class PromptVaultProperties {

    private StorageConfig storage = new StorageConfig();
    private SnapshotConfig snapshot = new SnapshotConfig();

    @Data
    public static class StorageConfig {
        /**
         * Application-owned writable directory holding the database file.
         */
        private String dataDir = System.getProperty("user.home") + "/.promptvault";

        /**
         * Base name of the H2 database file (H2 appends {@code .mv.db}).
         */
        private String fileName = "prompt-library";

        public Path resolveDataDir() {
            return Paths.get(dataDir).toAbsolutePath().normalize();
        }

        public Path resolveDatabaseFile() {
            return resolveDataDir().resolve(fileName);
        }
    }

    @Data
    public static class SnapshotConfig {
        private boolean prettyPrint = true;
    }
}
