package com.promptvault.config;

import com.promptvault.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Storage wiring: one H2 file database inside the configured data directory.
 * The directory is created on startup; failing that is fatal.
 */
@Slf4j
@Configuration
public class StorageConfiguration {

    static final String H2_DRIVER = "org.h2.Driver";

    @Bean
    public DataSource dataSource(PromptVaultProperties properties) {
        PromptVaultProperties.StorageConfig storage = properties.getStorage();
        Path dataDir = storage.resolveDataDir();

        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create data directory " + dataDir, e);
        }
        if (!Files.isWritable(dataDir)) {
            throw new StorageException("Data directory is not writable: " + dataDir);
        }

        String url = jdbcUrl(storage.resolveDatabaseFile());
        log.info("Opening prompt library database: {}", url);

        return DataSourceBuilder.create()
                .driverClassName(H2_DRIVER)
                .url(url)
                .username("sa")
                .password("")
                .build();
    }

    static String jdbcUrl(Path databaseFile) {
        return "jdbc:h2:file:" + databaseFile.toString().replace('\\', '/') + ";DB_CLOSE_ON_EXIT=FALSE";
    }
}
