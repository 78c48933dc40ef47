package com.promptvault.repository;

import com.promptvault.exception.StorageException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Owns the database layout: three tables, their indexes and the cascading
 * foreign keys from versions and usage logs to prompts.
 *
 * <p>The script only uses {@code IF NOT EXISTS} statements, so
 * {@link #ensureSchema()} can run on every startup against an existing file.
 */
@Slf4j
@Component
public class SchemaManager {

    static final String SCHEMA_SCRIPT = "db/schema.sql";

    private final DataSource dataSource;

    public SchemaManager(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @PostConstruct
    public void init() {
        ensureSchema();
    }

    /**
     * Create tables and indexes if absent.
     *
     * @throws StorageException when the database cannot be opened or the script fails
     */
    public void ensureSchema() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT));
        populator.setContinueOnError(false);
        populator.setSqlScriptEncoding("UTF-8");
        try {
            DatabasePopulatorUtils.execute(populator, dataSource);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to initialize prompt library schema", e);
        }
        log.info("Prompt library schema ready");
    }
}
