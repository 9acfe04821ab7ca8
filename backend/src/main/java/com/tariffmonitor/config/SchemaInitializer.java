package com.tariffmonitor.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Creates the tracked document schema when a run asks for it. Migrations are written with
 * {@code IF NOT EXISTS} so an existing table from an earlier install is adopted as-is.
 */
@Component
public class SchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    private final DataSource dataSource;

    public SchemaInitializer(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public synchronized int initialize() {
        MigrateResult result = Flyway.configure()
            .dataSource(dataSource)
            .locations("classpath:db/migration")
            .baselineOnMigrate(true)
            .baselineVersion("0")
            .load()
            .migrate();
        log.info("Schema initialized: {} migration(s) applied", result.migrationsExecuted);
        return result.migrationsExecuted;
    }
}
