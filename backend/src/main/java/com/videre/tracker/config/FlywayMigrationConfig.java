package com.videre.tracker.config;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlywayMigrationConfig {
    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy(
            @Value("${tracker.flyway.repair-on-start:false}") boolean repairOnStart) {
        return flyway -> {
            MigrationInfo[] pending = flyway.info().pending();
            log.info("[Flyway] {} pending migration(s)", pending.length);
            if (repairOnStart) {
                log.info("[Flyway] Running repair before migrate (to clean failed migrations)");
                flyway.repair();
            }
            flyway.migrate();
        };
    }
}
