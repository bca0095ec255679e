package com.videre.tracker.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Refuses to start with a schema-dropping ddl-auto outside test profiles.
 */
@Configuration
public class DatabaseSafetyConfig {
    private static final Logger log = LoggerFactory.getLogger(DatabaseSafetyConfig.class);

    private final Environment environment;

    @Value("${spring.jpa.hibernate.ddl-auto:none}")
    private String ddlAuto;

    @Value("${spring.datasource.url:}")
    private String datasourceUrl;

    public DatabaseSafetyConfig(Environment environment) {
        this.environment = environment;
    }

    @PostConstruct
    public void verifyDdlAuto() {
        String activeProfiles = String.join(",", environment.getActiveProfiles());
        String profiles = safeLower(activeProfiles);
        String ddl = safeLower(ddlAuto).replace('_', '-');
        String url = datasourceUrl == null ? "" : datasourceUrl;

        log.info("[DB_SAFETY] Active profiles='{}', ddl-auto='{}', datasource='{}'", activeProfiles, ddlAuto, url);

        boolean dropsSchema = "create".equals(ddl) || "create-drop".equals(ddl);
        if (dropsSchema && !profiles.contains("test")) {
            throw new IllegalStateException("ddl-auto=" + ddlAuto + " outside a test profile, aborting startup");
        }
        if (url.toLowerCase().contains("mem:")) {
            log.warn("[DB_SAFETY] In-memory database, ingested events will not survive a restart");
        }
    }

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase();
    }
}
