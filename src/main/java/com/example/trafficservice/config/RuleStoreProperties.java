package com.example.trafficservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the rule store and rule engine.
 *
 * <h3>Configuration Example:</h3>
 * <pre>
 * rules:
 *   persistence-file: ./storage/rules.json
 *   auto-reload: true
 *   presets-location: classpath:presets.json
 * </pre>
 */
@Configuration
@ConfigurationProperties(prefix = "rules")
@Data
public class RuleStoreProperties {

    /**
     * JSON file the rules are saved to after every change and loaded from on startup.
     * Empty keeps the rules in memory only.
     */
    private String persistenceFile;

    /**
     * Reload the engine snapshot after every store change. When false, changes only become
     * visible through an explicit reload.
     */
    private boolean autoReload = true;

    private String presetsLocation = "classpath:presets.json";

    public boolean isPersistenceEnabled() {
        return persistenceFile != null && !persistenceFile.isBlank();
    }
}
