package me.christianrobert.orapgroutines.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory configuration for the routine translator.
 *
 * <p>Translation keys:
 * <ul>
 *   <li>{@code translation.naming-mode} - SCHEMA_PER_PACKAGE or FLATTENED</li>
 *   <li>{@code translation.revoke-grantee} - role losing access to private routines</li>
 *   <li>{@code translation.parallelism} - worker count for batch runs</li>
 * </ul>
 *
 * <p>The {@code sync.*} and {@code typemap.*} keys belong to the incremental sync and
 * external type mapping features. They are stored and exposed here but the routine
 * translation pipeline does not read them.
 */
@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String NAMING_MODE = "translation.naming-mode";
    public static final String REVOKE_GRANTEE = "translation.revoke-grantee";
    public static final String PARALLELISM = "translation.parallelism";
    public static final String INCREMENTAL_SYNC_ENABLED = "sync.incremental.enabled";
    public static final String EXTERNAL_TYPE_MAP_ENABLED = "typemap.external.enabled";
    public static final String EXTERNAL_TYPE_MAP_PATH = "typemap.external.path";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(NAMING_MODE, "SCHEMA_PER_PACKAGE");
        configuration.put(REVOKE_GRANTEE, "PUBLIC");
        configuration.put(PARALLELISM, 4);
        configuration.put(INCREMENTAL_SYNC_ENABLED, false);
        configuration.put(EXTERNAL_TYPE_MAP_ENABLED, false);
        configuration.put(EXTERNAL_TYPE_MAP_PATH, "");

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Gets a configuration value as an integer.
     * Accepts numbers and numeric strings (REST clients send both).
     *
     * @param key Configuration key
     * @param defaultValue Returned when the key is missing or not numeric
     */
    public int getConfigValueAsInt(String key, int defaultValue) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} = '{}' is not a number, using {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });

        log.info("Configuration updated successfully");
    }

    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }
}
