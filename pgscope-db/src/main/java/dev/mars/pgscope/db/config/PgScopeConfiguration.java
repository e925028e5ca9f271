package dev.mars.pgscope.db.config;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Layered configuration for PgScope.
 *
 * <p>Sources, later ones overriding earlier ones:</p>
 * <ol>
 *   <li>{@code /pgscope-default.properties} on the classpath</li>
 *   <li>{@code /pgscope-<profile>.properties} when the profile is not {@code default}</li>
 *   <li>environment variables, {@code pgscope.pool.max-size} being read from {@code PGSCOPE_POOL_MAX_SIZE}</li>
 *   <li>system properties starting with {@code pgscope.}</li>
 *   <li>explicit overrides passed to the constructor</li>
 * </ol>
 *
 * <p>The active profile comes from the {@code pgscope.profile} system property or the
 * {@code PGSCOPE_PROFILE} environment variable.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class PgScopeConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(PgScopeConfiguration.class);

    private static final String PREFIX = "pgscope.";

    private final Properties properties;
    private final String profile;

    public PgScopeConfiguration() {
        this(getActiveProfile());
    }

    public PgScopeConfiguration(String profile) {
        this(profile, new Properties());
    }

    public PgScopeConfiguration(String profile, Properties overrides) {
        this(profile, overrides, System.getenv());
    }

    PgScopeConfiguration(String profile, Properties overrides, Map<String, String> environment) {
        this.profile = profile;
        this.properties = loadProperties(profile, environment);
        overrides.forEach((key, value) -> properties.setProperty(key.toString(), value.toString()));
        validateConfiguration();
        logger.info("Loaded PgScope configuration for profile: {}", profile);
    }

    private static String getActiveProfile() {
        return System.getProperty("pgscope.profile",
               System.getenv("PGSCOPE_PROFILE") != null ? System.getenv("PGSCOPE_PROFILE") : "default");
    }

    private Properties loadProperties(String profile, Map<String, String> environment) {
        Properties props = new Properties();

        loadPropertiesFromResource(props, "/pgscope-default.properties");
        if (!"default".equals(profile)) {
            loadPropertiesFromResource(props, "/pgscope-" + profile + ".properties");
        }

        // Known keys first so hyphenated names resolve, then anything else with the prefix
        for (String key : props.stringPropertyNames()) {
            String value = environment.get(toEnvironmentName(key));
            if (value != null) {
                props.setProperty(key, value);
            }
        }
        environment.forEach((key, value) -> {
            if (key.startsWith("PGSCOPE_") && !"PGSCOPE_PROFILE".equals(key)) {
                String propKey = key.toLowerCase(Locale.ROOT).replace('_', '.');
                if (!props.containsKey(propKey) && !isKnownUnderAnotherName(props, key)) {
                    props.setProperty(propKey, value);
                }
            }
        });

        System.getProperties().forEach((key, value) -> {
            String propKey = key.toString();
            if (propKey.startsWith(PREFIX)) {
                props.setProperty(propKey, value.toString());
            }
        });

        return props;
    }

    private static boolean isKnownUnderAnotherName(Properties props, String environmentName) {
        for (String key : props.stringPropertyNames()) {
            if (toEnvironmentName(key).equals(environmentName)) {
                return true;
            }
        }
        return false;
    }

    static String toEnvironmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private void loadPropertiesFromResource(Properties props, String resourcePath) {
        try (InputStream is = getClass().getResourceAsStream(resourcePath)) {
            if (is != null) {
                props.load(is);
                logger.debug("Loaded properties from {}", resourcePath);
            } else {
                logger.debug("Properties file not found: {}", resourcePath);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration from " + resourcePath, e);
        }
    }

    private void validateConfiguration() {
        List<String> errors = new ArrayList<>();

        if (getString("pgscope.database.host", "").isEmpty()) {
            errors.add("Database host is required");
        }
        int port = getInt("pgscope.database.port", 5432);
        if (port <= 0 || port > 65535) {
            errors.add("Database port must be between 1 and 65535");
        }
        if (getString("pgscope.database.name", "").isEmpty()) {
            errors.add("Database name is required");
        }

        int minSize = getInt("pgscope.pool.min-size", 1);
        int maxSize = getInt("pgscope.pool.max-size", 10);
        if (maxSize <= 0) {
            errors.add("Pool max size must be positive");
        }
        if (minSize < 0 || minSize > maxSize) {
            errors.add("Pool min size must be between 0 and max size");
        }
        if (getInt("pgscope.pool.max-overflow", 0) < 0) {
            errors.add("Pool max overflow cannot be negative");
        }
        if (getLong("pgscope.engine.query-timeout-ms", 0) < 0) {
            errors.add("Query timeout cannot be negative");
        }
        if (getInt("pgscope.engine.cursor-prefetch", 50) <= 0) {
            errors.add("Cursor prefetch must be positive");
        }
        if (!getString("pgscope.engine.savepoint-prefix", "pgscope_sp_").matches("[A-Za-z_][A-Za-z0-9_]*")) {
            errors.add("Savepoint prefix must be a plain SQL identifier");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Configuration validation failed: " + String.join(", ", errors));
        }
    }

    public String getProfile() {
        return profile;
    }

    public String getString(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Reads a millisecond value as a Duration; zero or a missing key yield {@code null}.
     */
    private Duration getOptionalMillis(String key, long defaultValue) {
        long millis = getLong(key, defaultValue);
        return millis > 0 ? Duration.ofMillis(millis) : null;
    }

    public ConnectionConfig getConnectionConfig() {
        return new ConnectionConfig.Builder()
            .host(getString("pgscope.database.host", "localhost"))
            .port(getInt("pgscope.database.port", 5432))
            .database(getString("pgscope.database.name", "pgscope"))
            .username(getString("pgscope.database.username", "pgscope"))
            .password(getString("pgscope.database.password", ""))
            .schema(getString("pgscope.database.schema", "public"))
            .sslEnabled(getBoolean("pgscope.database.ssl.enabled", false))
            .build();
    }

    public PoolConfig getPoolConfig() {
        return new PoolConfig.Builder()
            .minSize(getInt("pgscope.pool.min-size", 1))
            .maxSize(getInt("pgscope.pool.max-size", 10))
            .maxOverflow(getInt("pgscope.pool.max-overflow", 0))
            .maxWaitQueueSize(getInt("pgscope.pool.max-wait-queue-size", 128))
            .acquireTimeout(getOptionalMillis("pgscope.pool.acquire-timeout-ms", 30000))
            .idleTimeout(getOptionalMillis("pgscope.pool.idle-timeout-ms", 600000))
            .build();
    }

    public EngineConfig getEngineConfig() {
        return new EngineConfig.Builder()
            .strictReleaseOrder(getBoolean("pgscope.engine.strict-release-order", true))
            .queryTimeout(getOptionalMillis("pgscope.engine.query-timeout-ms", 0))
            .savepointPrefix(getString("pgscope.engine.savepoint-prefix", "pgscope_sp_"))
            .cursorPrefetch(getInt("pgscope.engine.cursor-prefetch", 50))
            .build();
    }

    public boolean isMetricsEnabled() {
        return getBoolean("pgscope.metrics.enabled", true);
    }
}
