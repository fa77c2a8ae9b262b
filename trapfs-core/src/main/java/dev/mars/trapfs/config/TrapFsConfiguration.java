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

package dev.mars.trapfs.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Configuration management for TrapFS.
 * Handles loading and providing access to jail, capture and listing parameters.
 *
 * <p>Sources, later ones overriding earlier ones: built-in defaults, a
 * {@code trapfs.properties} classpath resource, the first readable
 * {@code trapfs.properties} file from the working directory, {@code config/},
 * {@code ~/.trapfs/} or {@code /etc/trapfs/}, and finally any system property
 * starting with {@code trapfs.}.</p>
 *
 * <p>Protocol jails are declared with a comma separated {@code trapfs.protocols}
 * list plus one {@code trapfs.protocol.<name>.source} directory per entry.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class TrapFsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(TrapFsConfiguration.class);

    public static final String JAIL_STORE = "trapfs.jail.store";
    public static final String JAIL_ROOT_DIR = "trapfs.jail.root.dir";
    public static final String CAPTURE_DIR = "trapfs.capture.dir";
    public static final String CAPTURE_TIMESTAMP_PATTERN = "trapfs.capture.timestamp.pattern";
    public static final String CAPTURE_TIMEZONE = "trapfs.capture.timezone";
    public static final String CAPTURE_COLLISION_MAX_ATTEMPTS = "trapfs.capture.collision.max.attempts";
    public static final String CAPTURE_MANIFEST_ENABLED = "trapfs.capture.manifest.enabled";
    public static final String LISTING_OWNER = "trapfs.listing.owner";
    public static final String LISTING_GROUP = "trapfs.listing.group";
    public static final String LISTING_RECENT_WINDOW_DAYS = "trapfs.listing.recent.window.days";
    public static final String PROTOCOLS = "trapfs.protocols";
    public static final String METRICS_ENABLED = "trapfs.monitoring.metrics.enabled";

    // Default configuration values
    private static final String DEFAULT_JAIL_STORE = "local";
    private static final String DEFAULT_CAPTURE_DIR =
            Paths.get(System.getProperty("java.io.tmpdir"), "trapfs-data").toString();
    private static final String DEFAULT_TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";
    private static final int DEFAULT_COLLISION_MAX_ATTEMPTS = 10;
    private static final String DEFAULT_OWNER = "owner";
    private static final String DEFAULT_GROUP = "group";
    private static final long DEFAULT_RECENT_WINDOW_DAYS = 180;

    private final Properties properties;

    public TrapFsConfiguration() {
        this(defaultConfigFiles());
    }

    /**
     * Loads every layer, reading the first readable file of {@code configFiles}.
     */
    TrapFsConfiguration(List<Path> configFiles) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        loadConfigurationFromClasspath();
        loadConfigurationFromFile(configFiles);
        loadConfigurationFromSystemProperties();
    }

    public TrapFsConfiguration(Properties properties) {
        this.properties = new Properties();
        loadDefaultConfiguration();
        if (properties != null) {
            this.properties.putAll(properties);
        }
    }

    // Jail Configuration

    /**
     * @return {@code local} (host directory) or {@code memory}
     */
    public String getJailStore() {
        return getStringProperty(JAIL_STORE, DEFAULT_JAIL_STORE).trim().toLowerCase();
    }

    /**
     * @return the jail root directory, or {@code null} for a temporary directory
     *         that is removed at shutdown
     */
    public Path getJailRootDirectory() {
        String value = getStringProperty(JAIL_ROOT_DIR, "");
        return value.isBlank() ? null : Paths.get(value.trim());
    }

    public List<String> getProtocols() {
        List<String> protocols = new ArrayList<>();
        for (String entry : getStringProperty(PROTOCOLS, "").split(",")) {
            if (!entry.isBlank()) {
                protocols.add(entry.trim());
            }
        }
        return protocols;
    }

    public Path getProtocolSourceDirectory(String protocol) {
        String value = properties.getProperty("trapfs.protocol." + protocol + ".source");
        return value == null || value.isBlank() ? null : Paths.get(value.trim());
    }

    // Capture Configuration
    public Path getCaptureDirectory() {
        return Paths.get(getStringProperty(CAPTURE_DIR, DEFAULT_CAPTURE_DIR).trim());
    }

    public String getCaptureTimestampPattern() {
        return getStringProperty(CAPTURE_TIMESTAMP_PATTERN, DEFAULT_TIMESTAMP_PATTERN);
    }

    /**
     * @return zone id for capture timestamps; blank means the system default zone
     */
    public String getCaptureTimezone() {
        return getStringProperty(CAPTURE_TIMEZONE, "").trim();
    }

    public int getCaptureCollisionMaxAttempts() {
        return getIntProperty(CAPTURE_COLLISION_MAX_ATTEMPTS, DEFAULT_COLLISION_MAX_ATTEMPTS);
    }

    public boolean isCaptureManifestEnabled() {
        return getBooleanProperty(CAPTURE_MANIFEST_ENABLED, true);
    }

    // Listing Configuration
    public String getListingOwner() {
        return getStringProperty(LISTING_OWNER, DEFAULT_OWNER);
    }

    public String getListingGroup() {
        return getStringProperty(LISTING_GROUP, DEFAULT_GROUP);
    }

    public Duration getListingRecentWindow() {
        return Duration.ofDays(getLongProperty(LISTING_RECENT_WINDOW_DAYS, DEFAULT_RECENT_WINDOW_DAYS));
    }

    // Monitoring Configuration
    public boolean isMetricsEnabled() {
        return getBooleanProperty(METRICS_ENABLED, true);
    }

    // Generic property access
    public String getProperty(String key) {
        return properties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    public void setProperty(String key, String value) {
        properties.setProperty(key, value);
    }

    // Utility methods for type conversion
    private String getStringProperty(String key, String defaultValue) {
        return properties.getProperty(key, defaultValue);
    }

    private int getIntProperty(String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private long getLongProperty(String key, long defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            try {
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for property {}: {}. Using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = properties.getProperty(key);
        if (value != null) {
            return Boolean.parseBoolean(value.trim());
        }
        return defaultValue;
    }

    private void loadDefaultConfiguration() {
        properties.setProperty(JAIL_STORE, DEFAULT_JAIL_STORE);
        properties.setProperty(CAPTURE_DIR, DEFAULT_CAPTURE_DIR);
        properties.setProperty(CAPTURE_TIMESTAMP_PATTERN, DEFAULT_TIMESTAMP_PATTERN);
        properties.setProperty(CAPTURE_COLLISION_MAX_ATTEMPTS, String.valueOf(DEFAULT_COLLISION_MAX_ATTEMPTS));
        properties.setProperty(CAPTURE_MANIFEST_ENABLED, "true");
        properties.setProperty(LISTING_OWNER, DEFAULT_OWNER);
        properties.setProperty(LISTING_GROUP, DEFAULT_GROUP);
        properties.setProperty(LISTING_RECENT_WINDOW_DAYS, String.valueOf(DEFAULT_RECENT_WINDOW_DAYS));
        properties.setProperty(METRICS_ENABLED, "true");
    }

    private static List<Path> defaultConfigFiles() {
        return List.of(
                Paths.get("trapfs.properties"),
                Paths.get("config", "trapfs.properties"),
                Paths.get(System.getProperty("user.home"), ".trapfs", "trapfs.properties"),
                Paths.get("/etc/trapfs/trapfs.properties"));
    }

    private void loadConfigurationFromFile(List<Path> configFiles) {
        for (Path configPath : configFiles) {
            if (Files.exists(configPath) && Files.isReadable(configPath)) {
                try (InputStream input = Files.newInputStream(configPath)) {
                    properties.load(input);
                    logger.info("Loaded configuration from: {}", configPath);
                    return;
                } catch (IOException e) {
                    logger.warn("Failed to load configuration from {}: {}", configPath, e.getMessage());
                }
            }
        }
    }

    private void loadConfigurationFromClasspath() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream("trapfs.properties")) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from classpath");
            }
        } catch (IOException e) {
            logger.warn("Failed to load configuration from classpath: {}", e.getMessage());
        }
    }

    private void loadConfigurationFromSystemProperties() {
        // Override with system properties that start with "trapfs."
        System.getProperties().entrySet().stream()
                .filter(entry -> entry.getKey().toString().startsWith("trapfs."))
                .forEach(entry -> {
                    properties.setProperty(entry.getKey().toString(), entry.getValue().toString());
                    logger.debug("Override from system property: {}={}", entry.getKey(), entry.getValue());
                });
    }

    @Override
    public String toString() {
        return "TrapFsConfiguration{" +
                "jailStore='" + getJailStore() + '\'' +
                ", protocols=" + getProtocols() +
                ", captureDirectory=" + getCaptureDirectory() +
                ", collisionMaxAttempts=" + getCaptureCollisionMaxAttempts() +
                ", metricsEnabled=" + isMetricsEnabled() +
                '}';
    }
}
