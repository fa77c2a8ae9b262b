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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link TrapFsConfiguration}.
 */
@DisplayName("TrapFsConfiguration Tests")
class TrapFsConfigurationTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty(TrapFsConfiguration.LISTING_OWNER);
    }

    @Test
    @DisplayName("Should provide defaults")
    void testDefaults() {
        TrapFsConfiguration config = new TrapFsConfiguration(new Properties());

        assertThat(config.getJailStore()).isEqualTo("local");
        assertThat(config.getJailRootDirectory()).isNull();
        assertThat(config.getProtocols()).isEmpty();
        assertThat(config.getCaptureDirectory())
            .isEqualTo(Paths.get(System.getProperty("java.io.tmpdir"), "trapfs-data"));
        assertThat(config.getCaptureTimestampPattern()).isEqualTo("yyyy-MM-dd HH:mm:ss");
        assertThat(config.getCaptureTimezone()).isEmpty();
        assertThat(config.getCaptureCollisionMaxAttempts()).isEqualTo(10);
        assertThat(config.isCaptureManifestEnabled()).isTrue();
        assertThat(config.getListingOwner()).isEqualTo("owner");
        assertThat(config.getListingGroup()).isEqualTo("group");
        assertThat(config.getListingRecentWindow()).isEqualTo(Duration.ofDays(180));
        assertThat(config.isMetricsEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should override defaults from properties")
    void testOverrides() {
        Properties properties = new Properties();
        properties.setProperty(TrapFsConfiguration.JAIL_STORE, " Memory ");
        properties.setProperty(TrapFsConfiguration.JAIL_ROOT_DIR, "/srv/jail");
        properties.setProperty(TrapFsConfiguration.CAPTURE_COLLISION_MAX_ATTEMPTS, "0");
        properties.setProperty(TrapFsConfiguration.LISTING_OWNER, "root");
        properties.setProperty(TrapFsConfiguration.LISTING_RECENT_WINDOW_DAYS, "30");
        properties.setProperty(TrapFsConfiguration.METRICS_ENABLED, "false");

        TrapFsConfiguration config = new TrapFsConfiguration(properties);

        assertThat(config.getJailStore()).isEqualTo("memory");
        assertThat(config.getJailRootDirectory()).isEqualTo(Paths.get("/srv/jail"));
        assertThat(config.getCaptureCollisionMaxAttempts()).isZero();
        assertThat(config.getListingOwner()).isEqualTo("root");
        assertThat(config.getListingRecentWindow()).isEqualTo(Duration.ofDays(30));
        assertThat(config.isMetricsEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should parse the protocol list and source directories")
    void testProtocols() {
        Properties properties = new Properties();
        properties.setProperty(TrapFsConfiguration.PROTOCOLS, "ftp, tftp,,  ");
        properties.setProperty("trapfs.protocol.ftp.source", "/data/ftp");

        TrapFsConfiguration config = new TrapFsConfiguration(properties);

        assertThat(config.getProtocols()).containsExactly("ftp", "tftp");
        assertThat(config.getProtocolSourceDirectory("ftp")).isEqualTo(Paths.get("/data/ftp"));
        assertThat(config.getProtocolSourceDirectory("tftp")).isNull();
    }

    @Test
    @DisplayName("Should fall back to defaults for malformed numbers")
    void testMalformedNumbers() {
        Properties properties = new Properties();
        properties.setProperty(TrapFsConfiguration.CAPTURE_COLLISION_MAX_ATTEMPTS, "many");
        properties.setProperty(TrapFsConfiguration.LISTING_RECENT_WINDOW_DAYS, "half a year");

        TrapFsConfiguration config = new TrapFsConfiguration(properties);

        assertThat(config.getCaptureCollisionMaxAttempts()).isEqualTo(10);
        assertThat(config.getListingRecentWindow()).isEqualTo(Duration.ofDays(180));
    }

    @Test
    @DisplayName("Should apply trapfs system properties over defaults")
    void testSystemPropertyOverride() {
        System.setProperty(TrapFsConfiguration.LISTING_OWNER, "ftpadmin");

        TrapFsConfiguration config = new TrapFsConfiguration();

        assertThat(config.getListingOwner()).isEqualTo("ftpadmin");
    }

    @Test
    @DisplayName("Should layer the config file over the classpath resource")
    void testFileOverClasspath(@TempDir Path dir) throws Exception {
        Path missing = dir.resolve("missing.properties");
        Path first = dir.resolve("first.properties");
        Path second = dir.resolve("second.properties");
        Files.write(first, "trapfs.listing.owner=file-owner\n".getBytes(StandardCharsets.UTF_8));
        Files.write(second, "trapfs.listing.group=unused\n".getBytes(StandardCharsets.UTF_8));

        TrapFsConfiguration config = new TrapFsConfiguration(List.of(missing, first, second));

        assertThat(config.getListingOwner()).isEqualTo("file-owner");
        assertThat(config.getListingGroup()).isEqualTo("ftpusers");
    }

    @Test
    @DisplayName("Should apply the classpath resource when no file is readable")
    void testClasspathOnly(@TempDir Path dir) {
        TrapFsConfiguration config = new TrapFsConfiguration(List.of(dir.resolve("missing.properties")));

        assertThat(config.getListingOwner()).isEqualTo("ftp");
        assertThat(config.getListingGroup()).isEqualTo("ftpusers");
        assertThat(config.getJailStore()).isEqualTo("local");
    }

    @Test
    @DisplayName("Should support generic property access")
    void testGenericAccess() {
        TrapFsConfiguration config = new TrapFsConfiguration((Properties) null);

        assertThat(config.getProperty("trapfs.custom")).isNull();
        assertThat(config.getProperty("trapfs.custom", "fallback")).isEqualTo("fallback");

        config.setProperty("trapfs.custom", "value");
        assertThat(config.getProperty("trapfs.custom")).isEqualTo("value");
        assertThat(config.toString()).contains("jailStore='local'");
    }
}
