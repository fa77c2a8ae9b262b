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

package dev.mars.trapfs.service;

import dev.mars.trapfs.capture.UploadCaptureService;
import dev.mars.trapfs.config.TrapFsConfiguration;
import dev.mars.trapfs.core.exceptions.FilesystemException;
import dev.mars.trapfs.core.exceptions.NotFoundException;
import dev.mars.trapfs.core.exceptions.TrapFsException;
import dev.mars.trapfs.jail.JailRoot;
import dev.mars.trapfs.jail.JailSession;
import dev.mars.trapfs.jail.ProtocolJail;
import dev.mars.trapfs.listing.DirectoryListingFormatter;
import dev.mars.trapfs.observability.JailTelemetryMetrics;
import dev.mars.trapfs.protocol.CommandAliasTable;
import dev.mars.trapfs.stat.StatEmulator;
import dev.mars.trapfs.storage.BackingStore;
import dev.mars.trapfs.storage.InMemoryBackingStore;
import dev.mars.trapfs.storage.LocalBackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Wires the jail root, the capture store and the protocol jails from configuration and
 * hands out sessions to protocol adapters.
 *
 * <pre>
 * try (TrapFsService service = TrapFsService.create(new TrapFsConfiguration())) {
 *     try (JailSession session = service.openSession("ftp")) {
 *         session.chdir("pub");
 *         String listing = session.renderListing(".");
 *     }
 * }
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class TrapFsService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TrapFsService.class);

    private final TrapFsConfiguration configuration;
    private final JailRoot jailRoot;
    private final UploadCaptureService captureService;
    private final CommandAliasTable commandAliases;
    private final AtomicLong sessionCounter = new AtomicLong();

    TrapFsService(TrapFsConfiguration configuration, JailRoot jailRoot, UploadCaptureService captureService) {
        this.configuration = configuration;
        this.jailRoot = jailRoot;
        this.captureService = captureService;
        this.commandAliases = CommandAliasTable.ftpDefaults();
    }

    /**
     * Opens both stores and initializes one jail per configured protocol.
     *
     * @throws TrapFsException if the stores cannot be opened, overlap, or a jail fails to initialize
     */
    public static TrapFsService create(TrapFsConfiguration configuration) throws TrapFsException {
        logger.info("Starting TrapFS: {}", configuration);
        JailTelemetryMetrics metrics = configuration.isMetricsEnabled()
                ? JailTelemetryMetrics.getInstance()
                : JailTelemetryMetrics.disabled();

        LocalBackingStore captureStore;
        try {
            captureStore = new LocalBackingStore(configuration.getCaptureDirectory());
        } catch (IOException e) {
            throw new TrapFsException("Cannot open capture directory " + configuration.getCaptureDirectory(), e);
        }
        UploadCaptureService captureService;
        try {
            captureService = UploadCaptureService.fromConfiguration(captureStore, configuration, metrics);
        } catch (RuntimeException e) {
            closeQuietly(captureStore, e);
            throw new TrapFsException("Invalid capture configuration: " + e.getMessage(), e);
        }

        BackingStore jailStore;
        try {
            jailStore = openJailStore(configuration);
        } catch (IOException | TrapFsException e) {
            closeQuietly(captureStore, e);
            throw e instanceof TrapFsException
                    ? (TrapFsException) e
                    : new TrapFsException("Cannot open jail store", e);
        }

        if (jailStore instanceof LocalBackingStore) {
            Path jailDir = ((LocalBackingStore) jailStore).getRoot();
            Path captureDir = captureStore.getRoot();
            if (jailDir.startsWith(captureDir) || captureDir.startsWith(jailDir)) {
                TrapFsException overlap = new TrapFsException(
                        "Jail directory " + jailDir + " and capture directory " + captureDir + " overlap");
                closeQuietly(jailStore, overlap);
                closeQuietly(captureStore, overlap);
                throw overlap;
            }
        }

        JailRoot jailRoot;
        try {
            StatEmulator statEmulator = new StatEmulator(jailStore,
                    configuration.getListingOwner(), configuration.getListingGroup());
            DirectoryListingFormatter formatter = new DirectoryListingFormatter(Clock.systemUTC(),
                    configuration.getListingRecentWindow());
            jailRoot = new JailRoot(jailStore, statEmulator, formatter, metrics);
        } catch (RuntimeException e) {
            TrapFsException failure = new TrapFsException("Invalid listing configuration: " + e.getMessage(), e);
            closeQuietly(jailStore, failure);
            closeQuietly(captureStore, failure);
            throw failure;
        }

        TrapFsService service = new TrapFsService(configuration, jailRoot, captureService);
        try {
            for (String protocol : configuration.getProtocols()) {
                Path source = configuration.getProtocolSourceDirectory(protocol);
                if (source == null) {
                    throw new TrapFsException("No source directory configured for protocol '" + protocol
                            + "' (trapfs.protocol." + protocol + ".source)");
                }
                service.registerProtocol(protocol, source);
            }
        } catch (TrapFsException | RuntimeException e) {
            closeQuietly(service, e);
            throw e;
        }
        logger.info("TrapFS started with {} protocol jail(s) in {}", jailRoot.getJails().size(),
                jailStore.describe());
        return service;
    }

    /**
     * Initializes a jail for a protocol that was not configured up front.
     *
     * @throws TrapFsException if the source overlaps the jail or capture directory
     */
    public ProtocolJail registerProtocol(String protocol, Path sourceDir) throws TrapFsException {
        Path source;
        try {
            source = sourceDir.toRealPath();
        } catch (IOException e) {
            throw new TrapFsException("Cannot resolve source directory " + sourceDir, e);
        }
        BackingStore store = jailRoot.getStore();
        if (store instanceof LocalBackingStore && ((LocalBackingStore) store).getRoot().startsWith(source)) {
            throw new TrapFsException("Source directory " + sourceDir + " contains the jail directory");
        }
        BackingStore captureStore = captureService.getStore();
        if (captureStore instanceof LocalBackingStore) {
            Path captureDir = ((LocalBackingStore) captureStore).getRoot();
            if (captureDir.startsWith(source) || source.startsWith(captureDir)) {
                throw new TrapFsException("Source directory " + sourceDir + " overlaps the capture directory "
                        + captureDir);
            }
        }
        return jailRoot.initialize(protocol, sourceDir);
    }

    /**
     * Opens a session in the protocol's home with upload capture enabled.
     *
     * @throws NotFoundException if no jail exists for the protocol
     */
    public JailSession openSession(String protocol) throws FilesystemException {
        ProtocolJail jail = jailRoot.getJail(protocol)
                .orElseThrow(() -> new NotFoundException(protocol));
        String sessionId = protocol + "-" + sessionCounter.incrementAndGet();
        logger.debug("Opening session {}", sessionId);
        return jail.openSession(sessionId, captureService);
    }

    public TrapFsConfiguration getConfiguration() {
        return configuration;
    }

    public JailRoot getJailRoot() {
        return jailRoot;
    }

    public UploadCaptureService getCaptureService() {
        return captureService;
    }

    public CommandAliasTable getCommandAliases() {
        return commandAliases;
    }

    /**
     * Closes the jail root, deleting a temporary jail directory, and the capture store.
     * Captured uploads are kept.
     */
    @Override
    public void close() throws IOException {
        IOException failure = null;
        try {
            jailRoot.close();
        } catch (IOException e) {
            failure = e;
        }
        try {
            captureService.getStore().close();
        } catch (IOException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            logger.error("Failed to shut down cleanly: {}", failure.getMessage());
            throw failure;
        }
        logger.info("TrapFS stopped");
    }

    private static BackingStore openJailStore(TrapFsConfiguration configuration)
            throws IOException, TrapFsException {
        String kind = configuration.getJailStore();
        switch (kind) {
            case "memory":
                return new InMemoryBackingStore();
            case "local":
                Path directory = configuration.getJailRootDirectory();
                return directory == null
                        ? LocalBackingStore.temporary("trapfs-jail-")
                        : new LocalBackingStore(directory);
            default:
                throw new TrapFsException("Unknown jail store '" + kind + "' (expected local or memory)");
        }
    }

    private static void closeQuietly(AutoCloseable closeable, Exception primary) {
        try {
            closeable.close();
        } catch (Exception e) {
            primary.addSuppressed(e);
        }
    }
}
