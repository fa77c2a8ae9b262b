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

package dev.mars.trapfs.jail;

import dev.mars.trapfs.core.exceptions.AlreadyExistsException;
import dev.mars.trapfs.core.exceptions.FilesystemException;
import dev.mars.trapfs.core.exceptions.FilesystemExceptions;
import dev.mars.trapfs.core.exceptions.NotADirectoryException;
import dev.mars.trapfs.listing.DirectoryListingFormatter;
import dev.mars.trapfs.observability.JailTelemetryMetrics;
import dev.mars.trapfs.stat.StatEmulator;
import dev.mars.trapfs.storage.BackingStore;
import dev.mars.trapfs.storage.StorePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The shared virtual root of the process. Each protocol gets one home directory
 * directly below it, seeded by mirroring a host directory.
 *
 * <p>Initialization is race-safe: the home is created with an exclusive directory
 * create, so for one protocol name exactly one caller wins and every other caller
 * gets {@link AlreadyExistsException}.</p>
 *
 * <p>Jail contents are ephemeral. Closing the root closes the backing store, which
 * deletes it when it is a temporary directory.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class JailRoot implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JailRoot.class);

    private final BackingStore store;
    private final StatEmulator statEmulator;
    private final DirectoryListingFormatter formatter;
    private final JailTelemetryMetrics metrics;
    private final Map<String, ProtocolJail> jails = new ConcurrentHashMap<>();

    public JailRoot(BackingStore store) {
        this(store, new StatEmulator(store, "owner", "group"), new DirectoryListingFormatter(),
                JailTelemetryMetrics.disabled());
    }

    public JailRoot(BackingStore store, StatEmulator statEmulator, DirectoryListingFormatter formatter,
                    JailTelemetryMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.statEmulator = Objects.requireNonNull(statEmulator, "statEmulator");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Creates the home of {@code protocolName} and mirrors {@code sourceDir} into it.
     * On a mirror failure the partial home is removed before the error is rethrown.
     *
     * @throws AlreadyExistsException if the protocol already has a jail
     * @throws NotADirectoryException if {@code sourceDir} is not a directory
     */
    public ProtocolJail initialize(String protocolName, Path sourceDir) throws FilesystemException {
        JailPaths.validateProtocolName(protocolName);
        Objects.requireNonNull(sourceDir, "sourceDir");
        if (!Files.isDirectory(sourceDir)) {
            throw new NotADirectoryException(sourceDir.toString());
        }
        String home = StorePaths.join(StorePaths.ROOT, protocolName);

        try {
            store.createDirectoryExclusive(home);
        } catch (FileAlreadyExistsException e) {
            logger.warn("Jail for protocol '{}' already exists", protocolName);
            throw new AlreadyExistsException(home, e);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(home, e);
        }

        long entries;
        try {
            entries = store.mirror(sourceDir, home);
        } catch (IOException e) {
            logger.error("Failed to mirror {} into jail '{}': {}", sourceDir, protocolName, e.getMessage());
            FilesystemException failure = FilesystemExceptions.translate(home, e);
            try {
                store.deleteRecursively(home);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            throw failure;
        }

        ProtocolJail jail = new ProtocolJail(protocolName, home, this);
        jails.put(protocolName, jail);
        metrics.recordJailCreated(protocolName);
        logger.info("Initialized jail '{}' with {} entries mirrored from {}", protocolName, entries, sourceDir);
        return jail;
    }

    public Optional<ProtocolJail> getJail(String protocolName) {
        return Optional.ofNullable(jails.get(protocolName));
    }

    public Collection<ProtocolJail> getJails() {
        return Collections.unmodifiableList(new ArrayList<>(jails.values()));
    }

    public BackingStore getStore() {
        return store;
    }

    StatEmulator getStatEmulator() {
        return statEmulator;
    }

    DirectoryListingFormatter getFormatter() {
        return formatter;
    }

    JailTelemetryMetrics getMetrics() {
        return metrics;
    }

    /**
     * Drops all jails and closes the backing store.
     */
    @Override
    public void close() throws IOException {
        jails.clear();
        store.close();
        logger.info("Closed jail root {}", store.describe());
    }
}
