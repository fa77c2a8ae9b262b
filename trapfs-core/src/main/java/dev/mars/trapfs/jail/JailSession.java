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

import dev.mars.trapfs.capture.UploadCaptureService;
import dev.mars.trapfs.capture.UploadCaptureWriter;
import dev.mars.trapfs.core.exceptions.FilesystemException;
import dev.mars.trapfs.core.exceptions.FilesystemExceptions;
import dev.mars.trapfs.core.exceptions.NotADirectoryException;
import dev.mars.trapfs.core.exceptions.NotFoundException;
import dev.mars.trapfs.core.exceptions.OperationNotImplementedException;
import dev.mars.trapfs.listing.DirectoryListingFormatter;
import dev.mars.trapfs.listing.ListingSource;
import dev.mars.trapfs.observability.JailTelemetryMetrics;
import dev.mars.trapfs.stat.FileModes;
import dev.mars.trapfs.stat.StatEmulator;
import dev.mars.trapfs.stat.StatInfo;
import dev.mars.trapfs.storage.BackingStore;
import dev.mars.trapfs.storage.StorePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A protocol session's view of its jail.
 *
 * <p>All paths are home-relative: {@code /} is the protocol home, relative paths are
 * resolved against the working directory, and {@code ..} never climbs above home.
 * A path that tries to is rejected, logged and counted; directory operations report
 * it as {@link NotADirectoryException}, all others as {@link NotFoundException}.
 * Symbolic links are reported, never followed.</p>
 *
 * <p>Owner and group shown by {@link #stat(String)} are placeholders. Permission bits
 * are emulated only: {@code stat} shows them and {@link #chmod(String, int)} changes
 * them, but nothing is enforced.</p>
 *
 * <p>A session belongs to one protocol connection and is not thread-safe. Closing it
 * closes any upload still open.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class JailSession implements ListingSource, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(JailSession.class);

    private final ProtocolJail jail;
    private final String sessionId;
    private final UploadCaptureService captureService;
    private final BackingStore store;
    private final StatEmulator statEmulator;
    private final DirectoryListingFormatter formatter;
    private final JailTelemetryMetrics metrics;
    private final Set<UploadCaptureWriter> openUploads = new LinkedHashSet<>();

    private String cwd = JailPaths.HOME;
    private boolean closed;

    JailSession(ProtocolJail jail, String sessionId, UploadCaptureService captureService) {
        this.jail = jail;
        this.sessionId = sessionId;
        this.captureService = captureService;
        JailRoot root = jail.getRoot();
        this.store = root.getStore();
        this.statEmulator = root.getStatEmulator();
        this.formatter = root.getFormatter();
        this.metrics = root.getMetrics();
    }

    // Navigation

    /**
     * Changes the working directory.
     *
     * @throws NotADirectoryException if the target is missing, not a directory, or outside the jail
     */
    public void chdir(String path) throws FilesystemException {
        String target = resolveDirectory(path, "chdir");
        if (!store.isDirectory(storePath(target))) {
            throw new NotADirectoryException(target);
        }
        logger.debug("[{}] chdir {} -> {}", sessionId, cwd, target);
        cwd = target;
    }

    /**
     * @return the home-relative working directory, always starting with {@code /}
     */
    public String getcwd() {
        return cwd;
    }

    // Metadata

    @Override
    public StatInfo stat(String path) throws FilesystemException {
        String target = resolve(path, "stat");
        return statEmulator.stat(storePath(target), target);
    }

    @Override
    public String readlink(String path) throws FilesystemException {
        String target = resolve(path, "readlink");
        return statEmulator.readlink(storePath(target), target);
    }

    public Instant getmtime(String path) throws FilesystemException {
        return stat(path).mtime();
    }

    public long getsize(String path) throws FilesystemException {
        return stat(path).size();
    }

    public boolean exists(String path) {
        return resolveQuietly(path).map(target -> store.exists(storePath(target))).orElse(false);
    }

    public boolean isDirectory(String path) {
        return resolveQuietly(path).map(target -> store.isDirectory(storePath(target))).orElse(false);
    }

    public boolean isFile(String path) {
        return resolveQuietly(path).map(target -> store.isRegularFile(storePath(target))).orElse(false);
    }

    // Listing

    /**
     * @return entry names of a directory, sorted
     */
    public List<String> listdir(String path) throws FilesystemException {
        String target = resolveDirectory(path, "listdir");
        return list(target);
    }

    /**
     * @return stat data per entry, in {@link #listdir(String)} order
     */
    public Map<String, StatInfo> listDirectoryInfo(String path) throws FilesystemException {
        String target = resolveDirectory(path, "listdir");
        Map<String, StatInfo> entries = new LinkedHashMap<>();
        for (String name : list(target)) {
            entries.put(name, stat(StorePaths.join(target, name)));
        }
        return entries;
    }

    /**
     * Lazily formats {@code ls -lA} lines for the given names below {@code basedir}.
     * Entries that cannot be read surface as
     * {@link dev.mars.trapfs.core.exceptions.UncheckedFilesystemException} while consuming.
     */
    public Stream<String> formatList(String basedir, List<String> names) throws FilesystemException {
        String target = resolveDirectory(basedir, "list");
        return formatter.formatList(this, target, names);
    }

    public String renderListing(String basedir, List<String> names) throws FilesystemException {
        String target = resolveDirectory(basedir, "list");
        return formatter.renderListing(this, target, names);
    }

    /**
     * Renders the complete listing of a directory.
     */
    public String renderListing(String path) throws FilesystemException {
        String target = resolveDirectory(path, "list");
        return formatter.renderListing(this, target, list(target));
    }

    // Content

    /**
     * Opens a regular file of the jail copy for reading.
     */
    public InputStream openRead(String path) throws FilesystemException {
        String target = resolve(path, "read");
        String storePath = storePath(target);
        if (!store.isRegularFile(storePath)) {
            if (store.exists(storePath)) {
                throw new FilesystemException(target, "not a regular file");
            }
            throw new NotFoundException(target);
        }
        try {
            return store.openRead(storePath);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(target, e);
        }
    }

    // Mutation of the jail copy

    public void makeDirectory(String path) throws FilesystemException {
        String target = resolveDirectory(path, "mkdir");
        try {
            store.createDirectoryExclusive(storePath(target));
            logger.debug("[{}] mkdir {}", sessionId, target);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(target, e);
        }
    }

    /**
     * Removes a file or symbolic link; directories are refused.
     */
    public void removeFile(String path) throws FilesystemException {
        String target = resolve(path, "remove");
        String storePath = storePath(target);
        if (store.isDirectory(storePath)) {
            throw new FilesystemException(target, "is a directory");
        }
        try {
            store.delete(storePath);
            logger.debug("[{}] remove {}", sessionId, target);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(target, e);
        }
    }

    /**
     * Removes an empty directory other than home and the working directory's ancestors.
     */
    public void removeDirectory(String path) throws FilesystemException {
        String target = resolveDirectory(path, "rmdir");
        requireNotInUse(target);
        String storePath = storePath(target);
        if (!store.isDirectory(storePath)) {
            if (store.exists(storePath)) {
                throw new NotADirectoryException(target);
            }
            throw new NotFoundException(target);
        }
        try {
            store.delete(storePath);
            logger.debug("[{}] rmdir {}", sessionId, target);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(target, e);
        }
    }

    /**
     * @throws dev.mars.trapfs.core.exceptions.AlreadyExistsException if the target exists
     */
    public void rename(String from, String to) throws FilesystemException {
        String source = resolve(from, "rename");
        String target = resolve(to, "rename");
        requireNotInUse(source);
        if (JailPaths.HOME.equals(target)) {
            throw new FilesystemException(target, "cannot replace the jail home");
        }
        try {
            store.move(storePath(source), storePath(target));
            logger.debug("[{}] rename {} -> {}", sessionId, source, target);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(source, e);
        }
    }

    /**
     * Sets the permission bits of an entry of the jail copy.
     *
     * @throws OperationNotImplementedException if the backing store cannot hold POSIX modes
     */
    public void chmod(String path, int mode) throws FilesystemException {
        String target = resolve(path, "chmod");
        try {
            store.setPermissions(storePath(target), mode & FileModes.PERMISSION_MASK);
            logger.debug("[{}] chmod {} {}", sessionId, Integer.toOctalString(mode), target);
        } catch (UnsupportedOperationException e) {
            throw new OperationNotImplementedException(target, "chmod", e);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(target, e);
        }
    }

    public void utime(String path, Instant mtime) throws FilesystemException {
        String target = resolve(path, "utime");
        try {
            store.setLastModifiedTime(storePath(target), mtime);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(target, e);
        }
    }

    // Uploads

    /**
     * Opens a capture for an incoming upload. The bytes go to the capture store, never
     * into the jail.
     *
     * @throws OperationNotImplementedException if the session has no capture store
     */
    public UploadCaptureWriter beginUpload(String originalName) throws FilesystemException {
        if (closed) {
            throw new IllegalStateException("Session " + sessionId + " is closed");
        }
        if (captureService == null) {
            throw new OperationNotImplementedException(originalName, "upload");
        }
        UploadCaptureWriter writer = captureService.open(jail.getProtocolName(), sessionId, originalName);
        openUploads.add(writer);
        writer.addCloseListener((closedWriter, failure) -> openUploads.remove(closedWriter));
        return writer;
    }

    public int getOpenUploadCount() {
        return openUploads.size();
    }

    /**
     * Closes every upload still open. The first failure is thrown with the others suppressed.
     */
    @Override
    public void close() throws FilesystemException {
        if (closed) {
            return;
        }
        closed = true;
        FilesystemException failure = null;
        for (UploadCaptureWriter writer : new ArrayList<>(openUploads)) {
            try {
                writer.close();
            } catch (FilesystemException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        openUploads.clear();
        logger.debug("[{}] session closed", sessionId);
        if (failure != null) {
            throw failure;
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getProtocolName() {
        return jail.getProtocolName();
    }

    private List<String> list(String target) throws FilesystemException {
        String storePath = storePath(target);
        if (!store.isDirectory(storePath)) {
            if (store.exists(storePath)) {
                throw new NotADirectoryException(target);
            }
            throw new NotFoundException(target);
        }
        try {
            return store.list(storePath);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(target, e);
        }
    }

    private String resolve(String path, String operation) throws NotFoundException {
        Optional<String> target = JailPaths.resolve(cwd, path);
        if (target.isEmpty()) {
            rejectEscape(path, operation);
            throw new NotFoundException(path);
        }
        return target.get();
    }

    private String resolveDirectory(String path, String operation) throws NotADirectoryException {
        Optional<String> target = JailPaths.resolve(cwd, path);
        if (target.isEmpty()) {
            rejectEscape(path, operation);
            throw new NotADirectoryException(path, true);
        }
        return target.get();
    }

    private Optional<String> resolveQuietly(String path) {
        return JailPaths.resolve(cwd, path);
    }

    private void rejectEscape(String path, String operation) {
        logger.warn("[{}] Rejected {} of '{}' from {}: path leaves the {} jail",
                sessionId, operation, path, cwd, jail.getProtocolName());
        metrics.recordEscapeRejected(jail.getProtocolName(), operation);
    }

    private void requireNotInUse(String target) throws FilesystemException {
        if (JailPaths.HOME.equals(target)) {
            throw new FilesystemException(target, "cannot modify the jail home");
        }
        if (StorePaths.isAncestorOrSelf(target, cwd)) {
            throw new FilesystemException(target, "directory in use");
        }
    }

    private String storePath(String jailPath) {
        return JailPaths.toStorePath(jail.getHome(), jailPath);
    }

    @Override
    public String toString() {
        return "JailSession{protocol='" + jail.getProtocolName() + "', sessionId='" + sessionId
                + "', cwd='" + cwd + "'}";
    }
}
