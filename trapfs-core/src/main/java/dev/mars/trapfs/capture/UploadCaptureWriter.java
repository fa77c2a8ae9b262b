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

package dev.mars.trapfs.capture;

import dev.mars.trapfs.core.exceptions.FilesystemException;
import dev.mars.trapfs.core.exceptions.FilesystemExceptions;
import dev.mars.trapfs.storage.BackingStore;
import dev.mars.trapfs.storage.ChecksumCalculator;
import dev.mars.trapfs.storage.StorePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Exclusive write handle for one captured upload.
 *
 * <p>The target is created atomically and must not exist; an existing capture is
 * never truncated, appended to or replaced. Use with try-with-resources: closing flushes
 * and releases the handle on every exit path. Closing twice is a no-op.</p>
 *
 * <p>A writer belongs to a single session and is not thread-safe.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UploadCaptureWriter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(UploadCaptureWriter.class);

    /**
     * Notified once when the writer closes.
     */
    @FunctionalInterface
    public interface CloseListener {

        /**
         * @param failure the flush or close failure, or {@code null} when the capture is complete
         */
        void onClose(UploadCaptureWriter writer, FilesystemException failure) throws FilesystemException;
    }

    private final String storedName;
    private final OutputStream out;
    private final Clock clock;
    private final Instant openedAt;
    private final ChecksumCalculator checksum = new ChecksumCalculator();
    private final List<CloseListener> listeners = new CopyOnWriteArrayList<>();

    private long bytesWritten;
    private boolean closed;
    private Instant closedAt;
    private String sha256;

    private UploadCaptureWriter(String storedName, OutputStream out, Clock clock) {
        this.storedName = storedName;
        this.out = out;
        this.clock = clock;
        this.openedAt = clock.instant();
    }

    /**
     * Creates {@code storedName} at the root of the store.
     *
     * @throws dev.mars.trapfs.core.exceptions.AlreadyExistsException if the name is taken
     */
    public static UploadCaptureWriter open(BackingStore store, String storedName) throws FilesystemException {
        return open(store, storedName, Clock.systemUTC());
    }

    public static UploadCaptureWriter open(BackingStore store, String storedName, Clock clock)
            throws FilesystemException {
        Objects.requireNonNull(store, "store");
        validateName(storedName);
        try {
            OutputStream out = store.createExclusive(StorePaths.join(StorePaths.ROOT, storedName));
            logger.debug("Opened capture '{}' in {}", storedName, store.describe());
            return new UploadCaptureWriter(storedName, out, clock);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(storedName, e);
        }
    }

    public int writeChunk(byte[] data) throws FilesystemException {
        return writeChunk(data, 0, data.length);
    }

    /**
     * @return number of bytes accepted, always {@code length}
     * @throws IllegalStateException if the writer is closed
     */
    public int writeChunk(byte[] data, int offset, int length) throws FilesystemException {
        if (closed) {
            throw new IllegalStateException("Capture '" + storedName + "' is closed");
        }
        Objects.checkFromIndexSize(offset, length, data.length);
        try {
            out.write(data, offset, length);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(storedName, e);
        }
        checksum.update(data, offset, length);
        bytesWritten += length;
        return length;
    }

    public void addCloseListener(CloseListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void close() throws FilesystemException {
        if (closed) {
            return;
        }
        closed = true;
        FilesystemException failure = null;
        try {
            out.flush();
        } catch (IOException e) {
            failure = FilesystemExceptions.translate(storedName, e);
        } finally {
            try {
                out.close();
            } catch (IOException e) {
                FilesystemException closeFailure = FilesystemExceptions.translate(storedName, e);
                if (failure == null) {
                    failure = closeFailure;
                } else {
                    failure.addSuppressed(closeFailure);
                }
            }
        }
        closedAt = clock.instant();
        sha256 = checksum.getChecksum();

        for (CloseListener listener : listeners) {
            try {
                listener.onClose(this, failure);
            } catch (FilesystemException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            logger.error("Capture '{}' failed after {} bytes: {}", storedName, bytesWritten, failure.getMessage());
            throw failure;
        }
        logger.debug("Closed capture '{}' ({} bytes)", storedName, bytesWritten);
    }

    public String getStoredName() {
        return storedName;
    }

    public long getBytesWritten() {
        return bytesWritten;
    }

    public boolean isClosed() {
        return closed;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    /**
     * @return close time, or {@code null} while open
     */
    public Instant getClosedAt() {
        return closedAt;
    }

    /**
     * @return hex SHA-256 of the bytes written
     * @throws IllegalStateException while the writer is still open
     */
    public String getSha256() {
        if (!closed) {
            throw new IllegalStateException("Checksum is available after close");
        }
        return sha256;
    }

    private static void validateName(String storedName) {
        if (storedName == null || storedName.isEmpty() || storedName.indexOf('/') >= 0
                || storedName.indexOf('\\') >= 0 || ".".equals(storedName) || "..".equals(storedName)) {
            throw new IllegalArgumentException("Invalid capture name: " + storedName);
        }
    }

    @Override
    public String toString() {
        return "UploadCaptureWriter{storedName='" + storedName + "', bytesWritten=" + bytesWritten
                + ", closed=" + closed + "}";
    }
}
