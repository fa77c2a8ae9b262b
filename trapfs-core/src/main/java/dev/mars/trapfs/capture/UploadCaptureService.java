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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.trapfs.config.TrapFsConfiguration;
import dev.mars.trapfs.core.exceptions.AlreadyExistsException;
import dev.mars.trapfs.core.exceptions.FilesystemException;
import dev.mars.trapfs.core.exceptions.FilesystemExceptions;
import dev.mars.trapfs.core.exceptions.NotFoundException;
import dev.mars.trapfs.observability.JailTelemetryMetrics;
import dev.mars.trapfs.storage.BackingStore;
import dev.mars.trapfs.storage.StorePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Opens upload captures in the persistent store on behalf of protocol sessions.
 *
 * <p>Each upload gets a sanitized, timestamp prefixed name. When that name is already
 * taken (two uploads of the same name within one second) the service retries with
 * {@code -1}, {@code -2}, ... up to the configured number of extra attempts; with zero
 * attempts the first collision is reported to the caller. The writer itself never
 * overwrites anything.</p>
 *
 * <p>When receipts are enabled, a successful close writes {@code <storedName>.json}
 * describing the capture. Slugs never contain a dot, so receipts cannot collide with
 * captures.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UploadCaptureService {
    private static final Logger logger = LoggerFactory.getLogger(UploadCaptureService.class);

    public static final String RECEIPT_SUFFIX = ".json";

    private final BackingStore store;
    private final NameSanitizer sanitizer;
    private final int maxCollisionAttempts;
    private final boolean receiptsEnabled;
    private final JailTelemetryMetrics metrics;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public UploadCaptureService(BackingStore store, NameSanitizer sanitizer, int maxCollisionAttempts,
                                boolean receiptsEnabled, JailTelemetryMetrics metrics, Clock clock) {
        if (maxCollisionAttempts < 0) {
            throw new IllegalArgumentException("Collision attempts must not be negative: " + maxCollisionAttempts);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        this.maxCollisionAttempts = maxCollisionAttempts;
        this.receiptsEnabled = receiptsEnabled;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static UploadCaptureService fromConfiguration(BackingStore store, TrapFsConfiguration configuration,
                                                         JailTelemetryMetrics metrics) {
        String zone = configuration.getCaptureTimezone();
        NameSanitizer sanitizer = new NameSanitizer(Clock.systemDefaultZone(),
                zone.isEmpty() ? ZoneId.systemDefault() : ZoneId.of(zone),
                configuration.getCaptureTimestampPattern());
        return new UploadCaptureService(store, sanitizer, configuration.getCaptureCollisionMaxAttempts(),
                configuration.isCaptureManifestEnabled(), metrics, Clock.systemUTC());
    }

    /**
     * Opens a capture for an incoming upload.
     *
     * @throws AlreadyExistsException when every permitted name is taken
     */
    public UploadCaptureWriter open(String protocol, String sessionId, String originalName)
            throws FilesystemException {
        String baseName = sanitizer.sanitize(originalName);
        for (int attempt = 0; ; attempt++) {
            String candidate = NameSanitizer.disambiguate(baseName, attempt);
            try {
                UploadCaptureWriter writer = UploadCaptureWriter.open(store, candidate, clock);
                writer.addCloseListener((closed, failure) -> onClose(closed, failure, originalName, protocol, sessionId));
                metrics.recordCaptureOpened(protocol);
                logger.info("Capturing upload '{}' from {} session {} as '{}'",
                        originalName, protocol, sessionId, candidate);
                return writer;
            } catch (AlreadyExistsException e) {
                metrics.recordCaptureCollision(protocol);
                if (attempt >= maxCollisionAttempts) {
                    logger.warn("Capture name '{}' taken, giving up after {} attempt(s)", candidate, attempt + 1);
                    metrics.recordCaptureOpenFailed(protocol, e.getClass().getSimpleName());
                    throw e;
                }
                logger.warn("Capture name '{}' taken, retrying with a suffix", candidate);
            } catch (FilesystemException e) {
                logger.error("Failed to open capture '{}': {}", candidate, e.getMessage());
                metrics.recordCaptureOpenFailed(protocol, e.getClass().getSimpleName());
                throw e;
            }
        }
    }

    /**
     * Opens a completed capture for reading.
     */
    public InputStream openCapture(String storedName) throws FilesystemException {
        try {
            return store.openRead(storePath(storedName));
        } catch (IOException e) {
            throw FilesystemExceptions.translate(storedName, e);
        }
    }

    public UploadReceipt readReceipt(String storedName) throws FilesystemException {
        String receiptName = storedName + RECEIPT_SUFFIX;
        try (InputStream in = store.openRead(storePath(receiptName))) {
            return objectMapper.readValue(in, UploadReceipt.class);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(receiptName, e);
        }
    }

    /**
     * @return stored names of all captures, receipts excluded, sorted
     */
    public List<String> listCaptures() throws FilesystemException {
        try {
            return store.list(StorePaths.ROOT).stream()
                    .filter(name -> !name.endsWith(RECEIPT_SUFFIX))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw FilesystemExceptions.translate(StorePaths.ROOT, e);
        }
    }

    public BackingStore getStore() {
        return store;
    }

    public int getMaxCollisionAttempts() {
        return maxCollisionAttempts;
    }

    public boolean isReceiptsEnabled() {
        return receiptsEnabled;
    }

    private void onClose(UploadCaptureWriter writer, FilesystemException failure, String originalName,
                         String protocol, String sessionId) throws FilesystemException {
        if (failure != null) {
            metrics.recordCaptureFailed(protocol, failure.getClass().getSimpleName());
            return;
        }
        Duration duration = Duration.between(writer.getOpenedAt(), writer.getClosedAt());
        metrics.recordCaptureCompleted(protocol, writer.getBytesWritten(), duration.toNanos() / 1_000_000_000.0);
        logger.info("Captured '{}' ({} bytes, sha256 {})", writer.getStoredName(), writer.getBytesWritten(),
                writer.getSha256());
        if (receiptsEnabled) {
            writeReceipt(UploadReceipt.of(writer, originalName, protocol, sessionId));
        }
    }

    private void writeReceipt(UploadReceipt receipt) throws FilesystemException {
        String receiptName = receipt.getStoredName() + RECEIPT_SUFFIX;
        try (OutputStream out = store.createExclusive(storePath(receiptName))) {
            out.write(objectMapper.writeValueAsBytes(receipt));
        } catch (IOException e) {
            logger.error("Failed to write receipt '{}': {}", receiptName, e.getMessage());
            throw FilesystemExceptions.translate(receiptName, e);
        }
    }

    private static String storePath(String storedName) throws NotFoundException {
        if (storedName == null || storedName.isEmpty() || storedName.indexOf('/') >= 0
                || ".".equals(storedName) || "..".equals(storedName)) {
            throw new NotFoundException(String.valueOf(storedName));
        }
        return StorePaths.join(StorePaths.ROOT, storedName);
    }
}
