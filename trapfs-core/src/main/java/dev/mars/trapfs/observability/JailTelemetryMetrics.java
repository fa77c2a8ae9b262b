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

package dev.mars.trapfs.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the jail and the upload capture store.
 *
 * Provides:
 * - trapfs.jail.created (counter) - Protocol jails initialized
 * - trapfs.jail.escape.rejected (counter) - Paths rejected for climbing above a jail home
 * - trapfs.capture.opened (counter) - Upload captures opened
 * - trapfs.capture.completed (counter) - Upload captures closed successfully
 * - trapfs.capture.failed (counter) - Upload captures that failed to open or close
 * - trapfs.capture.collisions (counter) - Sanitized names already taken
 * - trapfs.capture.bytes.total (counter) - Total bytes captured
 * - trapfs.capture.duration.seconds (histogram) - Time between open and close
 * - trapfs.capture.active (gauge) - Currently open captures
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class JailTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(JailTelemetryMetrics.class);
    private static final String METER_NAME = "trapfs-core";

    private static JailTelemetryMetrics instance;

    // Counters
    private final LongCounter jailsCreated;
    private final LongCounter escapesRejected;
    private final LongCounter capturesOpened;
    private final LongCounter capturesCompleted;
    private final LongCounter capturesFailed;
    private final LongCounter captureCollisions;
    private final LongCounter bytesCaptured;

    private final DoubleHistogram captureDuration;

    // Gauge (backed by AtomicLong)
    private final AtomicLong activeCaptures = new AtomicLong(0);

    // Attribute keys
    private static final AttributeKey<String> PROTOCOL_KEY = AttributeKey.stringKey("protocol");
    private static final AttributeKey<String> OPERATION_KEY = AttributeKey.stringKey("operation");
    private static final AttributeKey<String> ERROR_TYPE_KEY = AttributeKey.stringKey("error.type");

    public JailTelemetryMetrics(Meter meter) {
        jailsCreated = meter.counterBuilder("trapfs.jail.created")
                .setDescription("Number of protocol jails initialized")
                .setUnit("1")
                .build();

        escapesRejected = meter.counterBuilder("trapfs.jail.escape.rejected")
                .setDescription("Number of paths rejected for leaving the jail home")
                .setUnit("1")
                .build();

        capturesOpened = meter.counterBuilder("trapfs.capture.opened")
                .setDescription("Number of upload captures opened")
                .setUnit("1")
                .build();

        capturesCompleted = meter.counterBuilder("trapfs.capture.completed")
                .setDescription("Number of upload captures closed successfully")
                .setUnit("1")
                .build();

        capturesFailed = meter.counterBuilder("trapfs.capture.failed")
                .setDescription("Number of upload captures that failed")
                .setUnit("1")
                .build();

        captureCollisions = meter.counterBuilder("trapfs.capture.collisions")
                .setDescription("Number of sanitized upload names that were already taken")
                .setUnit("1")
                .build();

        bytesCaptured = meter.counterBuilder("trapfs.capture.bytes.total")
                .setDescription("Total bytes captured")
                .setUnit("By")
                .build();

        captureDuration = meter.histogramBuilder("trapfs.capture.duration.seconds")
                .setDescription("Upload capture duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("trapfs.capture.active")
                .setDescription("Number of currently open upload captures")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeCaptures.get()));

        logger.debug("JailTelemetryMetrics initialized on meter {}", METER_NAME);
    }

    /**
     * Get the singleton instance bound to the global OpenTelemetry meter provider.
     */
    public static synchronized JailTelemetryMetrics getInstance() {
        if (instance == null) {
            instance = new JailTelemetryMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
        }
        return instance;
    }

    /**
     * Metrics that record nothing, for {@code trapfs.monitoring.metrics.enabled=false}.
     */
    public static JailTelemetryMetrics disabled() {
        return new JailTelemetryMetrics(OpenTelemetry.noop().getMeter(METER_NAME));
    }

    public void recordJailCreated(String protocol) {
        jailsCreated.add(1, Attributes.of(PROTOCOL_KEY, protocol));
    }

    public void recordEscapeRejected(String protocol, String operation) {
        escapesRejected.add(1, Attributes.builder()
                .put(PROTOCOL_KEY, protocol)
                .put(OPERATION_KEY, operation)
                .build());
    }

    public void recordCaptureOpened(String protocol) {
        capturesOpened.add(1, Attributes.of(PROTOCOL_KEY, protocol));
        activeCaptures.incrementAndGet();
    }

    public void recordCaptureCollision(String protocol) {
        captureCollisions.add(1, Attributes.of(PROTOCOL_KEY, protocol));
    }

    /**
     * Record a capture closed successfully.
     */
    public void recordCaptureCompleted(String protocol, long bytes, double durationSeconds) {
        activeCaptures.decrementAndGet();
        Attributes attrs = Attributes.of(PROTOCOL_KEY, protocol);
        capturesCompleted.add(1, attrs);
        bytesCaptured.add(bytes, attrs);
        captureDuration.record(durationSeconds, attrs);
    }

    /**
     * Record a capture that could not be opened. The active gauge is untouched.
     */
    public void recordCaptureOpenFailed(String protocol, String errorType) {
        capturesFailed.add(1, failureAttributes(protocol, errorType));
    }

    /**
     * Record an opened capture whose close failed.
     */
    public void recordCaptureFailed(String protocol, String errorType) {
        activeCaptures.decrementAndGet();
        capturesFailed.add(1, failureAttributes(protocol, errorType));
    }

    public long getActiveCaptures() {
        return activeCaptures.get();
    }

    private static Attributes failureAttributes(String protocol, String errorType) {
        return Attributes.builder()
                .put(PROTOCOL_KEY, protocol)
                .put(ERROR_TYPE_KEY, errorType != null ? errorType : "unknown")
                .build();
    }
}
