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

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collection;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link JailTelemetryMetrics}.
 */
@DisplayName("JailTelemetryMetrics Tests")
class JailTelemetryMetricsTest {

    private InMemoryMetricReader reader;
    private SdkMeterProvider meterProvider;
    private JailTelemetryMetrics metrics;

    @BeforeEach
    void setUp() {
        reader = InMemoryMetricReader.create();
        meterProvider = SdkMeterProvider.builder().registerMetricReader(reader).build();
        metrics = new JailTelemetryMetrics(meterProvider.get("trapfs-core"));
    }

    @AfterEach
    void tearDown() {
        meterProvider.close();
    }

    private MetricData metric(Collection<MetricData> data, String name) {
        return data.stream()
            .filter(m -> m.getName().equals(name))
            .findFirst()
            .orElseThrow(() -> new AssertionError("metric not exported: " + name));
    }

    private long sum(Collection<MetricData> data, String name) {
        return metric(data, name).getLongSumData().getPoints().stream()
            .mapToLong(LongPointData::getValue)
            .sum();
    }

    @Test
    @DisplayName("Should count jails and rejected escapes with their attributes")
    void testJailCounters() {
        metrics.recordJailCreated("ftp");
        metrics.recordJailCreated("tftp");
        metrics.recordEscapeRejected("ftp", "chdir");

        Collection<MetricData> data = reader.collectAllMetrics();

        assertThat(sum(data, "trapfs.jail.created")).isEqualTo(2);
        LongPointData escape = metric(data, "trapfs.jail.escape.rejected")
            .getLongSumData().getPoints().iterator().next();
        assertThat(escape.getValue()).isEqualTo(1);
        assertThat(escape.getAttributes().get(AttributeKey.stringKey("protocol"))).isEqualTo("ftp");
        assertThat(escape.getAttributes().get(AttributeKey.stringKey("operation"))).isEqualTo("chdir");
    }

    @Test
    @DisplayName("Should track the capture lifecycle")
    void testCaptureLifecycle() {
        metrics.recordCaptureOpened("ftp");
        metrics.recordCaptureOpened("ftp");
        metrics.recordCaptureCollision("ftp");
        assertThat(metrics.getActiveCaptures()).isEqualTo(2);

        metrics.recordCaptureCompleted("ftp", 1024, 0.5);
        metrics.recordCaptureFailed("ftp", "FilesystemException");
        assertThat(metrics.getActiveCaptures()).isZero();

        Collection<MetricData> data = reader.collectAllMetrics();

        assertThat(sum(data, "trapfs.capture.opened")).isEqualTo(2);
        assertThat(sum(data, "trapfs.capture.collisions")).isEqualTo(1);
        assertThat(sum(data, "trapfs.capture.completed")).isEqualTo(1);
        assertThat(sum(data, "trapfs.capture.failed")).isEqualTo(1);
        assertThat(sum(data, "trapfs.capture.bytes.total")).isEqualTo(1024);
        assertThat(metric(data, "trapfs.capture.duration.seconds").getHistogramData().getPoints())
            .singleElement()
            .satisfies(point -> {
                assertThat(point.getCount()).isEqualTo(1);
                assertThat(point.getSum()).isEqualTo(0.5);
            });
        assertThat(metric(data, "trapfs.capture.active").getLongGaugeData().getPoints())
            .singleElement()
            .satisfies(point -> assertThat(point.getValue()).isZero());
    }

    @Test
    @DisplayName("Should not touch the active gauge when a capture fails to open")
    void testOpenFailure() {
        metrics.recordCaptureOpenFailed("ftp", null);

        Collection<MetricData> data = reader.collectAllMetrics();

        assertThat(metrics.getActiveCaptures()).isZero();
        LongPointData failed = metric(data, "trapfs.capture.failed")
            .getLongSumData().getPoints().iterator().next();
        assertThat(failed.getAttributes().get(AttributeKey.stringKey("error.type"))).isEqualTo("unknown");
    }

    @Test
    @DisplayName("Should accept recordings when disabled")
    void testDisabled() {
        JailTelemetryMetrics disabled = JailTelemetryMetrics.disabled();

        disabled.recordCaptureOpened("ftp");
        disabled.recordCaptureCompleted("ftp", 10, 0.1);

        assertThat(disabled.getActiveCaptures()).isZero();
    }
}
