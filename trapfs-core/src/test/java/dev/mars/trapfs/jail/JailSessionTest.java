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

import dev.mars.trapfs.capture.NameSanitizer;
import dev.mars.trapfs.capture.UploadCaptureService;
import dev.mars.trapfs.capture.UploadCaptureWriter;
import dev.mars.trapfs.core.exceptions.AlreadyExistsException;
import dev.mars.trapfs.core.exceptions.FilesystemException;
import dev.mars.trapfs.core.exceptions.NotADirectoryException;
import dev.mars.trapfs.core.exceptions.NotASymlinkException;
import dev.mars.trapfs.core.exceptions.NotFoundException;
import dev.mars.trapfs.core.exceptions.OperationNotImplementedException;
import dev.mars.trapfs.listing.DirectoryListingFormatter;
import dev.mars.trapfs.observability.JailTelemetryMetrics;
import dev.mars.trapfs.stat.StatEmulator;
import dev.mars.trapfs.stat.StatInfo;
import dev.mars.trapfs.storage.InMemoryBackingStore;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link JailSession}.
 */
@DisplayName("JailSession Tests")
class JailSessionTest {

    private static final Instant NOW = Instant.parse("2024-03-14T09:26:53Z");
    private static final Instant OLD = Instant.parse("2022-09-02T10:15:00Z");

    @TempDir
    Path emptySource;

    private InMemoryBackingStore store;
    private JailRoot root;
    private JailSession session;

    @BeforeEach
    void setUp() throws Exception {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryBackingStore(clock);
        root = new JailRoot(store, new StatEmulator(store, "owner", "group"),
                new DirectoryListingFormatter(clock, Duration.ofDays(180)), JailTelemetryMetrics.disabled());
        root.initialize("ftp", emptySource);
        root.initialize("ssh", emptySource);

        store.createDirectories("/ftp/pub/music");
        store.createFile("/ftp/pub/music.mp3", "ID3 tag".getBytes(StandardCharsets.UTF_8), 0644, OLD);
        store.createSymbolicLink("/ftp/pub/latest", "music.mp3");
        store.createSymbolicLink("/ftp/pub/up", "..");
        store.createFile("/ssh/secret", "do not leak".getBytes(StandardCharsets.UTF_8));

        session = root.getJail("ftp").orElseThrow().openSession();
    }

    // ==================== Navigation ====================

    @Nested
    @DisplayName("Navigation")
    class NavigationTests {

        @Test
        @DisplayName("Should change directories with relative, absolute and dot segments")
        void testChdir() throws Exception {
            session.chdir("pub");
            assertThat(session.getcwd()).isEqualTo("/pub");

            session.chdir("music");
            assertThat(session.getcwd()).isEqualTo("/pub/music");

            session.chdir("../..");
            assertThat(session.getcwd()).isEqualTo("/");

            session.chdir("/pub/./music/..");
            assertThat(session.getcwd()).isEqualTo("/pub");
        }

        @Test
        @DisplayName("Should reject climbing above home and keep the working directory")
        void testEscapeRejected() throws Exception {
            session.chdir("pub");

            assertThatThrownBy(() -> session.chdir("../.."))
                .isInstanceOfSatisfying(NotADirectoryException.class, e -> assertThat(e.isEscapeAttempt()).isTrue());
            assertThatThrownBy(() -> session.chdir("/../ssh"))
                .isInstanceOf(NotADirectoryException.class);
            assertThat(session.getcwd()).isEqualTo("/pub");
        }

        @Test
        @DisplayName("Should refuse files, missing paths and symbolic links as targets")
        void testChdirNonDirectories() {
            assertThatThrownBy(() -> session.chdir("/pub/music.mp3"))
                .isInstanceOfSatisfying(NotADirectoryException.class, e -> assertThat(e.isEscapeAttempt()).isFalse());
            assertThatThrownBy(() -> session.chdir("/missing"))
                .isInstanceOf(NotADirectoryException.class);
            assertThatThrownBy(() -> session.chdir("/pub/up"))
                .isInstanceOf(NotADirectoryException.class);
            assertThat(session.getcwd()).isEqualTo("/");
        }

        @RepeatedTest(10)
        @DisplayName("Should stay inside home for random chdir sequences")
        void testRandomChdirContainment(RepetitionInfo repetition) {
            Random random = new Random(31L * repetition.getCurrentRepetition());
            String[] moves = {"..", "pub", "music", "/", "../..", "/pub/music", "up", "/..", "."};

            for (int step = 0; step < 100; step++) {
                try {
                    session.chdir(moves[random.nextInt(moves.length)]);
                } catch (FilesystemException e) {
                    assertThat(e).isInstanceOf(NotADirectoryException.class);
                }
                assertThat(session.getcwd()).isIn("/", "/pub", "/pub/music");
            }
        }
    }

    // ==================== Metadata ====================

    @Nested
    @DisplayName("Metadata")
    class MetadataTests {

        @Test
        @DisplayName("Should stat files relative to the working directory")
        void testStat() throws Exception {
            session.chdir("pub");

            StatInfo stat = session.stat("music.mp3");

            assertThat(stat.permissionString()).isEqualTo("-rw-r--r--");
            assertThat(stat.size()).isEqualTo(7);
            assertThat(session.getsize("music.mp3")).isEqualTo(7);
            assertThat(session.getmtime("music.mp3")).isEqualTo(OLD);
        }

        @Test
        @DisplayName("Should read links verbatim")
        void testReadlink() throws Exception {
            assertThat(session.readlink("/pub/latest")).isEqualTo("music.mp3");
            assertThat(session.readlink("/pub/up")).isEqualTo("..");
            assertThatThrownBy(() -> session.readlink("/pub/music.mp3"))
                .isInstanceOf(NotASymlinkException.class);
        }

        @Test
        @DisplayName("Should not reveal anything outside home")
        void testNoLeak() {
            assertThatThrownBy(() -> session.stat("/../ssh/secret"))
                .isInstanceOf(NotFoundException.class);
            assertThatThrownBy(() -> session.openRead("../ssh/secret"))
                .isInstanceOf(NotFoundException.class);
            assertThat(session.exists("/../ssh/secret")).isFalse();
            assertThat(session.exists("/ssh/secret")).isFalse();
        }

        @Test
        @DisplayName("Should answer existence and type checks")
        void testExistenceChecks() {
            assertThat(session.exists("/pub/latest")).isTrue();
            assertThat(session.isDirectory("/pub")).isTrue();
            assertThat(session.isDirectory("/pub/up")).isFalse();
            assertThat(session.isFile("/pub/music.mp3")).isTrue();
            assertThat(session.isFile("/pub/latest")).isFalse();
        }
    }

    // ==================== Listing ====================

    @Nested
    @DisplayName("Listing")
    class ListingTests {

        @Test
        @DisplayName("Should list names sorted")
        void testListdir() throws Exception {
            assertThat(session.listdir("/pub")).containsExactly("latest", "music", "music.mp3", "up");
            assertThatThrownBy(() -> session.listdir("/pub/music.mp3"))
                .isInstanceOf(NotADirectoryException.class);
            assertThatThrownBy(() -> session.listdir("/nope"))
                .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("Should list stat data per entry")
        void testListDirectoryInfo() throws Exception {
            Map<String, StatInfo> info = session.listDirectoryInfo("/pub");

            assertThat(info).containsOnlyKeys("latest", "music", "music.mp3", "up");
            assertThat(info.get("music").isDirectory()).isTrue();
            assertThat(info.get("latest").isSymbolicLink()).isTrue();
        }

        @Test
        @DisplayName("Should render an ls -lA listing of a directory")
        void testRenderListing() throws Exception {
            session.chdir("pub");

            String listing = session.renderListing(".");

            assertThat(listing).isEqualTo(
                "lrwxrwxrwx   1 owner    group          9 Mar 14 09:26 latest -> music.mp3\r\n"
                + "drwxr-xr-x   2 owner    group       4096 Mar 14 09:26 music\r\n"
                + "-rw-r--r--   1 owner    group          7 Sep 02  2022 music.mp3\r\n"
                + "lrwxrwxrwx   1 owner    group          2 Mar 14 09:26 up -> ..\r\n");
        }

        @Test
        @DisplayName("Should format selected names lazily")
        void testFormatList() throws Exception {
            List<String> lines = session.formatList("/pub", List.of("music.mp3"))
                .collect(Collectors.toList());

            assertThat(lines).containsExactly("-rw-r--r--   1 owner    group          7 Sep 02  2022 music.mp3\r\n");
        }

        @Test
        @DisplayName("Should report an entry that disappears")
        void testRenderMissingEntry() {
            assertThatThrownBy(() -> session.renderListing("/pub", List.of("music.mp3", "ghost")))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("/pub/ghost");
        }
    }

    // ==================== Content and Mutation ====================

    @Nested
    @DisplayName("Content and Mutation")
    class MutationTests {

        @Test
        @DisplayName("Should read mirrored files")
        void testOpenRead() throws Exception {
            try (InputStream in = session.openRead("/pub/music.mp3")) {
                assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("ID3 tag");
            }
            assertThatThrownBy(() -> session.openRead("/pub"))
                .isInstanceOf(FilesystemException.class)
                .hasMessageContaining("not a regular file");
            assertThatThrownBy(() -> session.openRead("/pub/latest"))
                .isInstanceOf(FilesystemException.class);
        }

        @Test
        @DisplayName("Should create and remove directories")
        void testDirectories() throws Exception {
            session.makeDirectory("/incoming");
            assertThat(session.isDirectory("/incoming")).isTrue();
            assertThatThrownBy(() -> session.makeDirectory("/incoming"))
                .isInstanceOf(AlreadyExistsException.class);

            session.removeDirectory("/incoming");
            assertThat(session.exists("/incoming")).isFalse();

            assertThatThrownBy(() -> session.removeDirectory("/pub"))
                .isInstanceOf(FilesystemException.class)
                .hasMessageContaining("not empty");
            assertThatThrownBy(() -> session.removeDirectory("/"))
                .isInstanceOf(FilesystemException.class);
            assertThatThrownBy(() -> session.makeDirectory("../evil"))
                .isInstanceOf(NotADirectoryException.class);
        }

        @Test
        @DisplayName("Should refuse removing the working directory")
        void testRemoveWorkingDirectory() throws Exception {
            session.chdir("/pub/music");

            assertThatThrownBy(() -> session.removeDirectory("/pub/music"))
                .isInstanceOf(FilesystemException.class)
                .hasMessageContaining("in use");
        }

        @Test
        @DisplayName("Should remove files and links but not directories")
        void testRemoveFile() throws Exception {
            session.removeFile("/pub/latest");
            assertThat(session.exists("/pub/latest")).isFalse();
            assertThat(session.exists("/pub/music.mp3")).isTrue();

            assertThatThrownBy(() -> session.removeFile("/pub/music"))
                .isInstanceOf(FilesystemException.class)
                .hasMessageContaining("is a directory");
        }

        @Test
        @DisplayName("Should rename without replacing")
        void testRename() throws Exception {
            session.rename("/pub/music.mp3", "/pub/song.mp3");
            assertThat(session.isFile("/pub/song.mp3")).isTrue();

            assertThatThrownBy(() -> session.rename("/pub/song.mp3", "/pub/latest"))
                .isInstanceOf(AlreadyExistsException.class);
            assertThatThrownBy(() -> session.rename("/pub/song.mp3", "/../ssh/song.mp3"))
                .isInstanceOf(NotFoundException.class);
        }

        @Test
        @DisplayName("Should emulate chmod and utime on the jail copy")
        void testChmodAndUtime() throws Exception {
            Instant modified = Instant.parse("2023-01-01T00:00:00Z");

            session.chmod("/pub/music.mp3", 0600);
            session.utime("/pub/music.mp3", modified);

            StatInfo stat = session.stat("/pub/music.mp3");
            assertThat(stat.permissionString()).isEqualTo("-rw-------");
            assertThat(stat.mtime()).isEqualTo(modified);
        }

        @Test
        @DisplayName("Should report chmod as not implemented without POSIX modes")
        void testChmodUnsupported() throws Exception {
            InMemoryBackingStore modeless = new InMemoryBackingStore() {
                @Override
                public void setPermissions(String path, int permissionBits) {
                    throw new UnsupportedOperationException("no POSIX modes");
                }
            };
            JailSession other = new JailRoot(modeless).initialize("ftp", emptySource).openSession();

            assertThatThrownBy(() -> other.chmod("/", 0700))
                .isInstanceOf(OperationNotImplementedException.class);
        }
    }

    // ==================== Uploads ====================

    @Nested
    @DisplayName("Uploads")
    class UploadTests {

        @Test
        @DisplayName("Should refuse uploads without a capture store")
        void testNoCaptureStore() {
            assertThatThrownBy(() -> session.beginUpload("evil.sh"))
                .isInstanceOf(OperationNotImplementedException.class);
        }

        @Test
        @DisplayName("Should capture outside the jail and close open uploads with the session")
        void testUploadClosedWithSession() throws Exception {
            InMemoryBackingStore captureStore = new InMemoryBackingStore();
            UploadCaptureService captureService = new UploadCaptureService(captureStore,
                    new NameSanitizer(Clock.fixed(NOW, ZoneOffset.UTC), ZoneOffset.UTC, NameSanitizer.DEFAULT_TIMESTAMP_PATTERN),
                    3, false, JailTelemetryMetrics.disabled(), Clock.systemUTC());
            JailSession uploading = root.getJail("ftp").orElseThrow().openSession("s-1", captureService);

            UploadCaptureWriter finished = uploading.beginUpload("done.txt");
            finished.writeChunk("a".getBytes(StandardCharsets.UTF_8));
            finished.close();
            UploadCaptureWriter pending = uploading.beginUpload("evil.sh");
            pending.writeChunk("rm -rf /".getBytes(StandardCharsets.UTF_8));
            assertThat(uploading.getOpenUploadCount()).isEqualTo(1);

            uploading.close();

            assertThat(pending.isClosed()).isTrue();
            assertThat(uploading.getOpenUploadCount()).isZero();
            assertThat(captureStore.readAllBytes("/2024-03-14 09:26:53 - evil-sh"))
                .isEqualTo("rm -rf /".getBytes(StandardCharsets.UTF_8));
            assertThat(store.exists("/ftp/evil.sh")).isFalse();
            assertThatThrownBy(() -> uploading.beginUpload("late"))
                .isInstanceOf(IllegalStateException.class);
        }
    }

    @AfterEach
    void tearDown() throws IOException, FilesystemException {
        session.close();
        root.close();
    }
}
