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

package dev.mars.trapfs.storage;

import dev.mars.trapfs.stat.FileModes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileSystemException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.NotLinkException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributeView;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFileAttributes;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Backing store over a directory of the host filesystem.
 *
 * <p>Every store path is resolved below the configured root directory. Resolution
 * refuses {@code ..} segments that leave the root and any path whose intermediate
 * segment is a symbolic link, so mirrored links pointing at host locations can be
 * listed and read with {@code readlink} but never traversed.</p>
 *
 * <p>A store created with {@link #temporary(String)} owns its directory and deletes
 * it on {@link #close()}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class LocalBackingStore implements BackingStore {

    private static final Logger logger = LoggerFactory.getLogger(LocalBackingStore.class);
    private static final LinkOption NOFOLLOW = LinkOption.NOFOLLOW_LINKS;

    private final Path root;
    private final boolean temporary;
    private final boolean unixAttributes;
    private final boolean posixAttributes;

    public LocalBackingStore(Path root) throws IOException {
        this(root, false);
    }

    private LocalBackingStore(Path root, boolean temporary) throws IOException {
        Files.createDirectories(root);
        this.root = root.toRealPath();
        this.temporary = temporary;
        Set<String> views = this.root.getFileSystem().supportedFileAttributeViews();
        this.unixAttributes = views.contains("unix");
        this.posixAttributes = views.contains("posix");
        logger.debug("Opened local store at {} (temporary={}, unix={}, posix={})",
                this.root, temporary, unixAttributes, posixAttributes);
    }

    /**
     * Creates a store over a fresh temporary directory that is deleted on close.
     */
    public static LocalBackingStore temporary(String prefix) throws IOException {
        return new LocalBackingStore(Files.createTempDirectory(prefix), true);
    }

    public Path getRoot() {
        return root;
    }

    public boolean isTemporary() {
        return temporary;
    }

    /**
     * Maps a store path onto the host path below the root.
     *
     * @throws NoSuchFileException if the path leaves the root or traverses a symbolic link
     */
    Path resolve(String path) throws NoSuchFileException {
        String normalized = StorePaths.normalize(path);
        Path current = root;
        if (StorePaths.ROOT.equals(normalized)) {
            return current;
        }
        String[] segments = normalized.substring(1).split("/");
        for (int i = 0; i < segments.length; i++) {
            current = current.resolve(segments[i]);
            if (i < segments.length - 1 && Files.isSymbolicLink(current)) {
                throw new NoSuchFileException(path, null, "path traverses a symbolic link");
            }
        }
        if (!current.normalize().startsWith(root)) {
            throw new NoSuchFileException(path, null, "path leaves the store root");
        }
        return current;
    }

    @Override
    public void createDirectoryExclusive(String path) throws IOException {
        Files.createDirectory(resolve(path));
    }

    @Override
    public long mirror(Path source, String destination) throws IOException {
        Path target = resolve(destination);
        if (!Files.isDirectory(target, NOFOLLOW)) {
            throw new NotDirectoryException(destination);
        }
        Path sourceRoot = source.toRealPath();
        if (!Files.isDirectory(sourceRoot)) {
            throw new NotDirectoryException(source.toString());
        }

        AtomicLong copied = new AtomicLong();
        Files.walkFileTree(sourceRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(sourceRoot)) {
                    Files.createDirectory(target.resolve(sourceRoot.relativize(dir)));
                    copied.incrementAndGet();
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Path copy = target.resolve(sourceRoot.relativize(file));
                if (attrs.isSymbolicLink()) {
                    Files.createSymbolicLink(copy, Files.readSymbolicLink(file));
                } else if (attrs.isRegularFile()) {
                    Files.copy(file, copy, StandardCopyOption.COPY_ATTRIBUTES, NOFOLLOW);
                } else {
                    logger.debug("Skipping special file during mirror: {}", file);
                    return FileVisitResult.CONTINUE;
                }
                copied.incrementAndGet();
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Path copy = target.resolve(sourceRoot.relativize(dir));
                if (posixAttributes && !dir.equals(sourceRoot)) {
                    Files.setPosixFilePermissions(copy, Files.getPosixFilePermissions(dir));
                }
                Files.setLastModifiedTime(copy, Files.getLastModifiedTime(dir));
                return FileVisitResult.CONTINUE;
            }
        });
        logger.debug("Mirrored {} entries from {} into {}", copied.get(), sourceRoot, target);
        return copied.get();
    }

    @Override
    public StoreMetadata metadata(String path) throws IOException {
        Path resolved = resolve(path);
        BasicFileAttributes attrs = Files.readAttributes(resolved, BasicFileAttributes.class, NOFOLLOW);
        EntryType type = EntryType.of(attrs);

        int mode;
        int linkCount = 1;
        int uid = -1;
        int gid = -1;
        if (unixAttributes) {
            Map<String, Object> unix = Files.readAttributes(resolved, "unix:mode,nlink,uid,gid", NOFOLLOW);
            mode = (Integer) unix.get("mode");
            linkCount = (Integer) unix.get("nlink");
            uid = (Integer) unix.get("uid");
            gid = (Integer) unix.get("gid");
        } else if (posixAttributes) {
            PosixFileAttributes posix = Files.readAttributes(resolved, PosixFileAttributes.class, NOFOLLOW);
            mode = type.getTypeBits() | FileModes.toBits(posix.permissions());
        } else {
            mode = type.getTypeBits() | type.getDefaultPermissions();
        }

        String linkTarget = type == EntryType.SYMLINK ? Files.readSymbolicLink(resolved).toString() : null;
        return new StoreMetadata(StorePaths.normalize(path), type, mode, linkCount, attrs.size(),
                attrs.lastModifiedTime().toInstant(), linkTarget, uid, gid);
    }

    @Override
    public String readLink(String path) throws IOException {
        Path resolved = resolve(path);
        if (!Files.isSymbolicLink(resolved)) {
            if (!Files.exists(resolved, NOFOLLOW)) {
                throw new NoSuchFileException(path);
            }
            throw new NotLinkException(path);
        }
        return Files.readSymbolicLink(resolved).toString();
    }

    @Override
    public List<String> list(String directory) throws IOException {
        Path resolved = resolve(directory);
        if (!Files.isDirectory(resolved, NOFOLLOW)) {
            if (!Files.exists(resolved, NOFOLLOW)) {
                throw new NoSuchFileException(directory);
            }
            throw new NotDirectoryException(directory);
        }
        try (Stream<Path> entries = Files.list(resolved)) {
            return entries.map(p -> p.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Override
    public boolean exists(String path) {
        try {
            return Files.exists(resolve(path), NOFOLLOW);
        } catch (NoSuchFileException e) {
            return false;
        }
    }

    @Override
    public boolean isDirectory(String path) {
        try {
            return Files.isDirectory(resolve(path), NOFOLLOW);
        } catch (NoSuchFileException e) {
            return false;
        }
    }

    @Override
    public boolean isRegularFile(String path) {
        try {
            return Files.isRegularFile(resolve(path), NOFOLLOW);
        } catch (NoSuchFileException e) {
            return false;
        }
    }

    @Override
    public InputStream openRead(String path) throws IOException {
        Path resolved = resolve(path);
        if (!Files.isRegularFile(resolved, NOFOLLOW)) {
            if (!Files.exists(resolved, NOFOLLOW)) {
                throw new NoSuchFileException(path);
            }
            throw new FileSystemException(path, null, "not a regular file");
        }
        return Files.newInputStream(resolved, StandardOpenOption.READ, NOFOLLOW);
    }

    @Override
    public OutputStream createExclusive(String path) throws IOException {
        return Files.newOutputStream(resolve(path), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
    }

    @Override
    public void delete(String path) throws IOException {
        if (StorePaths.ROOT.equals(StorePaths.normalize(path))) {
            throw new FileSystemException(path, null, "cannot delete the store root");
        }
        Files.delete(resolve(path));
    }

    @Override
    public void deleteRecursively(String path) throws IOException {
        Path resolved = resolve(path);
        if (!Files.exists(resolved, NOFOLLOW)) {
            return;
        }
        deleteTree(resolved);
    }

    @Override
    public void move(String source, String target) throws IOException {
        Path from = resolve(source);
        Path to = resolve(target);
        if (!Files.exists(from, NOFOLLOW)) {
            throw new NoSuchFileException(source);
        }
        Files.move(from, to);
    }

    @Override
    public void setPermissions(String path, int permissionBits) throws IOException {
        if (!posixAttributes) {
            throw new UnsupportedOperationException("POSIX permissions are not supported by " + describe());
        }
        Path resolved = resolve(path);
        if (Files.isSymbolicLink(resolved)) {
            throw new FileSystemException(path, null, "cannot change the mode of a symbolic link");
        }
        PosixFileAttributeView view = Files.getFileAttributeView(resolved, PosixFileAttributeView.class, NOFOLLOW);
        view.setPermissions(FileModes.toPermissions(permissionBits));
    }

    @Override
    public void setLastModifiedTime(String path, Instant modified) throws IOException {
        Path resolved = resolve(path);
        if (!Files.exists(resolved, NOFOLLOW)) {
            throw new NoSuchFileException(path);
        }
        BasicFileAttributeView view = Files.getFileAttributeView(resolved, BasicFileAttributeView.class, NOFOLLOW);
        view.setTimes(FileTime.from(modified), null, null);
    }

    @Override
    public String describe() {
        return "local:" + root;
    }

    @Override
    public void close() throws IOException {
        if (temporary && Files.exists(root, NOFOLLOW)) {
            deleteTree(root);
            logger.debug("Deleted temporary store {}", root);
        }
    }

    private static void deleteTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    @Override
    public String toString() {
        return "LocalBackingStore{root=" + root + ", temporary=" + temporary + "}";
    }
}
