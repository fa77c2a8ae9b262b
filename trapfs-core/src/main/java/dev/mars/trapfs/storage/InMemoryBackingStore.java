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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.NotLinkException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Backing store that keeps every entry in memory.
 *
 * <p>Used as a jail store when nothing should touch disk, and throughout the tests
 * because modes, link counts and timestamps can be set exactly. Entries are kept in a
 * concurrent map keyed by normalized store path; structural changes (create, delete,
 * move) are serialized on the store so exclusive creates stay atomic.</p>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * InMemoryBackingStore store = new InMemoryBackingStore();
 * store.createDirectoryExclusive("/ftp");
 * store.createFile("/ftp/music.mp3", content, 0644, Instant.parse("2022-09-02T03:47:00Z"));
 * store.createSymbolicLink("/ftp/latest.mp3", "music.mp3");
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith
 * @since 1.0
 */
public class InMemoryBackingStore implements BackingStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryBackingStore.class);

    private final Map<String, Node> nodes = new ConcurrentHashMap<>();
    private final Clock clock;

    // Statistics
    private final AtomicLong bytesRead = new AtomicLong(0);
    private final AtomicLong bytesWritten = new AtomicLong(0);

    public InMemoryBackingStore() {
        this(Clock.systemUTC());
    }

    public InMemoryBackingStore(Clock clock) {
        this.clock = clock;
        nodes.put(StorePaths.ROOT, Node.directory(0755, clock.instant()));
    }

    // ==================== Test fixtures ====================

    /**
     * Creates a regular file with explicit mode bits and modification time.
     * Parent directories must exist.
     */
    public synchronized void createFile(String path, byte[] content, int permissions, Instant modified)
            throws IOException {
        String normalized = StorePaths.normalize(path);
        requireParentDirectory(normalized);
        Node node = Node.file(content, permissions, modified);
        if (nodes.putIfAbsent(normalized, node) != null) {
            throw new FileAlreadyExistsException(normalized);
        }
    }

    public void createFile(String path, byte[] content) throws IOException {
        createFile(path, content, EntryType.FILE.getDefaultPermissions(), clock.instant());
    }

    public synchronized void createSymbolicLink(String path, String target) throws IOException {
        String normalized = StorePaths.normalize(path);
        requireParentDirectory(normalized);
        if (nodes.putIfAbsent(normalized, Node.symlink(target, clock.instant())) != null) {
            throw new FileAlreadyExistsException(normalized);
        }
    }

    /**
     * Creates a directory and any missing parents.
     */
    public synchronized void createDirectories(String path) throws IOException {
        String normalized = StorePaths.normalize(path);
        List<String> chain = new ArrayList<>();
        for (String current = normalized; current != null; current = StorePaths.parent(current)) {
            chain.add(0, current);
        }
        for (String dir : chain) {
            Node existing = nodes.get(dir);
            if (existing == null) {
                nodes.put(dir, Node.directory(EntryType.DIRECTORY.getDefaultPermissions(), clock.instant()));
            } else if (existing.type != EntryType.DIRECTORY) {
                throw new NotDirectoryException(dir);
            }
        }
    }

    public byte[] readAllBytes(String path) throws IOException {
        try (InputStream in = openRead(path)) {
            return in.readAllBytes();
        }
    }

    // ==================== BackingStore ====================

    @Override
    public synchronized void createDirectoryExclusive(String path) throws IOException {
        String normalized = StorePaths.normalize(path);
        requireParentDirectory(normalized);
        Node directory = Node.directory(EntryType.DIRECTORY.getDefaultPermissions(), clock.instant());
        if (nodes.putIfAbsent(normalized, directory) != null) {
            throw new FileAlreadyExistsException(normalized);
        }
    }

    @Override
    public long mirror(Path source, String destination) throws IOException {
        String target = StorePaths.normalize(destination);
        if (!isDirectory(target)) {
            throw new NotDirectoryException(destination);
        }
        Path sourceRoot = source.toRealPath();
        if (!Files.isDirectory(sourceRoot)) {
            throw new NotDirectoryException(source.toString());
        }
        boolean posix = sourceRoot.getFileSystem().supportedFileAttributeViews().contains("posix");

        AtomicLong copied = new AtomicLong();
        Files.walkFileTree(sourceRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (!dir.equals(sourceRoot)) {
                    insert(toStorePath(dir), Node.directory(permissionsOf(dir, EntryType.DIRECTORY),
                            attrs.lastModifiedTime().toInstant()));
                    copied.incrementAndGet();
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (attrs.isSymbolicLink()) {
                    insert(toStorePath(file), Node.symlink(Files.readSymbolicLink(file).toString(),
                            attrs.lastModifiedTime().toInstant()));
                } else if (attrs.isRegularFile()) {
                    byte[] content = Files.readAllBytes(file);
                    insert(toStorePath(file), Node.file(content, permissionsOf(file, EntryType.FILE),
                            attrs.lastModifiedTime().toInstant()));
                    bytesWritten.addAndGet(content.length);
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
                return FileVisitResult.CONTINUE;
            }

            private String toStorePath(Path hostPath) {
                String relative = sourceRoot.relativize(hostPath).toString().replace('\\', '/');
                return StorePaths.join(target, relative);
            }

            private int permissionsOf(Path hostPath, EntryType type) throws IOException {
                if (!posix) {
                    return type.getDefaultPermissions();
                }
                PosixFileAttributes attributes = Files.readAttributes(hostPath, PosixFileAttributes.class);
                return FileModes.toBits(attributes.permissions());
            }
        });
        logger.debug("Mirrored {} entries from {} into memory:{}", copied.get(), sourceRoot, target);
        return copied.get();
    }

    @Override
    public StoreMetadata metadata(String path) throws IOException {
        String normalized = StorePaths.normalize(path);
        Node node = lookup(normalized);
        int linkCount = 1;
        long size;
        switch (node.type) {
            case DIRECTORY:
                linkCount = 2 + (int) childrenOf(normalized).stream()
                        .map(nodes::get)
                        .filter(child -> child != null && child.type == EntryType.DIRECTORY)
                        .count();
                size = 4096;
                break;
            case SYMLINK:
                size = node.linkTarget.length();
                break;
            default:
                size = node.content.length;
                break;
        }
        return new StoreMetadata(normalized, node.type, node.type.getTypeBits() | node.permissions,
                linkCount, size, node.modified, node.linkTarget, 0, 0);
    }

    @Override
    public String readLink(String path) throws IOException {
        String normalized = StorePaths.normalize(path);
        Node node = lookup(normalized);
        if (node.type != EntryType.SYMLINK) {
            throw new NotLinkException(normalized);
        }
        return node.linkTarget;
    }

    @Override
    public List<String> list(String directory) throws IOException {
        String normalized = StorePaths.normalize(directory);
        Node node = lookup(normalized);
        if (node.type != EntryType.DIRECTORY) {
            throw new NotDirectoryException(normalized);
        }
        return childrenOf(normalized).stream()
                .map(StorePaths::name)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public boolean exists(String path) {
        return find(path) != null;
    }

    @Override
    public boolean isDirectory(String path) {
        Node node = find(path);
        return node != null && node.type == EntryType.DIRECTORY;
    }

    @Override
    public boolean isRegularFile(String path) {
        Node node = find(path);
        return node != null && node.type == EntryType.FILE;
    }

    @Override
    public InputStream openRead(String path) throws IOException {
        String normalized = StorePaths.normalize(path);
        Node node = lookup(normalized);
        if (node.type != EntryType.FILE) {
            throw new FileSystemException(normalized, null, "not a regular file");
        }
        byte[] content = node.content;
        bytesRead.addAndGet(content.length);
        return new ByteArrayInputStream(content);
    }

    @Override
    public synchronized OutputStream createExclusive(String path) throws IOException {
        String normalized = StorePaths.normalize(path);
        requireParentDirectory(normalized);
        Node node = Node.file(new byte[0], EntryType.FILE.getDefaultPermissions(), clock.instant());
        if (nodes.putIfAbsent(normalized, node) != null) {
            throw new FileAlreadyExistsException(normalized);
        }
        return new NodeOutputStream(node);
    }

    @Override
    public synchronized void delete(String path) throws IOException {
        String normalized = StorePaths.normalize(path);
        if (StorePaths.ROOT.equals(normalized)) {
            throw new FileSystemException(normalized, null, "cannot delete the store root");
        }
        Node node = lookup(normalized);
        if (node.type == EntryType.DIRECTORY && !childrenOf(normalized).isEmpty()) {
            throw new DirectoryNotEmptyException(normalized);
        }
        nodes.remove(normalized);
    }

    @Override
    public synchronized void deleteRecursively(String path) throws IOException {
        String normalized = StorePaths.normalize(path);
        if (!nodes.containsKey(normalized)) {
            return;
        }
        nodes.keySet().removeIf(key -> !StorePaths.ROOT.equals(key) && StorePaths.isAncestorOrSelf(normalized, key));
    }

    @Override
    public synchronized void move(String source, String target) throws IOException {
        String from = StorePaths.normalize(source);
        String to = StorePaths.normalize(target);
        lookup(from);
        requireParentDirectory(to);
        if (nodes.containsKey(to)) {
            throw new FileAlreadyExistsException(to);
        }
        if (StorePaths.isAncestorOrSelf(from, to)) {
            throw new FileSystemException(from, to, "cannot move a directory into itself");
        }
        List<String> moved = nodes.keySet().stream()
                .filter(key -> StorePaths.isAncestorOrSelf(from, key))
                .sorted(Comparator.comparingInt(String::length))
                .collect(Collectors.toList());
        for (String key : moved) {
            nodes.put(to + key.substring(from.length()), nodes.remove(key));
        }
    }

    @Override
    public void setPermissions(String path, int permissionBits) throws IOException {
        Node node = lookup(StorePaths.normalize(path));
        if (node.type == EntryType.SYMLINK) {
            throw new FileSystemException(path, null, "cannot change the mode of a symbolic link");
        }
        node.permissions = permissionBits & FileModes.PERMISSION_MASK;
    }

    @Override
    public void setLastModifiedTime(String path, Instant modified) throws IOException {
        lookup(StorePaths.normalize(path)).modified = modified;
    }

    @Override
    public String describe() {
        return "memory:" + Integer.toHexString(System.identityHashCode(this));
    }

    @Override
    public synchronized void close() {
        nodes.clear();
        nodes.put(StorePaths.ROOT, Node.directory(0755, clock.instant()));
    }

    public long getBytesRead() {
        return bytesRead.get();
    }

    public long getBytesWritten() {
        return bytesWritten.get();
    }

    public int getEntryCount() {
        return nodes.size();
    }

    // ==================== Helper Methods ====================

    private Node find(String path) {
        try {
            return nodes.get(StorePaths.normalize(path));
        } catch (NoSuchFileException e) {
            return null;
        }
    }

    private Node lookup(String normalized) throws NoSuchFileException {
        Node node = nodes.get(normalized);
        if (node == null) {
            throw new NoSuchFileException(normalized);
        }
        return node;
    }

    private void requireParentDirectory(String normalized) throws IOException {
        String parent = StorePaths.parent(normalized);
        if (parent == null) {
            throw new FileAlreadyExistsException(normalized);
        }
        Node parentNode = lookup(parent);
        if (parentNode.type != EntryType.DIRECTORY) {
            throw new NotDirectoryException(parent);
        }
    }

    private synchronized void insert(String normalized, Node node) throws IOException {
        requireParentDirectory(normalized);
        if (nodes.putIfAbsent(normalized, node) != null) {
            throw new FileAlreadyExistsException(normalized);
        }
    }

    private List<String> childrenOf(String directory) {
        String prefix = StorePaths.ROOT.equals(directory) ? StorePaths.ROOT : directory + "/";
        return nodes.keySet().stream()
                .filter(key -> key.length() > prefix.length() && key.startsWith(prefix))
                .filter(key -> key.indexOf('/', prefix.length()) < 0)
                .collect(Collectors.toList());
    }

    /**
     * A file, directory or symbolic link held in memory.
     */
    private static final class Node {
        final EntryType type;
        volatile byte[] content;
        final String linkTarget;
        volatile int permissions;
        volatile Instant modified;

        private Node(EntryType type, byte[] content, String linkTarget, int permissions, Instant modified) {
            this.type = type;
            this.content = content;
            this.linkTarget = linkTarget;
            this.permissions = permissions;
            this.modified = modified;
        }

        static Node file(byte[] content, int permissions, Instant modified) {
            return new Node(EntryType.FILE, content.clone(), null, permissions & FileModes.PERMISSION_MASK, modified);
        }

        static Node directory(int permissions, Instant modified) {
            return new Node(EntryType.DIRECTORY, null, null, permissions & FileModes.PERMISSION_MASK, modified);
        }

        static Node symlink(String target, Instant modified) {
            return new Node(EntryType.SYMLINK, null, target, EntryType.SYMLINK.getDefaultPermissions(), modified);
        }
    }

    /**
     * Output stream that publishes its buffer into the node on every flush and on close.
     */
    private final class NodeOutputStream extends ByteArrayOutputStream {
        private final Node node;
        private boolean closed;

        NodeOutputStream(Node node) {
            this.node = node;
        }

        @Override
        public synchronized void write(int b) {
            ensureOpen();
            super.write(b);
        }

        @Override
        public synchronized void write(byte[] b, int off, int len) {
            ensureOpen();
            super.write(b, off, len);
        }

        @Override
        public synchronized void flush() {
            if (!closed) {
                publish();
            }
        }

        @Override
        public synchronized void close() {
            if (!closed) {
                publish();
                closed = true;
            }
        }

        private void publish() {
            byte[] snapshot = toByteArray();
            bytesWritten.addAndGet(snapshot.length - node.content.length);
            node.content = snapshot;
            node.modified = clock.instant();
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("stream closed");
            }
        }
    }
}
