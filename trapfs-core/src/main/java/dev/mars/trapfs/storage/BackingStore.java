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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Storage underneath the jail root and the capture store.
 *
 * <p>Entries are addressed with absolute store paths (see {@link StorePaths}). No
 * operation follows symbolic links: metadata is {@code lstat}-like, and a path whose
 * intermediate segment is a symbolic link is reported as missing. Failures are
 * reported with the {@code java.nio.file} exception types
 * ({@link java.nio.file.FileAlreadyExistsException},
 * {@link java.nio.file.NoSuchFileException},
 * {@link java.nio.file.NotDirectoryException},
 * {@link java.nio.file.NotLinkException},
 * {@link java.nio.file.DirectoryNotEmptyException}).</p>
 *
 * <p>Implementations must make {@link #createDirectoryExclusive(String)} and
 * {@link #createExclusive(String)} atomic: when several threads race on one path,
 * exactly one succeeds.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface BackingStore extends Closeable {

    /**
     * Creates a directory whose parent must already exist.
     *
     * @throws java.nio.file.FileAlreadyExistsException if anything exists at the path
     */
    void createDirectoryExclusive(String path) throws IOException;

    /**
     * Recursively copies files, directories and symbolic links of a host directory
     * into an existing store directory. File bytes, relative structure and link
     * targets are preserved; the source is only read.
     *
     * @return number of entries copied
     */
    long mirror(Path source, String destination) throws IOException;

    StoreMetadata metadata(String path) throws IOException;

    /**
     * @return the stored target of a symbolic link, verbatim
     * @throws java.nio.file.NotLinkException if the entry is not a symbolic link
     */
    String readLink(String path) throws IOException;

    /**
     * @return entry names of a directory, sorted
     */
    List<String> list(String directory) throws IOException;

    boolean exists(String path);

    boolean isDirectory(String path);

    boolean isRegularFile(String path);

    InputStream openRead(String path) throws IOException;

    /**
     * Opens a new file for writing; never truncates or appends to an existing one.
     *
     * @throws java.nio.file.FileAlreadyExistsException if the name is taken
     */
    OutputStream createExclusive(String path) throws IOException;

    /**
     * Deletes a file, a symbolic link or an empty directory.
     */
    void delete(String path) throws IOException;

    /**
     * Deletes a subtree. Missing paths are ignored.
     */
    void deleteRecursively(String path) throws IOException;

    /**
     * @throws java.nio.file.FileAlreadyExistsException if the target exists
     */
    void move(String source, String target) throws IOException;

    /**
     * Replaces the permission bits ({@code 07777}) of an entry.
     *
     * @throws UnsupportedOperationException if the store cannot hold POSIX modes
     */
    void setPermissions(String path, int permissionBits) throws IOException;

    void setLastModifiedTime(String path, Instant modified) throws IOException;

    /**
     * @return short human readable description for log messages
     */
    String describe();
}
