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

import java.time.Instant;

/**
 * Raw metadata of a backing store entry, read without following symbolic links.
 *
 * @param path       the store path the metadata was read for
 * @param type       entry kind
 * @param mode       full {@code st_mode}: file type bits plus permission bits
 * @param linkCount  hard link count
 * @param size       size in bytes (for a symlink, the length of its target)
 * @param modified   last modification time
 * @param linkTarget target of a symbolic link, {@code null} for other entries
 * @param uid        numeric owner as reported by the store; diagnostic only
 * @param gid        numeric group as reported by the store; diagnostic only
 */
public record StoreMetadata(
        String path,
        EntryType type,
        int mode,
        int linkCount,
        long size,
        Instant modified,
        String linkTarget,
        int uid,
        int gid
) {

    public boolean isDirectory() {
        return type == EntryType.DIRECTORY;
    }

    public boolean isSymbolicLink() {
        return type == EntryType.SYMLINK;
    }

    public boolean isRegularFile() {
        return type == EntryType.FILE;
    }
}
