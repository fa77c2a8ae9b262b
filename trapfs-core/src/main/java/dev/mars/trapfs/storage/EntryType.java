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

import java.nio.file.attribute.BasicFileAttributes;

/**
 * Kind of entry held by a backing store.
 */
public enum EntryType {
    FILE(FileModes.S_IFREG, 0644),
    DIRECTORY(FileModes.S_IFDIR, 0755),
    SYMLINK(FileModes.S_IFLNK, 0777),
    /** Sockets, devices, FIFOs. Never mirrored. */
    OTHER(0, 0);

    private final int typeBits;
    private final int defaultPermissions;

    EntryType(int typeBits, int defaultPermissions) {
        this.typeBits = typeBits;
        this.defaultPermissions = defaultPermissions;
    }

    public int getTypeBits() {
        return typeBits;
    }

    public int getDefaultPermissions() {
        return defaultPermissions;
    }

    public static EntryType of(BasicFileAttributes attributes) {
        if (attributes.isSymbolicLink()) {
            return SYMLINK;
        }
        if (attributes.isDirectory()) {
            return DIRECTORY;
        }
        if (attributes.isRegularFile()) {
            return FILE;
        }
        return OTHER;
    }
}
