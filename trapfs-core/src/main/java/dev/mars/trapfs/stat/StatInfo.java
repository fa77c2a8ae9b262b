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

package dev.mars.trapfs.stat;

import java.time.Instant;

/**
 * Emulated {@code lstat} result as shown to a protocol session.
 *
 * <p>{@code owner} and {@code group} are display placeholders, never host identities.</p>
 *
 * @param mode  file type and permission bits, as in {@code st_mode}
 * @param nlink hard link count
 * @param size  size in bytes; for symbolic links the length of the target
 * @param mtime last modification time
 */
public record StatInfo(int mode, int nlink, long size, Instant mtime, String owner, String group) {

    public boolean isDirectory() {
        return FileModes.isDirectory(mode);
    }

    public boolean isRegularFile() {
        return FileModes.isRegularFile(mode);
    }

    public boolean isSymbolicLink() {
        return FileModes.isSymbolicLink(mode);
    }

    public int permissionBits() {
        return mode & FileModes.PERMISSION_MASK;
    }

    /**
     * @return the ten character {@code ls -l} mode string, e.g. {@code -rw-r--r--}
     */
    public String permissionString() {
        return FileModes.toPermissionString(mode);
    }
}
