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

import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/**
 * POSIX {@code st_mode} constants and conversions.
 *
 * <p>{@link #toPermissionString(int)} renders the ten character form used by
 * {@code ls -l} (file type followed by three rwx triplets, with the setuid, setgid
 * and sticky bits folded into the execute columns as s/S and t/T).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class FileModes {

    public static final int S_IFMT = 0170000;
    public static final int S_IFSOCK = 0140000;
    public static final int S_IFLNK = 0120000;
    public static final int S_IFREG = 0100000;
    public static final int S_IFBLK = 0060000;
    public static final int S_IFDIR = 0040000;
    public static final int S_IFCHR = 0020000;
    public static final int S_IFIFO = 0010000;

    public static final int S_ISUID = 04000;
    public static final int S_ISGID = 02000;
    public static final int S_ISVTX = 01000;

    /** Permission and special bits, everything below the file type. */
    public static final int PERMISSION_MASK = 07777;

    private static final PosixFilePermission[] PERMISSION_ORDER = {
            PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_EXECUTE,
            PosixFilePermission.GROUP_READ, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_EXECUTE,
            PosixFilePermission.OTHERS_READ, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_EXECUTE
    };

    private FileModes() {
    }

    public static int fileType(int mode) {
        return mode & S_IFMT;
    }

    public static boolean isDirectory(int mode) {
        return fileType(mode) == S_IFDIR;
    }

    public static boolean isRegularFile(int mode) {
        return fileType(mode) == S_IFREG;
    }

    public static boolean isSymbolicLink(int mode) {
        return fileType(mode) == S_IFLNK;
    }

    public static int toBits(Set<PosixFilePermission> permissions) {
        int bits = 0;
        for (int i = 0; i < PERMISSION_ORDER.length; i++) {
            if (permissions.contains(PERMISSION_ORDER[i])) {
                bits |= 1 << (8 - i);
            }
        }
        return bits;
    }

    public static Set<PosixFilePermission> toPermissions(int mode) {
        Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
        for (int i = 0; i < PERMISSION_ORDER.length; i++) {
            if ((mode & (1 << (8 - i))) != 0) {
                permissions.add(PERMISSION_ORDER[i]);
            }
        }
        return permissions;
    }

    public static String toPermissionString(int mode) {
        char[] out = new char[10];
        out[0] = typeChar(mode);
        out[1] = (mode & 0400) != 0 ? 'r' : '-';
        out[2] = (mode & 0200) != 0 ? 'w' : '-';
        out[3] = executeChar(mode & 0100, mode & S_ISUID, 's');
        out[4] = (mode & 040) != 0 ? 'r' : '-';
        out[5] = (mode & 020) != 0 ? 'w' : '-';
        out[6] = executeChar(mode & 010, mode & S_ISGID, 's');
        out[7] = (mode & 04) != 0 ? 'r' : '-';
        out[8] = (mode & 02) != 0 ? 'w' : '-';
        out[9] = executeChar(mode & 01, mode & S_ISVTX, 't');
        return new String(out);
    }

    private static char typeChar(int mode) {
        switch (fileType(mode)) {
            case S_IFLNK:
                return 'l';
            case S_IFSOCK:
                return 's';
            case S_IFREG:
                return '-';
            case S_IFBLK:
                return 'b';
            case S_IFDIR:
                return 'd';
            case S_IFCHR:
                return 'c';
            case S_IFIFO:
                return 'p';
            default:
                return '-';
        }
    }

    private static char executeChar(int executeBit, int specialBit, char special) {
        if (specialBit != 0) {
            return executeBit != 0 ? special : Character.toUpperCase(special);
        }
        return executeBit != 0 ? 'x' : '-';
    }
}
