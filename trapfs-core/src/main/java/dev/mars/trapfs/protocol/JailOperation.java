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

package dev.mars.trapfs.protocol;

/**
 * Filesystem operations a protocol adapter can invoke on a
 * {@link dev.mars.trapfs.jail.JailSession}.
 */
public enum JailOperation {
    /** {@code chdir} */
    CHDIR,
    /** {@code getcwd} */
    GETCWD,
    /** {@code stat} */
    STAT,
    /** {@code readlink} */
    READLINK,
    /** {@code renderListing}, long format */
    LIST,
    /** {@code listdir}, names only */
    LIST_NAMES,
    /** {@code listDirectoryInfo} */
    LIST_INFO,
    /** {@code exists}, {@code isDirectory}, {@code isFile} */
    EXISTS,
    /** {@code getsize} */
    GETSIZE,
    /** {@code getmtime} */
    GETMTIME,
    /** {@code utime} */
    UTIME,
    /** {@code chmod} */
    CHMOD,
    /** {@code makeDirectory} */
    MAKEDIR,
    /** {@code removeDirectory} */
    REMOVEDIR,
    /** {@code removeFile} */
    REMOVE,
    /** {@code rename} */
    RENAME,
    /** {@code openRead} */
    RETRIEVE,
    /** {@code beginUpload} */
    STORE
}
