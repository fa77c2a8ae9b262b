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

package dev.mars.trapfs.core.exceptions;

/**
 * Thrown when a directory operation targets something that is not a directory in
 * the jail, including any path that would resolve above the jail home.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class NotADirectoryException extends FilesystemException {

    private final boolean escapeAttempt;

    public NotADirectoryException(String path) {
        this(path, false);
    }

    public NotADirectoryException(String path, boolean escapeAttempt) {
        super(path, escapeAttempt ? "not a directory (outside jail)" : "not a directory");
        this.escapeAttempt = escapeAttempt;
    }

    /**
     * @return true when the path was rejected because it climbs above the jail home
     */
    public boolean isEscapeAttempt() {
        return escapeAttempt;
    }
}
