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

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.NotLinkException;

/**
 * Maps the {@code java.nio.file} exceptions spoken by the backing stores onto the
 * TrapFS taxonomy. The path reported is the jail-visible one, never the store path.
 * Messages never copy the cause's message, which names host paths; the cause itself is
 * kept for logging.
 */
public final class FilesystemExceptions {

    private FilesystemExceptions() {
    }

    public static FilesystemException translate(String path, IOException e) {
        if (e instanceof FileAlreadyExistsException) {
            return new AlreadyExistsException(path, e);
        }
        if (e instanceof NoSuchFileException) {
            return new NotFoundException(path, e);
        }
        if (e instanceof NotDirectoryException) {
            return new NotADirectoryException(path);
        }
        if (e instanceof NotLinkException) {
            return new NotASymlinkException(path);
        }
        if (e instanceof DirectoryNotEmptyException) {
            return new FilesystemException(path, "directory not empty", e);
        }
        if (e instanceof AccessDeniedException) {
            return new FilesystemException(path, "permission denied", e);
        }
        return new FilesystemException(path, "I/O error: " + reason(e), e);
    }

    private static String reason(IOException e) {
        if (e instanceof FileSystemException) {
            String reason = ((FileSystemException) e).getReason();
            if (reason != null && !reason.isBlank()) {
                return reason;
            }
        }
        return e.getClass().getSimpleName();
    }
}
