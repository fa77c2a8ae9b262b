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
 * Exception thrown when a jail or capture store operation fails.
 * Carries the jail-visible path the operation was invoked with, so the protocol
 * adapter can build a client-facing reply without re-parsing the message.
 *
 * <p>Subclasses name the failure kinds a protocol adapter is expected to
 * distinguish. Anything else (an unexpected {@link java.io.IOException} from the
 * backing store) surfaces as a plain {@code FilesystemException} with the I/O error
 * as its cause.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class FilesystemException extends TrapFsException {

    private final String path;

    public FilesystemException(String path, String message) {
        super(message);
        this.path = path;
    }

    public FilesystemException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }

    @Override
    public String getMessage() {
        return String.format("%s: %s", path, super.getMessage());
    }
}
