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

import java.util.Objects;

/**
 * Wraps a {@link FilesystemException} raised inside a lazily evaluated stream, such as
 * a directory listing that is rendered line by line.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class UncheckedFilesystemException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UncheckedFilesystemException(FilesystemException cause) {
        super(Objects.requireNonNull(cause).getMessage(), cause);
    }

    @Override
    public synchronized FilesystemException getCause() {
        return (FilesystemException) super.getCause();
    }
}
