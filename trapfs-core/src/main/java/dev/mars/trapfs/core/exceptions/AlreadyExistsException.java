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
 * Thrown when an exclusive create collides with an existing entry: a protocol jail
 * subtree that is already initialized, or a capture name already present in the
 * persistent store.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class AlreadyExistsException extends FilesystemException {

    public AlreadyExistsException(String path) {
        super(path, "already exists");
    }

    public AlreadyExistsException(String path, Throwable cause) {
        super(path, "already exists", cause);
    }
}
