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
 * Thrown when a protocol command has no jail operation behind it, or when the
 * backing store cannot carry out an operation (for example POSIX modes on a
 * non-POSIX host filesystem).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class OperationNotImplementedException extends FilesystemException {

    private final String operation;

    public OperationNotImplementedException(String path, String operation) {
        super(path, "operation not implemented: " + operation);
        this.operation = operation;
    }

    public OperationNotImplementedException(String path, String operation, Throwable cause) {
        super(path, "operation not implemented: " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
