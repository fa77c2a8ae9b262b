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

package dev.mars.trapfs.listing;

import dev.mars.trapfs.core.exceptions.FilesystemException;
import dev.mars.trapfs.stat.StatInfo;

/**
 * Where a listing gets its per-entry metadata from. Paths are the ones the
 * session sees, built by joining the listed directory and an entry name.
 */
public interface ListingSource {

    StatInfo stat(String path) throws FilesystemException;

    String readlink(String path) throws FilesystemException;
}
