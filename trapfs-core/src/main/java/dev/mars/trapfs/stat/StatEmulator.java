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

import dev.mars.trapfs.core.exceptions.FilesystemException;
import dev.mars.trapfs.core.exceptions.FilesystemExceptions;
import dev.mars.trapfs.storage.BackingStore;
import dev.mars.trapfs.storage.StoreMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Builds {@link StatInfo} values and resolves symbolic links from backing store metadata.
 *
 * <p>Links are never followed. Every call reads the store afresh; nothing is cached.
 * Store paths are given together with the path the caller should see in error messages,
 * so store layout never leaks into a session.</p>
 */
public class StatEmulator {
    private static final Logger logger = LoggerFactory.getLogger(StatEmulator.class);

    private final BackingStore store;
    private final String owner;
    private final String group;

    public StatEmulator(BackingStore store, String owner, String group) {
        this.store = Objects.requireNonNull(store, "store");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.group = Objects.requireNonNull(group, "group");
    }

    /**
     * @throws dev.mars.trapfs.core.exceptions.NotFoundException if nothing exists at the path
     */
    public StatInfo stat(String storePath, String displayPath) throws FilesystemException {
        try {
            StoreMetadata metadata = store.metadata(storePath);
            logger.debug("stat {} -> mode {}", displayPath, Integer.toOctalString(metadata.mode()));
            return new StatInfo(metadata.mode(), metadata.linkCount(), metadata.size(),
                    metadata.modified(), owner, group);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(displayPath, e);
        }
    }

    /**
     * @return the link target exactly as stored
     * @throws dev.mars.trapfs.core.exceptions.NotASymlinkException if the entry is not a link
     * @throws dev.mars.trapfs.core.exceptions.NotFoundException if nothing exists at the path
     */
    public String readlink(String storePath, String displayPath) throws FilesystemException {
        try {
            return store.readLink(storePath);
        } catch (IOException e) {
            throw FilesystemExceptions.translate(displayPath, e);
        }
    }

    public String getOwner() {
        return owner;
    }

    public String getGroup() {
        return group;
    }
}
