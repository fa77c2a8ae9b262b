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

package dev.mars.trapfs.storage;

import java.nio.file.NoSuchFileException;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Helpers for the absolute, slash separated paths used to address backing store
 * entries ({@code "/"}, {@code "/ftp"}, {@code "/ftp/pub/readme.txt"}).
 */
public final class StorePaths {

    public static final String ROOT = "/";

    private StorePaths() {
    }

    /**
     * Normalizes a store path: backslashes become slashes, empty and {@code .}
     * segments are dropped and {@code ..} pops a segment.
     *
     * @throws NoSuchFileException if a {@code ..} segment would climb above the store root
     */
    public static String normalize(String path) throws NoSuchFileException {
        if (path == null || path.isEmpty()) {
            return ROOT;
        }
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (segments.isEmpty()) {
                    throw new NoSuchFileException(path, null, "path leaves the store root");
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return segments.isEmpty() ? ROOT : "/" + String.join("/", segments);
    }

    public static String join(String directory, String name) {
        if (ROOT.equals(directory)) {
            return ROOT + name;
        }
        return directory + "/" + name;
    }

    /**
     * @return the parent of a normalized path, or {@code null} for the root
     */
    public static String parent(String normalizedPath) {
        if (ROOT.equals(normalizedPath)) {
            return null;
        }
        int slash = normalizedPath.lastIndexOf('/');
        return slash == 0 ? ROOT : normalizedPath.substring(0, slash);
    }

    public static String name(String normalizedPath) {
        if (ROOT.equals(normalizedPath)) {
            return "";
        }
        return normalizedPath.substring(normalizedPath.lastIndexOf('/') + 1);
    }

    public static boolean isAncestorOrSelf(String ancestor, String path) {
        if (ROOT.equals(ancestor)) {
            return true;
        }
        return path.equals(ancestor) || path.startsWith(ancestor + "/");
    }
}
