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

package dev.mars.trapfs.jail;

import dev.mars.trapfs.storage.StorePaths;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Canonicalization of session paths against a working directory.
 *
 * <p>Session paths are home-relative: {@code /} is the protocol home. Resolution is
 * purely lexical ({@code .} and {@code ..} are applied to the path string, symbolic
 * links are never consulted), and a path whose {@code ..} segments would climb above
 * home is reported as an escape instead of being clamped.</p>
 */
public final class JailPaths {

    public static final String HOME = "/";

    private JailPaths() {
    }

    /**
     * @param cwd  canonical working directory
     * @param path absolute (home-relative) or relative path; {@code null} or empty means {@code cwd}
     * @return the canonical home-relative path, or empty if it would leave home
     */
    public static Optional<String> resolve(String cwd, String path) {
        Deque<String> segments = new ArrayDeque<>();
        String input = path == null ? "" : path.replace('\\', '/');
        if (!input.startsWith("/")) {
            push(segments, cwd);
        }
        for (String segment : input.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (segments.isEmpty()) {
                    return Optional.empty();
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return Optional.of(segments.isEmpty() ? HOME : "/" + String.join("/", segments));
    }

    /**
     * Maps a canonical session path into the store subtree rooted at {@code home}.
     */
    public static String toStorePath(String home, String jailPath) {
        if (HOME.equals(jailPath)) {
            return home;
        }
        return StorePaths.ROOT.equals(home) ? jailPath : home + jailPath;
    }

    /**
     * Protocol names become a single directory under the jail root.
     *
     * @throws IllegalArgumentException for empty names, names with separators, {@code .} or {@code ..}
     */
    public static String validateProtocolName(String protocolName) {
        if (protocolName == null || protocolName.isBlank()
                || protocolName.indexOf('/') >= 0 || protocolName.indexOf('\\') >= 0
                || ".".equals(protocolName) || "..".equals(protocolName)) {
            throw new IllegalArgumentException("Invalid protocol name: " + protocolName);
        }
        return protocolName;
    }

    private static void push(Deque<String> segments, String canonical) {
        if (canonical == null) {
            return;
        }
        for (String segment : canonical.split("/")) {
            if (!segment.isEmpty()) {
                segments.addLast(segment);
            }
        }
    }
}
