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

package dev.mars.trapfs.capture;

import java.text.Normalizer;
import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns an attacker supplied upload name into a safe, timestamp prefixed store name:
 * {@code 2024-03-14 09:26:53 - my-evil-script-sh}.
 *
 * <p>The timestamp has second precision, so two uploads of the same name within one
 * second produce the same result. Callers that need distinct names use
 * {@link #sanitize(String, int)} with increasing attempt numbers.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class NameSanitizer {

    public static final String DEFAULT_TIMESTAMP_PATTERN = "yyyy-MM-dd HH:mm:ss";
    public static final String EMPTY_SLUG = "upload";
    /**
     * Longest slug produced. Leaves room under the common 255 byte file name limit for
     * the timestamp, a disambiguation counter and the receipt suffix.
     */
    public static final int MAX_SLUG_LENGTH = 200;

    private static final String SEPARATOR = " - ";
    private static final Pattern NON_ASCII = Pattern.compile("[^\\p{ASCII}]");
    private static final Pattern APOSTROPHES = Pattern.compile("'");
    private static final Pattern NON_SLUG = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");

    private final Clock clock;
    private final DateTimeFormatter formatter;

    public NameSanitizer() {
        this(Clock.systemDefaultZone(), ZoneId.systemDefault(), DEFAULT_TIMESTAMP_PATTERN);
    }

    public NameSanitizer(Clock clock, ZoneId zone, String timestampPattern) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.formatter = DateTimeFormatter.ofPattern(timestampPattern, Locale.ROOT)
                .withZone(Objects.requireNonNull(zone, "zone"));
    }

    public String sanitize(String name) {
        return formatter.format(clock.instant()) + SEPARATOR + slug(name);
    }

    /**
     * @param attempt 0 for the plain name, n for the n-th disambiguation
     */
    public String sanitize(String name, int attempt) {
        return disambiguate(sanitize(name), attempt);
    }

    /**
     * Appends {@code -<attempt>} to an already sanitized name. Attempt 0 leaves it unchanged.
     */
    public static String disambiguate(String sanitizedName, int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt must not be negative: " + attempt);
        }
        return attempt == 0 ? sanitizedName : sanitizedName + "-" + attempt;
    }

    /**
     * Lowercase ASCII slug: accents are stripped, apostrophes removed and every run of
     * other characters collapsed to a single dash. Slugs are cut to
     * {@link #MAX_SLUG_LENGTH} characters.
     */
    public static String slug(String name) {
        if (name == null) {
            return EMPTY_SLUG;
        }
        String value = Normalizer.normalize(name, Normalizer.Form.NFKD);
        value = NON_ASCII.matcher(value).replaceAll("");
        value = APOSTROPHES.matcher(value).replaceAll("");
        value = value.toLowerCase(Locale.ROOT);
        value = NON_SLUG.matcher(value).replaceAll("-");
        value = EDGE_DASHES.matcher(value).replaceAll("");
        if (value.length() > MAX_SLUG_LENGTH) {
            value = EDGE_DASHES.matcher(value.substring(0, MAX_SLUG_LENGTH)).replaceAll("");
        }
        return value.isEmpty() ? EMPTY_SLUG : value;
    }
}
