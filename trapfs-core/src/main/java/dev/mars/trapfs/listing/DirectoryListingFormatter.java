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
import dev.mars.trapfs.core.exceptions.UncheckedFilesystemException;
import dev.mars.trapfs.stat.StatInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Renders directory entries the way {@code ls -lA} prints them, one CRLF terminated
 * line per entry:
 *
 * <pre>
 * -rw-r--r--   1 owner    group    7045120 Sep 02  2022 music.mp3
 * lrwxrwxrwx   1 owner    group          9 Mar 14 09:26 latest -> music.mp3
 * </pre>
 *
 * <p>Columns: mode string, link count right aligned in three columns, owner and group
 * left aligned in eight, then the size right aligned and always separated from the
 * group by at least one space. Timestamps are rendered in UTC: entries modified longer
 * ago than the recent window (180 days by default) show the year, all others, future
 * ones included, show the time of day.</p>
 *
 * <p>Entries are rendered in the order given; nothing is filtered or sorted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class DirectoryListingFormatter {
    private static final Logger logger = LoggerFactory.getLogger(DirectoryListingFormatter.class);

    public static final Duration DEFAULT_RECENT_WINDOW = Duration.ofDays(180);
    public static final String LINE_TERMINATOR = "\r\n";
    public static final String LINK_SEPARATOR = " -> ";

    private final Clock clock;
    private final Duration recentWindow;

    public DirectoryListingFormatter() {
        this(Clock.systemUTC(), DEFAULT_RECENT_WINDOW);
    }

    public DirectoryListingFormatter(Clock clock, Duration recentWindow) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.recentWindow = Objects.requireNonNull(recentWindow, "recentWindow");
        if (recentWindow.isNegative()) {
            throw new IllegalArgumentException("Recent window must not be negative: " + recentWindow);
        }
    }

    /**
     * Lazily formats one line per name. Metadata is read when the stream is consumed;
     * a failing entry surfaces as {@link UncheckedFilesystemException}.
     */
    public Stream<String> formatList(ListingSource source, String basedir, List<String> names) {
        Objects.requireNonNull(source, "source");
        return names.stream().map(name -> formatEntry(source, join(basedir, name), name));
    }

    /**
     * Eagerly renders the whole listing.
     *
     * @throws FilesystemException the first entry whose metadata or link target cannot be read
     */
    public String renderListing(ListingSource source, String basedir, List<String> names)
            throws FilesystemException {
        try (Stream<String> lines = formatList(source, basedir, names)) {
            return lines.collect(Collectors.joining());
        } catch (UncheckedFilesystemException e) {
            throw e.getCause();
        }
    }

    /**
     * @param linkTarget target appended after {@code " -> "} for symbolic links, ignored otherwise
     */
    public String formatLine(StatInfo stat, String name, String linkTarget) {
        StringBuilder line = new StringBuilder(64 + name.length());
        line.append(String.format(Locale.ROOT, "%s %3d %-8s %-8s %7d %s %s",
                stat.permissionString(), stat.nlink(), stat.owner(), stat.group(), stat.size(),
                formatTimestamp(stat.mtime()), name));
        if (stat.isSymbolicLink() && linkTarget != null) {
            line.append(LINK_SEPARATOR).append(linkTarget);
        }
        return line.append(LINE_TERMINATOR).toString();
    }

    String formatTimestamp(Instant mtime) {
        ZonedDateTime time = mtime.atZone(ZoneOffset.UTC);
        String month = MonthNames.abbreviation(time.getMonthValue());
        Duration age = Duration.between(mtime, clock.instant());
        if (age.compareTo(recentWindow) > 0) {
            return String.format(Locale.ROOT, "%s %02d  %d", month, time.getDayOfMonth(), time.getYear());
        }
        return String.format(Locale.ROOT, "%s %02d %02d:%02d", month, time.getDayOfMonth(),
                time.getHour(), time.getMinute());
    }

    private String formatEntry(ListingSource source, String path, String name) {
        try {
            StatInfo stat = source.stat(path);
            String target = stat.isSymbolicLink() ? source.readlink(path) : null;
            return formatLine(stat, name, target);
        } catch (FilesystemException e) {
            logger.debug("Cannot list entry {}: {}", path, e.getMessage());
            throw new UncheckedFilesystemException(e);
        }
    }

    private static String join(String basedir, String name) {
        if (basedir == null || basedir.isEmpty()) {
            return name;
        }
        return basedir.endsWith("/") ? basedir + name : basedir + "/" + name;
    }
}
