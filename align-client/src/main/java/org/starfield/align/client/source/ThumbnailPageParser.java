package org.starfield.align.client.source;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts frame metadata from archive thumbnail index pages.
 *
 * Each page lists its thumbnails in one line of JavaScript (starting with StatusArr.push) containing
 * semicolon separated commands like:
 * <pre>
 *     thumbArr.push("data/thumbnails/lor_0299017139_0x630_sci.jpg");
 *     UTCArr.push("2015-07-10&lt;br&gt;06:09:39 UTC");
 *     ExpArr.push("150 msec");
 * </pre>
 * An ExpArr command completes the entry started by the preceding commands.
 */
public class ThumbnailPageParser {

    static final String ENTRY_LINE_PREFIX = "StatusArr.push";

    private static final DateTimeFormatter TIMESTAMP_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'<br>'HH:mm:ss 'UTC'");

    private static final String DEFAULT_IMAGE_EXTENSION = "jpg";

    private final String archiveUrl;

    /**
     * @param  archiveUrl  base URL (with trailing slash) that image paths are relative to.
     */
    public ThumbnailPageParser(final String archiveUrl) {
        this.archiveUrl = archiveUrl;
    }

    /**
     * @return entries listed on the page (newest first, as listed) or null if the page has no entry line
     *         (the archive serves such pages for page numbers beyond the last page).
     *
     * @throws IllegalArgumentException
     *   if the entry line contains an invalid timestamp.
     */
    public List<FrameMetadata> parsePage(final String pageText)
            throws IllegalArgumentException {

        List<FrameMetadata> entries = null;
        try (final BufferedReader reader = new BufferedReader(new StringReader(pageText))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith(ENTRY_LINE_PREFIX)) {
                    entries = parseLine(line);
                    break;
                }
            }
        } catch (final IOException e) {
            throw new IllegalStateException("failed to read page text", e);
        }

        return entries;
    }

    List<FrameMetadata> parseLine(final String line)
            throws IllegalArgumentException {

        final List<FrameMetadata> entries = new ArrayList<>();

        String url = null;
        Instant timestamp = null;

        for (final String command : line.split(";")) {
            final String trimmedCommand = command.trim();
            if (trimmedCommand.startsWith("thumbArr.push")) {
                url = archiveUrl + quotedValue(trimmedCommand).replace("thumbnails/", "");
            } else if (trimmedCommand.startsWith("UTCArr.push")) {
                timestamp = parseTimestamp(quotedValue(trimmedCommand));
            } else if (trimmedCommand.startsWith("ExpArr.push")) {
                if ((url != null) && (timestamp != null)) {
                    entries.add(new FrameMetadata(url,
                                                  timestamp.getEpochSecond(),
                                                  FrameFileNames.getName(timestamp, getExtension(url)),
                                                  quotedValue(trimmedCommand)));
                }
                url = null;
                timestamp = null;
            }
        }

        return entries;
    }

    static Instant parseTimestamp(final String value)
            throws IllegalArgumentException {
        try {
            return LocalDateTime.parse(value, TIMESTAMP_FORMATTER).toInstant(ZoneOffset.UTC);
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException("invalid thumbnail timestamp '" + value + "'", e);
        }
    }

    private static String getExtension(final String url) {
        final int lastDot = url.lastIndexOf('.');
        final int lastSlash = url.lastIndexOf('/');
        return (lastDot > lastSlash) && (lastDot < url.length() - 1) ?
               url.substring(lastDot + 1).toLowerCase() : DEFAULT_IMAGE_EXTENSION;
    }

    private static String quotedValue(final String command) {
        final int start = command.indexOf('"');
        final int stop = command.indexOf('"', start + 1);
        return ((start >= 0) && (stop > start)) ? command.substring(start + 1, stop) : "";
    }

}
