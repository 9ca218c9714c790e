package org.starfield.align.client.source;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps acquisition times to and from frame file names like 2015-07-14_114957_UTC.jpg.
 */
public class FrameFileNames {

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd_HHmmss").withZone(ZoneOffset.UTC);

    private static final Pattern NAME_PATTERN =
            Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}_\\d{6})_UTC\\.([A-Za-z0-9]+)$");

    private FrameFileNames() {
    }

    public static String getName(final Instant timestamp,
                                 final String extension) {
        return FORMATTER.format(timestamp) + "_UTC." + extension;
    }

    /**
     * @return the acquisition time encoded in the specified name or null if the name does not follow the convention.
     */
    public static Instant parseTimestamp(final String name) {
        Instant timestamp = null;
        final Matcher m = NAME_PATTERN.matcher(name);
        if (m.matches()) {
            try {
                timestamp = LocalDateTime.parse(m.group(1), FORMATTER).toInstant(ZoneOffset.UTC);
            } catch (final DateTimeParseException e) {
                timestamp = null;
            }
        }
        return timestamp;
    }

}
