package org.starfield.align.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.time.Instant;
import java.time.format.DateTimeParseException;

import org.starfield.align.client.source.TimeRange;

/**
 * Parameters for specifying the acquisition time window of frames to be processed.
 */
public class TimeRangeParameters
        implements Serializable {

    @Parameter(
            names = "--minTime",
            description = "Earliest acquisition time (ISO-8601 UTC, e.g. 2015-07-10T00:00:00Z) of frames to process")
    public String minTime;

    @Parameter(
            names = "--maxTime",
            description = "Latest acquisition time (ISO-8601 UTC) of frames to process")
    public String maxTime;

    /**
     * @throws IllegalArgumentException
     *   if either time cannot be parsed or the window is empty.
     */
    public TimeRange toTimeRange()
            throws IllegalArgumentException {
        return new TimeRange(parse("minTime", minTime), parse("maxTime", maxTime));
    }

    private static Instant parse(final String name,
                                 final String value)
            throws IllegalArgumentException {
        Instant instant = null;
        if (value != null) {
            try {
                instant = Instant.parse(value);
            } catch (final DateTimeParseException e) {
                throw new IllegalArgumentException(name + " '" + value + "' is not an ISO-8601 UTC time", e);
            }
        }
        return instant;
    }

}
