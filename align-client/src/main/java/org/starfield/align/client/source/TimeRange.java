package org.starfield.align.client.source;

import java.io.Serializable;
import java.time.Instant;

/**
 * Inclusive acquisition time window.  A null bound leaves that side of the window open.
 */
public class TimeRange
        implements Serializable {

    private final Instant minTime;
    private final Instant maxTime;

    /**
     * @throws IllegalArgumentException
     *   if both bounds are specified and minTime is after maxTime.
     */
    public TimeRange(final Instant minTime,
                     final Instant maxTime)
            throws IllegalArgumentException {
        if ((minTime != null) && (maxTime != null) && minTime.isAfter(maxTime)) {
            throw new IllegalArgumentException("minTime " + minTime + " is after maxTime " + maxTime);
        }
        this.minTime = minTime;
        this.maxTime = maxTime;
    }

    public static TimeRange all() {
        return new TimeRange(null, null);
    }

    public Instant getMinTime() {
        return minTime;
    }

    public Instant getMaxTime() {
        return maxTime;
    }

    public boolean contains(final Instant time) {
        return (time != null) &&
               ((minTime == null) || (! time.isBefore(minTime))) &&
               ((maxTime == null) || (! time.isAfter(maxTime)));
    }

    @Override
    public String toString() {
        return "[" + (minTime == null ? "*" : minTime) + ", " + (maxTime == null ? "*" : maxTime) + "]";
    }

}
