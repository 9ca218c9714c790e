package org.starfield.align.client.source;

import java.io.Serializable;
import java.time.Instant;

/**
 * Archive catalog entry for one frame.
 */
public class FrameMetadata
        implements Serializable {

    private final String url;
    private final long timestamp;
    private final String imagePath;
    private final String exposure;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private FrameMetadata() {
        this(null, 0, null, null);
    }

    /**
     * @param  url        full size image URL.
     * @param  timestamp  acquisition time in seconds since the epoch (UTC).
     * @param  imagePath  cached image path relative to the cache directory.
     * @param  exposure   exposure description as listed by the archive.
     */
    public FrameMetadata(final String url,
                         final long timestamp,
                         final String imagePath,
                         final String exposure) {
        this.url = url;
        this.timestamp = timestamp;
        this.imagePath = imagePath;
        this.exposure = exposure;
    }

    public String getUrl() {
        return url;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Instant getInstant() {
        return Instant.ofEpochSecond(timestamp);
    }

    public String getImagePath() {
        return imagePath;
    }

    public String getExposure() {
        return exposure;
    }

    @Override
    public String toString() {
        return imagePath + " (" + getInstant() + ")";
    }

}
