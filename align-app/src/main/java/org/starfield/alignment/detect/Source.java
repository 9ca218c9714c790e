package org.starfield.alignment.detect;

import java.io.Serializable;

/**
 * A detected point source (star) position with its brightness and footprint.
 */
public class Source
        implements Serializable {

    private final double x;
    private final double y;
    private final double brightness;
    private final int footprint;

    /**
     * @param  x           intensity weighted centroid x (pixel centers are at integer coordinates).
     * @param  y           intensity weighted centroid y.
     * @param  brightness  background subtracted intensity summed over the footprint.
     * @param  footprint   number of pixels in the source's connected region.
     */
    public Source(final double x,
                  final double y,
                  final double brightness,
                  final int footprint) {
        this.x = x;
        this.y = y;
        this.brightness = brightness;
        this.footprint = footprint;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getBrightness() {
        return brightness;
    }

    public int getFootprint() {
        return footprint;
    }

    public double distanceSquared(final double toX,
                                  final double toY) {
        final double dx = x - toX;
        final double dy = y - toY;
        return (dx * dx) + (dy * dy);
    }

    public double distance(final Source other) {
        return Math.sqrt(distanceSquared(other.x, other.y));
    }

    @Override
    public String toString() {
        return String.format("{\"x\": %.3f, \"y\": %.3f, \"brightness\": %.1f, \"footprint\": %d}",
                             x, y, brightness, footprint);
    }

}
