package org.starfield.alignment.match;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for pairing candidate frame sources with reference frame sources.
 */
public class MatchingParameters
        implements Serializable {

    public MatchingParameters() {
        setDefaults();
    }

    @Parameter(
            names = "--matchSearchRadius",
            description = "Maximum distance in pixels between a candidate source and its reference source"
    )
    public Double searchRadius;

    public void setDefaults() {
        if (searchRadius == null) {
            searchRadius = 20.0;
        }
    }

    public void validateAndSetDefaults(final String context)
            throws IllegalArgumentException {
        setDefaults();
        if (searchRadius <= 0) {
            throw new IllegalArgumentException(context + " searchRadius must be positive");
        }
    }

}
