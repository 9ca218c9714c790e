package org.starfield.alignment.pipeline;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.Reader;
import java.io.Serializable;

import org.starfield.alignment.detect.DetectionParameters;
import org.starfield.alignment.json.JsonUtils;
import org.starfield.alignment.match.MatchingParameters;
import org.starfield.alignment.transform.EstimationParameters;

/**
 * All parameters for an alignment run.
 * Can be specified on the command line or loaded from JSON.
 */
public class AlignmentParameters
        implements Serializable {

    @ParametersDelegate
    public DetectionParameters detection = new DetectionParameters();

    @ParametersDelegate
    public MatchingParameters matching = new MatchingParameters();

    @ParametersDelegate
    public EstimationParameters estimation = new EstimationParameters();

    @Parameter(
            names = "--referenceIndex",
            description = "Position (in temporal order) of the frame used as the alignment reference"
    )
    public Integer referenceIndex;

    @Parameter(
            names = "--numberOfThreads",
            description = "Number of worker threads for registering frames"
    )
    public Integer numberOfThreads;

    @Parameter(
            names = "--frameTimeoutSeconds",
            description = "If specified, skip frames that take longer than this to register"
    )
    public Integer frameTimeoutSeconds;

    @Parameter(
            names = "--backgroundValue",
            description = "Intensity for aligned pixels that map outside of their source frame"
    )
    public Float backgroundValue;

    public AlignmentParameters() {
        setDefaults();
    }

    public void setDefaults() {
        if (referenceIndex == null) {
            referenceIndex = 0;
        }
        if (numberOfThreads == null) {
            numberOfThreads = 1;
        }
        if (backgroundValue == null) {
            backgroundValue = 0.0f;
        }
    }

    public void validateAndSetDefaults()
            throws IllegalArgumentException {

        if ((detection == null) || (matching == null) || (estimation == null)) {
            throw new IllegalArgumentException("detection, matching, and estimation parameters must be specified");
        }

        setDefaults();

        detection.validateAndSetDefaults("detection");
        matching.validateAndSetDefaults("matching");
        estimation.validateAndSetDefaults("estimation");

        if (referenceIndex < 0) {
            throw new IllegalArgumentException("referenceIndex must not be negative");
        }
        if (numberOfThreads < 1) {
            throw new IllegalArgumentException("numberOfThreads must be at least 1");
        }
        if ((frameTimeoutSeconds != null) && (frameTimeoutSeconds < 1)) {
            throw new IllegalArgumentException("frameTimeoutSeconds must be at least 1 when specified");
        }
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static AlignmentParameters fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<AlignmentParameters> JSON_HELPER =
            new JsonUtils.Helper<>(AlignmentParameters.class);

}
