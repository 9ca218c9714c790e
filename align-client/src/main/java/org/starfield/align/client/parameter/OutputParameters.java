package org.starfield.align.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

/**
 * Parameters for writing aligned (or stacked) frames.
 */
public class OutputParameters
        implements Serializable {

    private static final List<String> SUPPORTED_FORMATS = Arrays.asList("png", "jpg", "tif");

    @Parameter(
            names = "--outputDirectory",
            description = "Directory for aligned frames and the alignment report",
            required = true)
    public String outputDirectory;

    @Parameter(
            names = "--outputFormat",
            description = "Format for aligned frames (png, jpg or tif)")
    public String outputFormat = "png";

    @Parameter(
            names = "--jpegQuality",
            description = "Compression quality for jpg output")
    public Float jpegQuality = 0.85f;

    @Parameter(
            names = "--stackIntervalSeconds",
            description = "If specified, average consecutive aligned frames that are less than this many seconds " +
                          "apart and write one stacked frame per group")
    public Long stackIntervalSeconds;

    public void validate()
            throws IllegalArgumentException {
        if (! SUPPORTED_FORMATS.contains(outputFormat)) {
            throw new IllegalArgumentException("outputFormat must be one of " + SUPPORTED_FORMATS);
        }
        if ((jpegQuality < 0) || (jpegQuality > 1)) {
            throw new IllegalArgumentException("jpegQuality must be between 0 and 1");
        }
        if ((stackIntervalSeconds != null) && (stackIntervalSeconds < 1)) {
            throw new IllegalArgumentException("stackIntervalSeconds must be at least 1 when specified");
        }
    }

}
