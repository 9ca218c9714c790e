package org.starfield.align.client.output;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.starfield.alignment.json.JsonUtils;
import org.starfield.alignment.pipeline.AlignedFrame;
import org.starfield.alignment.pipeline.AlignmentResult;
import org.starfield.alignment.pipeline.SkippedFrame;
import org.starfield.alignment.transform.FrameTransform;

/**
 * JSON summary of an alignment run, written next to the aligned frames.
 */
public class AlignmentReport {

    public static final String REPORT_FILE_NAME = "alignment-report.json";

    public Integer referenceFrameIndex;
    public List<Aligned> aligned;
    public List<Skipped> skipped;
    public boolean cancelled;

    AlignmentReport() {
        this.aligned = new ArrayList<>();
        this.skipped = new ArrayList<>();
    }

    /**
     * @param  result            result of the run.
     * @param  frameIndexToFile  output file for each aligned frame (missing entries are allowed).
     */
    public AlignmentReport(final AlignmentResult result,
                           final Map<Integer, File> frameIndexToFile) {
        this();
        this.referenceFrameIndex = result.getReferenceFrameIndex();
        this.cancelled = result.isCancelled();
        for (final AlignedFrame alignedFrame : result.getAlignedFrames()) {
            final File file = frameIndexToFile.get(alignedFrame.getFrameIndex());
            aligned.add(new Aligned(alignedFrame, file == null ? null : file.getName()));
        }
        for (final SkippedFrame skippedFrame : result.getSkippedFrames()) {
            skipped.add(new Skipped(skippedFrame));
        }
    }

    public File save(final File outputDirectory)
            throws IOException {
        final File file = new File(outputDirectory, REPORT_FILE_NAME);
        try (final Writer writer = new FileWriter(file, StandardCharsets.UTF_8)) {
            JSON_HELPER.toJson(this, writer);
        }
        return file;
    }

    public static AlignmentReport fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    public static class Aligned {

        public int frameIndex;
        public String timestamp;
        public String modelType;
        public double[] matrix;
        public int inlierCount;
        public double rmsResidual;
        public String outputFile;

        Aligned() {
        }

        Aligned(final AlignedFrame alignedFrame,
                final String outputFile) {
            final FrameTransform transform = alignedFrame.getTransform();
            this.frameIndex = alignedFrame.getFrameIndex();
            this.timestamp = String.valueOf(alignedFrame.getTimestamp());
            this.modelType = String.valueOf(transform.getModelType());
            this.matrix = transform.getMatrix();
            this.inlierCount = transform.getInlierCount();
            this.rmsResidual = transform.getRmsResidual();
            this.outputFile = outputFile;
        }
    }

    public static class Skipped {

        public int frameIndex;
        public String timestamp;
        public String reason;
        public String message;

        Skipped() {
        }

        Skipped(final SkippedFrame skippedFrame) {
            this.frameIndex = skippedFrame.getFrameIndex();
            this.timestamp = String.valueOf(skippedFrame.getTimestamp());
            this.reason = String.valueOf(skippedFrame.getReason());
            this.message = skippedFrame.getMessage();
        }
    }

    private static final JsonUtils.Helper<AlignmentReport> JSON_HELPER =
            new JsonUtils.Helper<>(AlignmentReport.class);
}
