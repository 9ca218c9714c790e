package org.starfield.align.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import org.starfield.align.client.output.AlignedFrameWriter;
import org.starfield.align.client.output.AlignmentReport;
import org.starfield.align.client.parameter.ArchiveParameters;
import org.starfield.align.client.parameter.CommandLineParameters;
import org.starfield.align.client.parameter.CropParameters;
import org.starfield.align.client.parameter.OutputParameters;
import org.starfield.align.client.parameter.TimeRangeParameters;
import org.starfield.align.client.source.ArchiveFrameSource;
import org.starfield.align.client.source.FrameSource;
import org.starfield.align.client.source.LocalFrameSource;
import org.starfield.align.client.source.TimeRange;
import org.starfield.alignment.pipeline.AlignmentFailedException;
import org.starfield.alignment.pipeline.AlignmentParameters;
import org.starfield.alignment.pipeline.AlignmentPipeline;
import org.starfield.alignment.pipeline.AlignmentResult;
import org.starfield.alignment.pipeline.CancellationToken;
import org.starfield.alignment.pipeline.FrameLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for aligning a time window of frames from a local directory or a remote archive
 * and writing the aligned (optionally stacked) frames with a JSON report.
 */
public class AlignFramesClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public AlignmentParameters alignment = new AlignmentParameters();

        @ParametersDelegate
        public TimeRangeParameters timeRange = new TimeRangeParameters();

        @ParametersDelegate
        public CropParameters crop = new CropParameters();

        @ParametersDelegate
        public ArchiveParameters archive = new ArchiveParameters();

        @ParametersDelegate
        public OutputParameters output = new OutputParameters();

        @Parameter(
                names = "--imageDirectory",
                description = "Directory of frames named like 2015-07-14_114957_UTC.jpg (instead of --archiveUrl)")
        public String imageDirectory;

        @Parameter(
                names = "--parametersJson",
                description = "JSON file with alignment parameters (explicit command line options take precedence)")
        public String parametersJson;

        /**
         * Loads alignment parameters from the --parametersJson file named in args (if any) so that
         * a subsequent {@link #parse} only overrides explicitly specified options.
         */
        public void loadParametersJson(final String[] args)
                throws IOException {
            for (int i = 0; i < args.length - 1; i++) {
                if ("--parametersJson".equals(args[i])) {
                    try (final Reader reader = Files.newBufferedReader(Paths.get(args[i + 1]),
                                                                       StandardCharsets.UTF_8)) {
                        alignment = AlignmentParameters.fromJson(reader);
                    }
                }
            }
        }

        public void validate()
                throws IllegalArgumentException {

            if ((imageDirectory == null) == (! archive.isDefined())) {
                throw new IllegalArgumentException("exactly one of --imageDirectory or --archiveUrl must be specified");
            }
            if (archive.isDefined()) {
                archive.validateAndSetDefaults();
            }
            output.validate();
            alignment.validateAndSetDefaults();
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.loadParametersJson(args);
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final AlignFramesClient client = new AlignFramesClient(parameters);
                client.run();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final CancellationToken cancellationToken;

    public AlignFramesClient(final Parameters parameters)
            throws IllegalArgumentException {
        parameters.validate();
        this.parameters = parameters;
        this.cancellationToken = new CancellationToken();
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    /**
     * Fetches, aligns, and writes the frames in the configured time window.
     *
     * @return result of the alignment.
     *
     * @throws IOException
     *   if the frames cannot be listed or the output cannot be written.
     * @throws AlignmentFailedException
     *   if the reference frame cannot be used.
     */
    public AlignmentResult run()
            throws IOException, AlignmentFailedException {

        final TimeRange range = parameters.timeRange.toTimeRange();

        final AlignmentResult result;
        try (final FrameSource source = buildSource()) {

            final List<FrameLoader> loaders = source.fetch(range);
            if (loaders.isEmpty()) {
                throw new IllegalArgumentException("no frames found within " + range);
            }

            final AlignmentPipeline pipeline = new AlignmentPipeline(parameters.alignment);
            result = pipeline.alignLoaders(loaders, parameters.crop.crop, cancellationToken);
        }

        final File outputDirectory = new File(parameters.output.outputDirectory).getAbsoluteFile();
        final AlignedFrameWriter writer = new AlignedFrameWriter(outputDirectory,
                                                                 parameters.output.outputFormat,
                                                                 parameters.output.jpegQuality,
                                                                 parameters.output.stackIntervalSeconds);
        final Map<Integer, File> frameIndexToFile = writer.write(result.getAlignedFrames());

        final File reportFile = new AlignmentReport(result, frameIndexToFile).save(outputDirectory);

        LOG.info("run: aligned {} frames, skipped {}, report written to {}",
                 result.getAlignedFrames().size(), result.getSkippedFrames().size(), reportFile);

        return result;
    }

    private FrameSource buildSource() {
        final FrameSource source;
        if (parameters.imageDirectory != null) {
            source = new LocalFrameSource(new File(parameters.imageDirectory).getAbsoluteFile());
        } else {
            source = new ArchiveFrameSource(parameters.archive);
        }
        return source;
    }

    private static final Logger LOG = LoggerFactory.getLogger(AlignFramesClient.class);
}
