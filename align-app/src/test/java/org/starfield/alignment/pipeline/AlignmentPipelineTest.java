package org.starfield.alignment.pipeline;

import java.awt.Rectangle;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.starfield.alignment.FailureReason;
import org.starfield.alignment.FetchFailureException;
import org.starfield.alignment.SyntheticStarField;
import org.starfield.alignment.detect.DetectionParameters;
import org.starfield.alignment.detect.SourceDetector;
import org.starfield.alignment.detect.SourceSet;
import org.starfield.alignment.image.Frame;

/**
 * Tests the {@link AlignmentPipeline} class.
 */
public class AlignmentPipelineTest {

    @Test
    public void testAlignRotatedFrames() {

        final double[] rotationDegrees = { 0.0, 5.0, 12.0 };
        final List<Frame> frames = new ArrayList<>();
        for (int i = 0; i < rotationDegrees.length; i++) {
            frames.add(renderRotated(rotationDegrees[i], i));
        }

        final AlignmentPipeline pipeline = new AlignmentPipeline(new AlignmentParameters());
        final AlignmentResult result = pipeline.align(frames, null);

        Assert.assertEquals("invalid state", AlignmentState.DONE, pipeline.getState());
        Assert.assertEquals("invalid reference frame index", 0, result.getReferenceFrameIndex());
        Assert.assertEquals("invalid number of aligned frames", 3, result.getAlignedFrames().size());
        Assert.assertFalse("no frames should be skipped", result.hasSkippedFrames());
        Assert.assertFalse("run should not be cancelled", result.isCancelled());

        Assert.assertTrue("reference transform should be identity",
                          result.getAlignedFrames().get(0).getTransform().isIdentity());

        final SourceDetector detector = new SourceDetector(new DetectionParameters());
        for (int i = 0; i < rotationDegrees.length; i++) {

            final AlignedFrame alignedFrame = result.getAlignedFrames().get(i);
            Assert.assertEquals("aligned frames out of order", i, alignedFrame.getFrameIndex());
            Assert.assertEquals("invalid rotation for frame " + i,
                                -Math.toRadians(rotationDegrees[i]), alignedFrame.getTransform().getRotation(), 0.005);

            final Frame image = alignedFrame.getImage();
            Assert.assertEquals("invalid width for frame " + i, SyntheticStarField.WIDTH, image.getWidth());
            Assert.assertEquals("invalid height for frame " + i, SyntheticStarField.HEIGHT, image.getHeight());

            final SourceSet alignedSources = detector.detect(image, i);
            for (final double[] star : SyntheticStarField.STARS) {
                Assert.assertTrue("star " + Arrays.toString(star) + " is not aligned in frame " + i,
                                  SyntheticStarField.distanceToClosest(alignedSources, star[0], star[1]) < 1.0);
            }
        }
    }

    @Test
    public void testFrameWithoutStarsIsSkipped() {

        final List<Frame> frames = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            if (i == 1) {
                frames.add(Frame.filled(SyntheticStarField.WIDTH, SyntheticStarField.HEIGHT, 1, 10.0f,
                                        SyntheticStarField.timestamp(i)));
            } else {
                frames.add(renderRotated(i * 2.0, i));
            }
        }

        final AlignmentResult result = new AlignmentPipeline(new AlignmentParameters()).align(frames, null);

        Assert.assertEquals("invalid number of aligned frames", 4, result.getAlignedFrames().size());
        Assert.assertEquals("invalid number of skipped frames", 1, result.getSkippedFrames().size());

        final SkippedFrame skippedFrame = result.getSkippedFrames().get(0);
        Assert.assertEquals("invalid skipped frame index", 1, skippedFrame.getFrameIndex());
        Assert.assertEquals("invalid skip reason", FailureReason.EMPTY_DETECTION, skippedFrame.getReason());
        Assert.assertEquals("invalid skipped timestamp", SyntheticStarField.timestamp(1), skippedFrame.getTimestamp());

        final int[] expectedAlignedIndexes = { 0, 2, 3, 4 };
        for (int i = 0; i < expectedAlignedIndexes.length; i++) {
            Assert.assertEquals("invalid aligned frame order",
                                expectedAlignedIndexes[i], result.getAlignedFrames().get(i).getFrameIndex());
        }
    }

    @Test
    public void testReferenceWithoutStarsFailsRun() {

        final List<Frame> frames = Arrays.asList(Frame.filled(SyntheticStarField.WIDTH, SyntheticStarField.HEIGHT,
                                                              1, 10.0f, SyntheticStarField.timestamp(0)),
                                                 renderRotated(3.0, 1));

        final AlignmentPipeline pipeline = new AlignmentPipeline(new AlignmentParameters());
        try {
            pipeline.align(frames, null);
            Assert.fail("run should fail when reference frame has no stars");
        } catch (final AlignmentFailedException e) {
            Assert.assertEquals("invalid failed frame index", 0, e.getFrameIndex());
            Assert.assertEquals("invalid failure reason", FailureReason.EMPTY_DETECTION, e.getReason());
        }

        Assert.assertEquals("invalid state", AlignmentState.FAILED, pipeline.getState());
        Assert.assertEquals("invalid failed frame index", Integer.valueOf(0), pipeline.getFailedFrameIndex());
        Assert.assertEquals("invalid failure reason", FailureReason.EMPTY_DETECTION, pipeline.getFailureReason());
    }

    @Test
    public void testReferenceIndexSelectsTemporalPosition() {

        final List<Frame> frames = Arrays.asList(renderRotated(4.0, 2),
                                                 renderRotated(0.0, 0),
                                                 renderRotated(2.0, 1));

        final AlignmentParameters parameters = new AlignmentParameters();
        parameters.referenceIndex = 1;
        final AlignmentResult result = new AlignmentPipeline(parameters).align(frames, null);

        Assert.assertEquals("reference should be the second frame in time", 2, result.getReferenceFrameIndex());
        Assert.assertFalse("no frames should be skipped", result.hasSkippedFrames());

        final int[] expectedOrder = { 1, 2, 0 };
        for (int i = 0; i < expectedOrder.length; i++) {
            final AlignedFrame alignedFrame = result.getAlignedFrames().get(i);
            Assert.assertEquals("aligned frames should be in temporal order",
                                expectedOrder[i], alignedFrame.getFrameIndex());
            Assert.assertEquals("invalid timestamp", SyntheticStarField.timestamp(i), alignedFrame.getTimestamp());
        }

        Assert.assertEquals("invalid rotation for earliest frame",
                            Math.toRadians(2.0), result.getAlignedFrames().get(0).getTransform().getRotation(), 0.005);
    }

    @Test
    public void testFetchFailureIsSkipped() {

        final List<FrameLoader> loaders = new ArrayList<>();
        loaders.add(FrameLoader.of(renderRotated(0.0, 0)));
        loaders.add(new FailingLoader(SyntheticStarField.timestamp(1), new FetchFailureException("archive offline")));
        loaders.add(FrameLoader.of(renderRotated(3.0, 2)));

        final AlignmentResult result = new AlignmentPipeline(new AlignmentParameters())
                .alignLoaders(loaders, null, new CancellationToken());

        Assert.assertEquals("invalid number of aligned frames", 2, result.getAlignedFrames().size());
        Assert.assertEquals("invalid number of skipped frames", 1, result.getSkippedFrames().size());
        Assert.assertEquals("invalid skip reason", FailureReason.FETCH_FAILURE,
                            result.getSkippedFrames().get(0).getReason());
        Assert.assertEquals("invalid skip message", "archive offline", result.getSkippedFrames().get(0).getMessage());
    }

    @Test
    public void testUnexpectedFailureIsSkipped() {

        final List<FrameLoader> loaders = new ArrayList<>();
        loaders.add(FrameLoader.of(renderRotated(0.0, 0)));
        loaders.add(new FailingLoader(SyntheticStarField.timestamp(1), new IllegalStateException("corrupt frame")));

        final AlignmentResult result = new AlignmentPipeline(new AlignmentParameters())
                .alignLoaders(loaders, null, new CancellationToken());

        Assert.assertEquals("invalid number of skipped frames", 1, result.getSkippedFrames().size());
        Assert.assertEquals("invalid skip reason", FailureReason.UNEXPECTED,
                            result.getSkippedFrames().get(0).getReason());
    }

    @Test
    public void testReferenceFetchFailureFailsRun() {

        final List<FrameLoader> loaders = new ArrayList<>();
        loaders.add(new FailingLoader(SyntheticStarField.timestamp(0), new FetchFailureException("missing")));
        loaders.add(FrameLoader.of(renderRotated(3.0, 1)));

        final AlignmentPipeline pipeline = new AlignmentPipeline(new AlignmentParameters());
        try {
            pipeline.alignLoaders(loaders, null, new CancellationToken());
            Assert.fail("run should fail when reference frame cannot be loaded");
        } catch (final AlignmentFailedException e) {
            Assert.assertEquals("invalid failure reason", FailureReason.FETCH_FAILURE, e.getReason());
        }
        Assert.assertEquals("invalid state", AlignmentState.FAILED, pipeline.getState());
    }

    @Test
    public void testCancelledRunSkipsRemainingFrames() {

        final List<Frame> frames = Arrays.asList(renderRotated(0.0, 0),
                                                 renderRotated(2.0, 1),
                                                 renderRotated(4.0, 2));

        final CancellationToken cancellationToken = new CancellationToken();
        cancellationToken.cancel();

        final AlignmentResult result = new AlignmentPipeline(new AlignmentParameters())
                .alignLoaders(toLoaders(frames), null, cancellationToken);

        Assert.assertTrue("result should be marked cancelled", result.isCancelled());
        Assert.assertEquals("only reference should be aligned", 1, result.getAlignedFrames().size());
        Assert.assertEquals("invalid number of skipped frames", 2, result.getSkippedFrames().size());
        for (final SkippedFrame skippedFrame : result.getSkippedFrames()) {
            Assert.assertEquals("invalid skip reason", FailureReason.CANCELLED, skippedFrame.getReason());
        }
    }

    @Test
    public void testSlowFrameTimesOut() {

        final List<FrameLoader> loaders = new ArrayList<>();
        loaders.add(FrameLoader.of(renderRotated(0.0, 0)));
        loaders.add(new FrameLoader() {
            @Override
            public Instant getTimestamp() {
                return SyntheticStarField.timestamp(1);
            }

            @Override
            public Frame load() throws FetchFailureException {
                try {
                    Thread.sleep(10000);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new FetchFailureException("interrupted while loading", e);
                }
                return renderRotated(1.0, 1);
            }
        });
        loaders.add(FrameLoader.of(renderRotated(2.0, 2)));

        final AlignmentParameters parameters = new AlignmentParameters();
        parameters.numberOfThreads = 2;
        parameters.frameTimeoutSeconds = 1;

        final AlignmentResult result = new AlignmentPipeline(parameters)
                .alignLoaders(loaders, null, new CancellationToken());

        Assert.assertEquals("invalid number of aligned frames", 2, result.getAlignedFrames().size());
        Assert.assertEquals("invalid number of skipped frames", 1, result.getSkippedFrames().size());
        Assert.assertEquals("invalid skip reason", FailureReason.TIMEOUT, result.getSkippedFrames().get(0).getReason());
    }

    @Test
    public void testQueuedFrameIsNotTimedOutBehindSlowFrame() {

        final List<FrameLoader> loaders = new ArrayList<>();
        loaders.add(FrameLoader.of(renderRotated(0.0, 0)));
        loaders.add(new FrameLoader() {
            @Override
            public Instant getTimestamp() {
                return SyntheticStarField.timestamp(1);
            }

            @Override
            public Frame load() {
                // keeps the only worker busy regardless of interrupts
                final long stopTime = System.currentTimeMillis() + 3000;
                while (System.currentTimeMillis() < stopTime) {
                    Thread.onSpinWait();
                }
                return renderRotated(1.0, 1);
            }
        });
        loaders.add(FrameLoader.of(renderRotated(2.0, 2)));

        final AlignmentParameters parameters = new AlignmentParameters();
        parameters.numberOfThreads = 1;
        parameters.frameTimeoutSeconds = 1;

        final AlignmentResult result = new AlignmentPipeline(parameters)
                .alignLoaders(loaders, null, new CancellationToken());

        Assert.assertEquals("invalid number of aligned frames", 2, result.getAlignedFrames().size());
        Assert.assertEquals("invalid first aligned frame", 0, result.getAlignedFrames().get(0).getFrameIndex());
        Assert.assertEquals("queued frame should be aligned", 2, result.getAlignedFrames().get(1).getFrameIndex());
        Assert.assertEquals("invalid number of skipped frames", 1, result.getSkippedFrames().size());

        final SkippedFrame skippedFrame = result.getSkippedFrames().get(0);
        Assert.assertEquals("invalid skipped frame", 1, skippedFrame.getFrameIndex());
        Assert.assertEquals("invalid skip reason", FailureReason.TIMEOUT, skippedFrame.getReason());
    }

    @Test
    public void testParallelMatchesSequential() {

        final List<Frame> frames = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            frames.add(renderRotated(i * 1.5, i));
        }

        final AlignmentResult sequential = new AlignmentPipeline(new AlignmentParameters()).align(frames, null);

        final AlignmentParameters parallelParameters = new AlignmentParameters();
        parallelParameters.numberOfThreads = 4;
        final AlignmentResult parallel = new AlignmentPipeline(parallelParameters).align(frames, null);

        Assert.assertEquals("aligned frame counts differ",
                            sequential.getAlignedFrames().size(), parallel.getAlignedFrames().size());
        for (int i = 0; i < sequential.getAlignedFrames().size(); i++) {
            final AlignedFrame expected = sequential.getAlignedFrames().get(i);
            final AlignedFrame actual = parallel.getAlignedFrames().get(i);
            Assert.assertEquals("frame order differs", expected.getFrameIndex(), actual.getFrameIndex());
            Assert.assertArrayEquals("transforms differ for frame " + i,
                                     expected.getTransform().getMatrix(), actual.getTransform().getMatrix(), 0.0);
            Assert.assertArrayEquals("pixels differ for frame " + i,
                                     expected.getImage().getChannelPixels(0), actual.getImage().getChannelPixels(0),
                                     0.0f);
        }
    }

    @Test
    public void testCrop() {

        final List<Frame> frames = Arrays.asList(renderRotated(0.0, 0), renderRotated(5.0, 1));
        final Rectangle crop = new Rectangle(20, 20, 160, 160);

        final AlignmentResult result = new AlignmentPipeline(new AlignmentParameters()).align(frames, crop);

        Assert.assertEquals("invalid number of aligned frames", 2, result.getAlignedFrames().size());
        for (final AlignedFrame alignedFrame : result.getAlignedFrames()) {
            Assert.assertEquals("invalid width", 160, alignedFrame.getImage().getWidth());
            Assert.assertEquals("invalid height", 160, alignedFrame.getImage().getHeight());
        }
        Assert.assertEquals("invalid rotation", -Math.toRadians(5.0),
                            result.getAlignedFrames().get(1).getTransform().getRotation(), 0.005);
    }

    @Test
    public void testCropOutsideReferenceFailsRun() {

        final List<Frame> frames = Arrays.asList(renderRotated(0.0, 0), renderRotated(5.0, 1));
        final AlignmentPipeline pipeline = new AlignmentPipeline(new AlignmentParameters());
        try {
            pipeline.align(frames, new Rectangle(150, 150, 100, 100));
            Assert.fail("run should fail for crop outside of reference frame");
        } catch (final AlignmentFailedException e) {
            Assert.assertEquals("invalid failure reason", FailureReason.FETCH_FAILURE, e.getReason());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoFrames() {
        new AlignmentPipeline(new AlignmentParameters()).align(new ArrayList<>(), null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReferenceIndexOutOfRange() {
        final AlignmentParameters parameters = new AlignmentParameters();
        parameters.referenceIndex = 2;
        new AlignmentPipeline(parameters).align(Arrays.asList(renderRotated(0.0, 0), renderRotated(1.0, 1)), null);
    }

    @Test
    public void testPipelineCanBeReused() {

        final AlignmentPipeline pipeline = new AlignmentPipeline(new AlignmentParameters());
        try {
            pipeline.align(Arrays.asList(Frame.filled(50, 50, 1, 1.0f, SyntheticStarField.timestamp(0)),
                                         renderRotated(1.0, 1)), null);
            Assert.fail("first run should fail");
        } catch (final AlignmentFailedException e) {
            Assert.assertEquals("invalid state after failure", AlignmentState.FAILED, pipeline.getState());
        }

        pipeline.align(Arrays.asList(renderRotated(0.0, 0), renderRotated(1.0, 1)), null);

        Assert.assertEquals("invalid state after success", AlignmentState.DONE, pipeline.getState());
        Assert.assertNull("failure reason should be cleared", pipeline.getFailureReason());
    }

    private static Frame renderRotated(final double degrees,
                                       final int frameNumber) {
        return SyntheticStarField.render(SyntheticStarField.rotate(SyntheticStarField.STARS, degrees),
                                         SyntheticStarField.timestamp(frameNumber));
    }

    private static List<FrameLoader> toLoaders(final List<Frame> frames) {
        final List<FrameLoader> loaders = new ArrayList<>();
        for (final Frame frame : frames) {
            loaders.add(FrameLoader.of(frame));
        }
        return loaders;
    }

    private static class FailingLoader
            implements FrameLoader {

        private final Instant timestamp;
        private final Exception failure;

        FailingLoader(final Instant timestamp,
                      final Exception failure) {
            this.timestamp = timestamp;
            this.failure = failure;
        }

        @Override
        public Instant getTimestamp() {
            return timestamp;
        }

        @Override
        public Frame load() throws FetchFailureException {
            if (failure instanceof FetchFailureException) {
                throw (FetchFailureException) failure;
            }
            throw (RuntimeException) failure;
        }
    }

}
