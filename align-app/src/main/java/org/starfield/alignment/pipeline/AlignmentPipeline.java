package org.starfield.alignment.pipeline;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import org.starfield.alignment.EmptyDetectionException;
import org.starfield.alignment.FailureReason;
import org.starfield.alignment.FetchFailureException;
import org.starfield.alignment.RegistrationException;
import org.starfield.alignment.detect.SourceDetector;
import org.starfield.alignment.detect.SourceSet;
import org.starfield.alignment.image.Frame;
import org.starfield.alignment.match.Correspondence;
import org.starfield.alignment.match.CorrespondenceMatcher;
import org.starfield.alignment.transform.FrameTransform;
import org.starfield.alignment.transform.TransformEstimator;
import org.starfield.alignment.util.ProcessTimer;
import org.starfield.alignment.warp.FrameResampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns a sequence of frames so that their star fields match a reference frame's star field.
 *
 * The reference frame is loaded and its sources detected on the calling thread.
 * Every other frame is then registered independently on a worker pool
 * (load, crop, detect, match against the reference sources, estimate, warp) and the results are merged
 * back into temporal order.
 * Frames that fail to register are skipped and reported, only a reference failure aborts the run.
 *
 * Runs on one pipeline instance are serialized.
 */
public class AlignmentPipeline {

    private final AlignmentParameters parameters;
    private final SourceDetector detector;
    private final CorrespondenceMatcher matcher;
    private final TransformEstimator estimator;
    private final FrameResampler resampler;

    private volatile AlignmentState state;
    private volatile Integer failedFrameIndex;
    private volatile FailureReason failureReason;

    public AlignmentPipeline(final AlignmentParameters parameters)
            throws IllegalArgumentException {
        parameters.validateAndSetDefaults();
        this.parameters = parameters;
        this.detector = new SourceDetector(parameters.detection);
        this.matcher = new CorrespondenceMatcher(parameters.matching);
        this.estimator = new TransformEstimator(parameters.estimation);
        this.resampler = new FrameResampler(parameters.backgroundValue);
        this.state = AlignmentState.IDLE;
    }

    public AlignmentState getState() {
        return state;
    }

    /**
     * @return index of the frame that caused the last run to fail (or null if it did not fail).
     */
    public Integer getFailedFrameIndex() {
        return failedFrameIndex;
    }

    /**
     * @return reason the last run failed (or null if it did not fail).
     */
    public FailureReason getFailureReason() {
        return failureReason;
    }

    /**
     * Aligns frames that have already been loaded.
     */
    public AlignmentResult align(final List<Frame> frames,
                                 final Rectangle crop)
            throws IllegalArgumentException, AlignmentFailedException {
        return alignLoaders(frames.stream().map(FrameLoader::of).collect(Collectors.toList()),
                            crop,
                            new CancellationToken());
    }

    /**
     * @param  loaders            one loader per frame (any order, frames are processed in temporal order).
     * @param  crop               region applied to every frame before detection (null for entire frames).
     * @param  cancellationToken  token checked before each frame is started.
     *
     * @return aligned frames in temporal order plus every skipped frame with its reason.
     *
     * @throws IllegalArgumentException
     *   if no frames are provided or the reference index is out of range.
     * @throws AlignmentFailedException
     *   if the reference frame cannot be loaded, cropped or has no sources.
     */
    public synchronized AlignmentResult alignLoaders(final List<? extends FrameLoader> loaders,
                                                     final Rectangle crop,
                                                     final CancellationToken cancellationToken)
            throws IllegalArgumentException, AlignmentFailedException {

        state = AlignmentState.IDLE;
        failedFrameIndex = null;
        failureReason = null;

        if (loaders.isEmpty()) {
            throw new IllegalArgumentException("no frames to align");
        }

        final int referencePosition = parameters.referenceIndex;
        if (referencePosition >= loaders.size()) {
            throw new IllegalArgumentException("referenceIndex " + referencePosition + " is out of range for " +
                                               loaders.size() + " frames");
        }

        LOG.info("alignLoaders: entry, {} frames, crop {}, {} threads",
                 loaders.size(), crop, parameters.numberOfThreads);

        final ProcessTimer timer = new ProcessTimer();

        final List<FrameTask> tasks = new ArrayList<>(loaders.size());
        for (int i = 0; i < loaders.size(); i++) {
            tasks.add(new FrameTask(i, loaders.get(i)));
        }
        tasks.sort(Comparator.comparing(FrameTask::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder())));

        final FrameTask referenceTask = tasks.get(referencePosition);
        final SourceSet referenceSources = selectReference(referenceTask, crop);

        state = AlignmentState.PROCESSING;

        final List<SkippedFrame> skippedFrames = new ArrayList<>();
        final List<AlignedFrame> alignedFrames = new ArrayList<>();

        final ExecutorService executorService = Executors.newFixedThreadPool(parameters.numberOfThreads);
        try {

            final List<Future<FrameTask>> futures = new ArrayList<>(tasks.size());
            for (final FrameTask task : tasks) {
                if (task == referenceTask) {
                    futures.add(null);
                } else {
                    futures.add(executorService.submit(() -> process(task,
                                                                     crop,
                                                                     referenceSources,
                                                                     referenceTask.getAlignedFrame().getImage(),
                                                                     cancellationToken)));
                }
            }

            for (int i = 0; i < tasks.size(); i++) {
                final FrameTask task = tasks.get(i);
                final Future<FrameTask> future = futures.get(i);
                if (future == null) {
                    alignedFrames.add(task.getAlignedFrame());
                    continue;
                }

                waitFor(task, future, cancellationToken);
                if (task.isFailed()) {
                    skippedFrames.add(task.toSkippedFrame());
                } else {
                    alignedFrames.add(task.getAlignedFrame());
                }
            }

        } finally {
            executorService.shutdownNow();
        }

        for (final SkippedFrame skippedFrame : skippedFrames) {
            LOG.warn("alignLoaders: skipped frame {} ({}), {}: {}",
                     skippedFrame.getFrameIndex(), skippedFrame.getTimestamp(),
                     skippedFrame.getReason(), skippedFrame.getMessage());
        }

        final AlignmentResult result = new AlignmentResult(referenceTask.getFrameIndex(),
                                                           alignedFrames,
                                                           skippedFrames,
                                                           cancellationToken.isCancelled());
        state = AlignmentState.DONE;

        LOG.info("alignLoaders: exit, result {}, elapsed time {}", result, timer);

        return result;
    }

    /**
     * Loads and detects the reference frame, failing the run if that is not possible.
     */
    private SourceSet selectReference(final FrameTask referenceTask,
                                      final Rectangle crop)
            throws AlignmentFailedException {

        final int frameIndex = referenceTask.getFrameIndex();
        try {

            final Frame frame = cropFrame(referenceTask.getLoader().load(), crop);
            final SourceSet sources = detector.detect(frame, frameIndex);
            if (sources.isEmpty()) {
                throw new EmptyDetectionException(frameIndex);
            }

            referenceTask.setSourceSet(sources);
            referenceTask.complete(new AlignedFrame(frameIndex,
                                                    resampler.warp(frame, FrameTransform.identity()),
                                                    FrameTransform.identity()));

        } catch (final RegistrationException e) {
            throw failRun(frameIndex, e.getReason(), e.getMessage(), e);
        } catch (final RuntimeException e) {
            throw failRun(frameIndex, FailureReason.UNEXPECTED, e.getMessage(), e);
        }

        state = AlignmentState.REFERENCE_SELECTED;

        LOG.info("selectReference: frame {} ({}) has {} sources",
                 frameIndex, referenceTask.getTimestamp(), referenceTask.getSourceSet().size());

        return referenceTask.getSourceSet();
    }

    private AlignmentFailedException failRun(final int frameIndex,
                                             final FailureReason reason,
                                             final String message,
                                             final Throwable cause) {
        state = AlignmentState.FAILED;
        failedFrameIndex = frameIndex;
        failureReason = reason;
        LOG.error("alignLoaders: failed to select reference frame {}, {}: {}", frameIndex, reason, message);
        return new AlignmentFailedException(frameIndex, reason, message, cause);
    }

    /**
     * Registers one frame against the reference sources, recording the aligned frame or failure in the task.
     */
    FrameTask process(final FrameTask task,
                      final Rectangle crop,
                      final SourceSet referenceSources,
                      final Frame referenceFrame,
                      final CancellationToken cancellationToken) {

        task.markStarted();

        if (cancellationToken.isCancelled()) {
            task.fail(FailureReason.CANCELLED, "run was cancelled before frame was started");
            return task;
        }

        try {
            final Frame frame = cropFrame(task.getLoader().load(), crop);

            final SourceSet sources = detector.detect(frame, task.getFrameIndex());
            task.setSourceSet(sources);
            if (sources.isEmpty()) {
                throw new EmptyDetectionException(task.getFrameIndex());
            }

            final List<Correspondence> correspondences = matcher.match(sources, referenceSources);
            final FrameTransform transform = estimator.estimate(correspondences);

            final Frame warped = resampler.warp(frame, transform, referenceFrame.getWidth(), referenceFrame.getHeight());
            task.complete(new AlignedFrame(task.getFrameIndex(), warped, transform));

            LOG.debug("process: aligned {} with {} sources, {} correspondences, transform {}",
                      task, sources.size(), correspondences.size(), transform);

        } catch (final RegistrationException e) {
            task.fail(e.getReason(), e.getMessage());
        }

        return task;
    }

    private Frame cropFrame(final Frame frame,
                            final Rectangle crop)
            throws FetchFailureException {
        if (frame == null) {
            throw new FetchFailureException("loader returned no frame");
        }
        if ((crop != null) && (! frame.contains(crop))) {
            throw new FetchFailureException("crop region " + crop + " is outside of " +
                                            frame.getWidth() + "x" + frame.getHeight() + " frame");
        }
        return frame.crop(crop);
    }

    /**
     * Waits for a frame's worker to finish, recording timeouts, cancellation and unexpected errors in the task.
     * The time limit for a frame is measured from the moment a worker starts processing it,
     * so time spent queued behind slow frames does not count.
     */
    private void waitFor(final FrameTask task,
                         final Future<FrameTask> future,
                         final CancellationToken cancellationToken) {
        try {
            if (parameters.frameTimeoutSeconds == null) {
                future.get();
            } else {
                final long startNanos = task.awaitStart();
                final long deadlineNanos = startNanos + TimeUnit.SECONDS.toNanos(parameters.frameTimeoutSeconds);
                future.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
            }
        } catch (final TimeoutException e) {
            future.cancel(true);
            task.fail(FailureReason.TIMEOUT,
                      "registration did not finish within " + parameters.frameTimeoutSeconds +
                      " seconds of starting");
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellationToken.cancel();
            future.cancel(true);
            task.fail(FailureReason.CANCELLED, "interrupted while waiting for frame");
        } catch (final CancellationException e) {
            task.fail(FailureReason.CANCELLED, "frame processing was cancelled");
        } catch (final ExecutionException e) {
            LOG.error("waitFor: unexpected failure registering " + task, e.getCause());
            task.fail(FailureReason.UNEXPECTED, String.valueOf(e.getCause()));
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(AlignmentPipeline.class);
}
