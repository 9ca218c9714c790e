package org.starfield.alignment.pipeline;

/**
 * Life cycle of an {@link AlignmentPipeline} run.
 */
public enum AlignmentState {
    IDLE,
    REFERENCE_SELECTED,
    PROCESSING,
    DONE,
    FAILED
}
