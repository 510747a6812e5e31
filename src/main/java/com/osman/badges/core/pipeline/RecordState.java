package com.osman.badges.core.pipeline;

/**
 * Progress of a single record through the pipeline.
 */
public enum RecordState {
    PENDING,
    SHAPED,
    ENCODED,
    COMPOSED,
    DONE,
    FAILED
}
