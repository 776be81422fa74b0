package com.reflow.core.checkpoint;

/**
 * Raised when a token does not name a live snapshot. Always a programming error.
 */
public class UnknownCheckpointException extends IllegalStateException {

    public UnknownCheckpointException(CheckpointToken token) {
        super("Unknown or released checkpoint: " + token);
    }
}
