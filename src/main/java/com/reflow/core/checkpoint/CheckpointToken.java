package com.reflow.core.checkpoint;

/**
 * Opaque handle to a stored snapshot.
 *
 * @param id    sequence number within the owning manager
 * @param label diagnostic label, e.g. {@code pre-step-2-a0}
 */
public record CheckpointToken(long id, String label) {}
