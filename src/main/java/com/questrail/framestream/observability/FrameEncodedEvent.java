package com.questrail.framestream.observability;

import com.questrail.framestream.model.FrameMode;

import java.time.Instant;

/**
 * Record describing one encoded frame.
 *
 * @param wireBytes     total bytes of the framed unit
 * @param changedBlocks changed block count, or -1 when no diff was computed
 * @param delivered     whether the bytes were handed to a connected transport
 */
public record FrameEncodedEvent(
    Instant timestamp,
    FrameMode mode,
    int wireBytes,
    int changedBlocks,
    int forcedRefreshCounter,
    boolean delivered
) {
}
