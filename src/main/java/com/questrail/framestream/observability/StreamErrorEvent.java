package com.questrail.framestream.observability;

import com.questrail.framestream.model.FrameMode;

import java.time.Instant;

/**
 * Record representing a dropped frame.
 */
public record StreamErrorEvent(
    Instant timestamp,
    FrameMode mode,
    String message,
    Throwable cause
) {
}
