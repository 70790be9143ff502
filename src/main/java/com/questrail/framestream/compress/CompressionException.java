package com.questrail.framestream.compress;

/**
 * Indicates that the image codec could not produce usable output for a payload.
 *
 * <p>This is fatal to a single frame only: the frame is dropped and the next
 * successful frame is sent as FULL.</p>
 */
public final class CompressionException extends Exception
{
    public CompressionException(String message) {
        super(message);
    }

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
