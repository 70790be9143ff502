package com.questrail.framestream.codec;

/**
 * Indicates bytes that cannot be a frame of the stream wire format
 * (unknown mode tag, inconsistent length).
 */
public final class WireFormatException extends RuntimeException
{
    public WireFormatException(String message) {
        super(message);
    }
}
