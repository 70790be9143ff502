package com.questrail.framestream.transport;

/**
 * Phase of the outbound connection.
 *
 * <pre>
 *   DISCONNECTED → CONNECTING → CONNECTED → DISCONNECTED
 *                       └──────────────────────┘ (attempt failed)
 * </pre>
 */
public enum ConnectionPhase
{
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
