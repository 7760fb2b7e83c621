package org.abstractica.textworld;

import java.io.IOException;

/**
 * Reason a connection was closed.
 */
public sealed interface CloseReason
{
    /**
     * Network-level error occurred.
     *
     * @param cause the underlying I/O exception
     */
    record NetworkError(IOException cause) implements CloseReason {}

    /**
     * The client closed its end of the socket.
     */
    record ClosedByPeer() implements CloseReason {}

    /**
     * Server explicitly closed the connection.
     *
     * @param message reason provided by server
     */
    record KickedByServer(String message) implements CloseReason {}

    /**
     * Protocol error (over-long line, unusable framing).
     *
     * @param details description of the protocol violation
     */
    record ProtocolError(String details) implements CloseReason {}

    /**
     * Server is shutting down.
     */
    record ServerShutdown() implements CloseReason {}
}
