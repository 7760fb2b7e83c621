package org.abstractica.textworld.impl.session;

/**
 * State of a connection.
 */
public enum ConnectionState
{
    /**
     * Socket is open and messages flow both ways.
     */
    OPEN,

    /**
     * Connection was closed. Queued outbound messages may still be flushed
     * before the socket is released.
     */
    CLOSED
}
