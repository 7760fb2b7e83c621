package org.abstractica.textworld;

import java.util.Optional;

/**
 * A live connection between one client and the server.
 *
 * <p>A connection lasts as long as the underlying socket. Each connection has:</p>
 * <ul>
 *   <li>A unique identifier</li>
 *   <li>A bounded outbound queue drained by its own writer</li>
 *   <li>An optional application attachment for custom state</li>
 * </ul>
 */
public interface Connection
{
    /**
     * Queues a message for delivery.
     *
     * @param message the message to send
     * @throws IllegalStateException if the connection is closed or its outbound queue is full
     */
    void send(Object message);

    /**
     * Attempts to queue a message for delivery without blocking.
     *
     * <p>Returns false if the outbound queue is full or the connection is
     * closed, indicating backpressure. The message is dropped in that case.</p>
     *
     * @param message the message to send
     * @return true if queued, false otherwise
     */
    boolean trySend(Object message);

    /**
     * Closes the connection normally.
     */
    void close();

    /**
     * Closes the connection with a reason message.
     *
     * @param reason the reason for closing
     */
    void close(String reason);

    /**
     * Returns the unique connection identifier.
     *
     * @return connection ID
     */
    String getId();

    /**
     * Returns whether the connection is still open.
     *
     * @return true while the socket is open
     */
    boolean isOpen();

    /**
     * Returns the application attachment if set.
     *
     * @return the attachment, or empty if none set
     */
    Optional<Object> getAttachment();

    /**
     * Sets the application attachment.
     *
     * <p>The attachment is application-managed state associated with
     * this connection. The library does not interpret or modify it.</p>
     *
     * @param attachment the attachment to set (may be null)
     */
    void setAttachment(Object attachment);
}
