package org.abstractica.textworld.handlers;

import org.abstractica.textworld.Connection;

/**
 * Handles incoming messages of a specific type.
 *
 * <p>Handlers are registered per message type and invoked on the reader
 * thread of the connection that received the message.</p>
 *
 * @param <T> the message type this handler processes
 */
@FunctionalInterface
public interface MessageHandler<T>
{
    /**
     * Handles an incoming message.
     *
     * @param connection the connection that received the message
     * @param message    the message to handle
     */
    void handle(Connection connection, T message);
}
