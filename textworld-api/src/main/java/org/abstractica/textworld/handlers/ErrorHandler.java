package org.abstractica.textworld.handlers;

import org.abstractica.textworld.Connection;

/**
 * Handles exceptions thrown by message handlers.
 *
 * <p>When a message handler throws, the server catches the exception and
 * invokes this handler. The connection keeps processing later messages.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles an exception thrown by a message handler.
     *
     * @param connection the connection where the error occurred
     * @param message    the message that caused the error
     * @param exception  the exception thrown by the handler
     */
    void handle(Connection connection, Object message, Exception exception);
}
