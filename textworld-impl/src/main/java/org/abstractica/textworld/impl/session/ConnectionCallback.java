package org.abstractica.textworld.impl.session;

import org.abstractica.textworld.CloseReason;
import org.abstractica.textworld.handlers.ErrorHandler;
import org.abstractica.textworld.handlers.MessageHandler;
import org.abstractica.textworld.impl.protocol.JsonProtocol;

/**
 * Callback interface from connection to server.
 *
 * <p>Used by SocketConnection to look up handlers, reach the protocol and
 * report when it closes.</p>
 */
public interface ConnectionCallback
{
    /**
     * Notifies that a connection has closed.
     *
     * @param connection the closed connection
     * @param reason     the reason for closing
     */
    void onConnectionClosed(SocketConnection connection, CloseReason reason);

    /**
     * Gets the message handler for a message type.
     *
     * @param messageType the message class
     * @return the handler, or null if none registered
     */
    MessageHandler<?> getHandler(Class<?> messageType);

    /**
     * Gets the error handler for handler exceptions.
     *
     * @return the error handler, or null if none set
     */
    ErrorHandler getErrorHandler();

    /**
     * Gets the protocol for message serialization.
     *
     * @return the protocol
     */
    JsonProtocol getProtocol();
}
