package org.abstractica.textworld;

import org.abstractica.textworld.handlers.ErrorHandler;
import org.abstractica.textworld.handlers.MessageHandler;

import java.net.InetSocketAddress;
import java.util.Collection;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * A server that accepts client connections and dispatches their messages.
 *
 * <p>Applications register message handlers and lifecycle callbacks before
 * calling {@link #start()}.</p>
 *
 * <pre>{@code
 * Server server = new TcpServerFactory().builder()
 *     .port(4000)
 *     .protocol(protocol)
 *     .build();
 *
 * server.onMessage(ClientMessage.Move.class, (connection, msg) -> {
 *     // Handle move
 * });
 *
 * server.start();
 * }</pre>
 */
public interface Server extends AutoCloseable
{
    /**
     * Starts the server.
     *
     * <p>Binds the listening socket and begins accepting connections.
     * Returns immediately; the server runs on background threads.</p>
     *
     * @throws IllegalStateException if already started or the socket cannot be bound
     */
    void start();

    /**
     * Stops accepting new connections.
     *
     * <p>Existing connections remain open.</p>
     */
    void stop();

    /**
     * Closes the server and all connections.
     */
    @Override
    void close();

    /**
     * Returns the address the server is listening on.
     *
     * <p>Useful when the server was configured with port 0.</p>
     *
     * @return the bound address
     * @throws IllegalStateException if the server is not started
     */
    InetSocketAddress getLocalAddress();

    /**
     * Registers a handler for messages of the specified type.
     *
     * <p>Handlers are called on the connection's reader thread, so messages
     * from one connection are handled in the order they arrived.</p>
     *
     * @param type    the message class to handle
     * @param handler the handler to invoke
     * @param <T>     the message type
     */
    <T> void onMessage(Class<T> type, MessageHandler<T> handler);

    /**
     * Registers a callback for newly accepted connections.
     *
     * @param handler called when a connection opens
     */
    void onConnectionOpened(Consumer<Connection> handler);

    /**
     * Registers a callback for closed connections.
     *
     * @param handler called with the connection and the close reason
     */
    void onConnectionClosed(BiConsumer<Connection, CloseReason> handler);

    /**
     * Registers an error handler for message handler exceptions.
     *
     * @param handler called when a message handler throws an exception
     */
    void onError(ErrorHandler handler);

    /**
     * Sends a message to every open connection without blocking.
     *
     * @param message the message to broadcast
     */
    void broadcast(Object message);

    /**
     * Returns all open connections.
     *
     * @return unmodifiable collection of connections
     */
    Collection<Connection> getConnections();
}
