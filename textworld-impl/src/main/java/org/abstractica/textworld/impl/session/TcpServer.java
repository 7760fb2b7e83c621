package org.abstractica.textworld.impl.session;

import org.abstractica.textworld.CloseReason;
import org.abstractica.textworld.Connection;
import org.abstractica.textworld.Server;
import org.abstractica.textworld.handlers.ErrorHandler;
import org.abstractica.textworld.handlers.MessageHandler;
import org.abstractica.textworld.impl.protocol.JsonProtocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * TCP implementation of the Server interface.
 *
 * <p>One acceptor thread accepts sockets and wraps each in a
 * {@link SocketConnection}.</p>
 */
public class TcpServer implements Server, ConnectionCallback
{
    private static final Logger LOG = LoggerFactory.getLogger(TcpServer.class);

    private final InetSocketAddress bindAddress;
    private final JsonProtocol protocol;
    private final int maxConnections;
    private final int maxOutboundQueueSize;
    private final int maxLineLength;

    private final Map<String, SocketConnection> connections;
    private final Map<Class<?>, MessageHandler<?>> messageHandlers;
    private final List<Consumer<Connection>> connectionOpenedCallbacks;
    private final List<BiConsumer<Connection, CloseReason>> connectionClosedCallbacks;
    private volatile ErrorHandler errorHandler;

    private final AtomicLong nextConnectionId;

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running;
    private volatile boolean acceptingConnections;

    /**
     * Creates a new server.
     *
     * <p>Use {@link TcpServerFactory} to create instances.</p>
     */
    TcpServer(
            InetSocketAddress bindAddress,
            JsonProtocol protocol,
            int maxConnections,
            int maxOutboundQueueSize,
            int maxLineLength
    )
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.maxConnections = maxConnections;
        this.maxOutboundQueueSize = maxOutboundQueueSize;
        this.maxLineLength = maxLineLength;

        this.connections = new ConcurrentHashMap<>();
        this.messageHandlers = new ConcurrentHashMap<>();
        this.connectionOpenedCallbacks = new CopyOnWriteArrayList<>();
        this.connectionClosedCallbacks = new CopyOnWriteArrayList<>();
        this.nextConnectionId = new AtomicLong(1);

        this.running = false;
        this.acceptingConnections = false;
    }

    // ========== Server Interface ==========

    @Override
    public void start()
    {
        if (running)
        {
            throw new IllegalStateException("Server already started");
        }

        LOG.info("Starting server");

        try
        {
            serverSocket = new ServerSocket();
            serverSocket.setReuseAddress(true);
            serverSocket.bind(bindAddress);
        }
        catch (IOException e)
        {
            throw new IllegalStateException("Cannot bind " + bindAddress, e);
        }

        running = true;
        acceptingConnections = true;

        acceptThread = new Thread(this::acceptLoop, "server-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();

        LOG.info("Server started on {}", getLocalAddress());
    }

    @Override
    public void stop()
    {
        LOG.info("Stopping server (no new connections)");
        acceptingConnections = false;
    }

    @Override
    public void close()
    {
        if (!running)
        {
            return;
        }

        LOG.info("Closing server");

        running = false;
        acceptingConnections = false;

        try
        {
            serverSocket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing server socket: {}", e.getMessage());
        }

        for (SocketConnection connection : new ArrayList<>(connections.values()))
        {
            connection.close(new CloseReason.ServerShutdown());
        }

        LOG.info("Server closed");
    }

    @Override
    public InetSocketAddress getLocalAddress()
    {
        if (serverSocket == null || !serverSocket.isBound())
        {
            throw new IllegalStateException("Server not started");
        }
        return (InetSocketAddress) serverSocket.getLocalSocketAddress();
    }

    @Override
    public <T> void onMessage(Class<T> type, MessageHandler<T> handler)
    {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        protocol.getTypeName(type); // rejects types outside the protocol
        messageHandlers.put(type, handler);
    }

    @Override
    public void onConnectionOpened(Consumer<Connection> handler)
    {
        Objects.requireNonNull(handler, "handler");
        connectionOpenedCallbacks.add(handler);
    }

    @Override
    public void onConnectionClosed(BiConsumer<Connection, CloseReason> handler)
    {
        Objects.requireNonNull(handler, "handler");
        connectionClosedCallbacks.add(handler);
    }

    @Override
    public void onError(ErrorHandler handler)
    {
        this.errorHandler = handler;
    }

    @Override
    public void broadcast(Object message)
    {
        Objects.requireNonNull(message, "message");

        for (SocketConnection connection : connections.values())
        {
            connection.trySend(message);
        }
    }

    @Override
    public Collection<Connection> getConnections()
    {
        return Collections.unmodifiableCollection(connections.values());
    }

    // ========== ConnectionCallback Interface ==========

    @Override
    public void onConnectionClosed(SocketConnection connection, CloseReason reason)
    {
        if (connections.remove(connection.getId()) == null)
        {
            return;
        }

        LOG.info("Connection {} closed: {}", connection.getId(), reason);

        for (BiConsumer<Connection, CloseReason> callback : connectionClosedCallbacks)
        {
            try
            {
                callback.accept(connection, reason);
            }
            catch (Exception e)
            {
                LOG.error("Connection closed callback error", e);
            }
        }
    }

    @Override
    public MessageHandler<?> getHandler(Class<?> messageType)
    {
        return messageHandlers.get(messageType);
    }

    @Override
    public ErrorHandler getErrorHandler()
    {
        return errorHandler;
    }

    @Override
    public JsonProtocol getProtocol()
    {
        return protocol;
    }

    // ========== Accept Loop ==========

    private void acceptLoop()
    {
        LOG.debug("Accept loop started");

        while (running)
        {
            Socket socket;
            try
            {
                socket = serverSocket.accept();
            }
            catch (SocketException e)
            {
                // Closed by close()
                break;
            }
            catch (IOException e)
            {
                LOG.error("Error accepting connection", e);
                continue;
            }

            try
            {
                handleAccepted(socket);
            }
            catch (Exception e)
            {
                LOG.error("Error setting up connection from {}", socket.getRemoteSocketAddress(), e);
                closeQuietly(socket);
            }
        }

        LOG.debug("Accept loop stopped");
    }

    private void handleAccepted(Socket socket) throws IOException
    {
        if (!acceptingConnections)
        {
            LOG.debug("Refusing connection from {} while not accepting", socket.getRemoteSocketAddress());
            closeQuietly(socket);
            return;
        }
        if (maxConnections > 0 && connections.size() >= maxConnections)
        {
            LOG.warn("Refusing connection from {}: limit of {} reached",
                    socket.getRemoteSocketAddress(), maxConnections);
            closeQuietly(socket);
            return;
        }

        socket.setTcpNoDelay(true);
        String id = String.format("%06x", nextConnectionId.getAndIncrement());
        SocketConnection connection = new SocketConnection(
                id, socket, this, maxOutboundQueueSize, maxLineLength);
        connections.put(id, connection);

        LOG.info("Connection {} opened from {}", id, socket.getRemoteSocketAddress());

        // Listeners run before the reader starts so attachments are in place for the first message
        for (Consumer<Connection> callback : connectionOpenedCallbacks)
        {
            try
            {
                callback.accept(connection);
            }
            catch (Exception e)
            {
                LOG.error("Connection opened callback error", e);
            }
        }

        connection.start();
    }

    private static void closeQuietly(Socket socket)
    {
        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing refused socket: {}", e.getMessage());
        }
    }
}
