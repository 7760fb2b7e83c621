package org.abstractica.textworld.impl.session;

import org.abstractica.textworld.CloseReason;
import org.abstractica.textworld.Connection;
import org.abstractica.textworld.handlers.ErrorHandler;
import org.abstractica.textworld.handlers.MessageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Connection over one TCP socket carrying newline-delimited JSON.
 *
 * <p>Each connection owns two threads. The reader decodes lines and invokes
 * handlers in arrival order. The writer drains a bounded outbound queue, so
 * {@link #trySend(Object)} never blocks the caller.</p>
 */
public class SocketConnection implements Connection
{
    private static final Logger LOG = LoggerFactory.getLogger(SocketConnection.class);

    // Queued by close() so the writer flushes everything queued before it.
    private static final Object CLOSE_MARKER = new Object();

    private final String id;
    private final Socket socket;
    private final ConnectionCallback callback;
    private final BlockingQueue<Object> outbound;
    private final int maxLineLength;
    private final AtomicReference<ConnectionState> state;

    private volatile Object attachment;
    private Thread readerThread;
    private Thread writerThread;

    /**
     * Creates a new connection.
     *
     * @param id                   the unique connection id
     * @param socket               the accepted socket
     * @param callback             callback to the server
     * @param maxOutboundQueueSize capacity of the outbound queue
     * @param maxLineLength        longest accepted inbound line
     */
    public SocketConnection(
            String id,
            Socket socket,
            ConnectionCallback callback,
            int maxOutboundQueueSize,
            int maxLineLength
    )
    {
        this.id = Objects.requireNonNull(id, "id");
        this.socket = Objects.requireNonNull(socket, "socket");
        this.callback = Objects.requireNonNull(callback, "callback");
        if (maxOutboundQueueSize <= 0)
        {
            throw new IllegalArgumentException("maxOutboundQueueSize must be positive: " + maxOutboundQueueSize);
        }
        if (maxLineLength <= 0)
        {
            throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        this.outbound = new LinkedBlockingQueue<>(maxOutboundQueueSize);
        this.maxLineLength = maxLineLength;
        this.state = new AtomicReference<>(ConnectionState.OPEN);
    }

    /**
     * Starts the reader and writer threads.
     */
    public void start()
    {
        if (readerThread != null)
        {
            return;
        }

        writerThread = new Thread(this::writeLoop, "conn-" + id + "-writer");
        writerThread.setDaemon(true);
        writerThread.start();

        readerThread = new Thread(this::readLoop, "conn-" + id + "-reader");
        readerThread.setDaemon(true);
        readerThread.start();
    }

    // ========== Connection Interface ==========

    @Override
    public void send(Object message)
    {
        Objects.requireNonNull(message, "message");
        if (state.get() != ConnectionState.OPEN)
        {
            throw new IllegalStateException("Connection is closed");
        }
        if (!outbound.offer(message))
        {
            throw new IllegalStateException("Outbound queue is full");
        }
    }

    @Override
    public boolean trySend(Object message)
    {
        Objects.requireNonNull(message, "message");
        if (state.get() != ConnectionState.OPEN)
        {
            return false;
        }
        boolean queued = outbound.offer(message);
        if (!queued)
        {
            LOG.debug("Outbound queue full on connection {}, dropping {}", id, message.getClass().getSimpleName());
        }
        return queued;
    }

    @Override
    public void close()
    {
        close(new CloseReason.KickedByServer("Connection closed"));
    }

    @Override
    public void close(String reason)
    {
        close(new CloseReason.KickedByServer(reason));
    }

    /**
     * Closes the connection with an explicit reason.
     *
     * <p>Messages queued before the call are still written. Only the first
     * call has any effect.</p>
     *
     * @param reason the close reason reported to listeners
     */
    public void close(CloseReason reason)
    {
        Objects.requireNonNull(reason, "reason");
        if (!state.compareAndSet(ConnectionState.OPEN, ConnectionState.CLOSED))
        {
            return;
        }

        LOG.debug("Closing connection {}: {}", id, reason);

        if (!outbound.offer(CLOSE_MARKER))
        {
            closeSocket();
        }
        if (writerThread == null)
        {
            closeSocket();
        }

        callback.onConnectionClosed(this, reason);
    }

    @Override
    public String getId()
    {
        return id;
    }

    @Override
    public boolean isOpen()
    {
        return state.get() == ConnectionState.OPEN;
    }

    @Override
    public Optional<Object> getAttachment()
    {
        return Optional.ofNullable(attachment);
    }

    @Override
    public void setAttachment(Object attachment)
    {
        this.attachment = attachment;
    }

    public ConnectionState getState()
    {
        return state.get();
    }

    // ========== Reader ==========

    private void readLoop()
    {
        LOG.debug("Connection {} reader started", id);

        try (Reader reader = new BufferedReader(
                new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8)))
        {
            StringBuilder line = new StringBuilder();
            while (isOpen())
            {
                int result = readLine(reader, line);
                if (result < 0)
                {
                    close(new CloseReason.ClosedByPeer());
                    break;
                }
                if (result == 0)
                {
                    LOG.warn("Connection {} sent a line longer than {} characters", id, maxLineLength);
                    close(new CloseReason.ProtocolError("Line exceeds " + maxLineLength + " characters"));
                    break;
                }

                String text = line.toString().trim();
                if (!text.isEmpty())
                {
                    processLine(text);
                }
            }
        }
        catch (IOException e)
        {
            if (isOpen())
            {
                LOG.debug("Connection {} read failed: {}", id, e.getMessage());
                close(new CloseReason.NetworkError(e));
            }
        }

        LOG.debug("Connection {} reader stopped", id);
    }

    /**
     * Reads one line into the buffer.
     *
     * @return 1 when a line was read, 0 when the line is too long, -1 at end of stream
     */
    private int readLine(Reader reader, StringBuilder line) throws IOException
    {
        line.setLength(0);
        int c;
        while ((c = reader.read()) != -1)
        {
            if (c == '\n')
            {
                return 1;
            }
            if (line.length() >= maxLineLength)
            {
                return 0;
            }
            line.append((char) c);
        }
        return line.length() > 0 ? 1 : -1;
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private void processLine(String text)
    {
        Record decoded;
        try
        {
            decoded = callback.getProtocol().decodeClientMessage(text);
        }
        catch (IllegalArgumentException e)
        {
            LOG.warn("Undecodable message on connection {}: {}", id, e.getMessage());
            reportError(text, e);
            return;
        }

        MessageHandler handler = callback.getHandler(decoded.getClass());
        if (handler == null)
        {
            LOG.debug("No handler for message type: {}", decoded.getClass().getSimpleName());
            return;
        }

        try
        {
            handler.handle(this, decoded);
        }
        catch (Exception e)
        {
            reportError(decoded, e);
        }
    }

    private void reportError(Object message, Exception exception)
    {
        ErrorHandler errorHandler = callback.getErrorHandler();
        if (errorHandler == null)
        {
            LOG.error("Message handler exception: connection={}, message={}", id, message, exception);
            return;
        }

        try
        {
            errorHandler.handle(this, message, exception);
        }
        catch (Exception e2)
        {
            LOG.error("Error handler threw exception", e2);
        }
    }

    // ========== Writer ==========

    private void writeLoop()
    {
        try (Writer writer = new BufferedWriter(
                new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8)))
        {
            while (true)
            {
                Object message = outbound.take();
                if (message == CLOSE_MARKER)
                {
                    break;
                }

                String line;
                try
                {
                    line = callback.getProtocol().encode(message);
                }
                catch (IllegalArgumentException e)
                {
                    LOG.error("Cannot encode outbound message on connection {}", id, e);
                    continue;
                }

                writer.write(line);
                writer.write('\n');
                if (outbound.isEmpty())
                {
                    writer.flush();
                }
            }
            writer.flush();
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        catch (IOException e)
        {
            LOG.debug("Connection {} write failed: {}", id, e.getMessage());
            close(new CloseReason.NetworkError(e));
        }
        finally
        {
            closeSocket();
        }
    }

    private void closeSocket()
    {
        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing socket of connection {}: {}", id, e.getMessage());
        }
    }
}
