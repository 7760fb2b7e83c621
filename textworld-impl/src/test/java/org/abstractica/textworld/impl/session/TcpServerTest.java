package org.abstractica.textworld.impl.session;

import org.abstractica.textworld.CloseReason;
import org.abstractica.textworld.Connection;
import org.abstractica.textworld.Server;
import org.abstractica.textworld.impl.protocol.JsonProtocol;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link TcpServer} over a real loopback socket.
 */
class TcpServerTest
{
    // ========== Test Protocol ==========

    public sealed interface ClientMessage permits ClientMessage.Echo, ClientMessage.Fail, ClientMessage.Count
    {
        record Echo(String text) implements ClientMessage {}
        record Fail(String why) implements ClientMessage {}
        record Count(int n) implements ClientMessage {}
    }

    public sealed interface ServerMessage permits ServerMessage.EchoReply, ServerMessage.Problem, ServerMessage.Welcome
    {
        record EchoReply(String text) implements ServerMessage {}
        record Problem(String detail) implements ServerMessage {}
        record Welcome(String connectionId) implements ServerMessage {}
    }

    // ========== Test Setup ==========

    private Server server;
    private Socket client;
    private BufferedReader in;
    private OutputStream out;

    @BeforeEach
    void setUp()
    {
        JsonProtocol protocol = new JsonProtocol.Builder()
                .clientMessages(ClientMessage.class)
                .serverMessages(ServerMessage.class)
                .build();

        server = new TcpServerFactory().builder()
                .port(0)
                .bindAddress(InetAddress.getLoopbackAddress())
                .protocol(protocol)
                .maxLineLength(256)
                .build();

        server.onConnectionOpened(connection -> connection.send(new ServerMessage.Welcome(connection.getId())));
        server.onMessage(ClientMessage.Echo.class, (connection, msg) ->
                connection.send(new ServerMessage.EchoReply(msg.text())));
        server.onMessage(ClientMessage.Fail.class, (connection, msg) ->
        {
            throw new IllegalStateException(msg.why());
        });
        server.onError((connection, message, exception) ->
                connection.trySend(new ServerMessage.Problem(exception.getMessage())));
    }

    @AfterEach
    void tearDown() throws IOException
    {
        if (client != null)
        {
            client.close();
        }
        server.close();
    }

    private void connect() throws IOException
    {
        server.start();
        client = new Socket(InetAddress.getLoopbackAddress(), server.getLocalAddress().getPort());
        client.setSoTimeout(5000);
        in = new BufferedReader(new InputStreamReader(client.getInputStream(), StandardCharsets.UTF_8));
        out = client.getOutputStream();
    }

    private void sendLine(String line) throws IOException
    {
        out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    // ========== Tests ==========

    @Test
    void connect_receivesWelcomeFromOpenedCallback() throws Exception
    {
        connect();

        String welcome = in.readLine();

        assertNotNull(welcome);
        assertTrue(welcome.startsWith("{\"type\":\"welcome\""), welcome);
        assertEquals(1, server.getConnections().size());
    }

    @Test
    void echo_repliesInOrder() throws Exception
    {
        connect();
        in.readLine(); // welcome

        sendLine("{\"type\":\"echo\",\"text\":\"one\"}");
        sendLine("{\"type\":\"echo\",\"text\":\"two\"}");

        assertEquals("{\"type\":\"echoReply\",\"text\":\"one\"}", in.readLine());
        assertEquals("{\"type\":\"echoReply\",\"text\":\"two\"}", in.readLine());
    }

    @Test
    void handlerException_reportedAndConnectionSurvives() throws Exception
    {
        connect();
        in.readLine(); // welcome

        sendLine("{\"type\":\"fail\",\"why\":\"boom\"}");
        sendLine("{\"type\":\"echo\",\"text\":\"still here\"}");

        assertEquals("{\"type\":\"problem\",\"detail\":\"boom\"}", in.readLine());
        assertEquals("{\"type\":\"echoReply\",\"text\":\"still here\"}", in.readLine());
    }

    @Test
    void undecodableLine_reportedToErrorHandler() throws Exception
    {
        connect();
        in.readLine(); // welcome

        sendLine("this is not json");
        sendLine("{\"type\":\"echo\",\"text\":\"after\"}");

        String problem = in.readLine();
        assertTrue(problem.startsWith("{\"type\":\"problem\""), problem);
        assertEquals("{\"type\":\"echoReply\",\"text\":\"after\"}", in.readLine());
    }

    @Test
    void messageWithoutHandler_isIgnored() throws Exception
    {
        connect();
        in.readLine(); // welcome

        sendLine("{\"type\":\"count\",\"n\":3}");
        sendLine("{\"type\":\"echo\",\"text\":\"next\"}");

        assertEquals("{\"type\":\"echoReply\",\"text\":\"next\"}", in.readLine());
    }

    @Test
    void overlongLine_closesWithProtocolError() throws Exception
    {
        AtomicReference<CloseReason> reason = new AtomicReference<>();
        CountDownLatch closed = new CountDownLatch(1);
        server.onConnectionClosed((connection, r) ->
        {
            reason.set(r);
            closed.countDown();
        });
        connect();
        in.readLine(); // welcome

        sendLine("{\"type\":\"echo\",\"text\":\"" + "x".repeat(300) + "\"}");

        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertInstanceOf(CloseReason.ProtocolError.class, reason.get());
        assertTrue(server.getConnections().isEmpty());
    }

    @Test
    void peerClose_reportsClosedByPeer() throws Exception
    {
        AtomicReference<CloseReason> reason = new AtomicReference<>();
        CountDownLatch closed = new CountDownLatch(1);
        server.onConnectionClosed((connection, r) ->
        {
            reason.set(r);
            closed.countDown();
        });
        connect();
        in.readLine(); // welcome

        client.close();
        client = null;

        assertTrue(closed.await(5, TimeUnit.SECONDS));
        assertInstanceOf(CloseReason.ClosedByPeer.class, reason.get());
    }

    @Test
    void kick_flushesQueuedMessagesBeforeClosing() throws Exception
    {
        List<Connection> opened = new CopyOnWriteArrayList<>();
        server.onConnectionOpened(opened::add);
        connect();
        in.readLine(); // welcome

        Connection connection = opened.get(0);
        connection.send(new ServerMessage.EchoReply("last words"));
        connection.close("bye");

        assertEquals("{\"type\":\"echoReply\",\"text\":\"last words\"}", in.readLine());
        assertNull(in.readLine());
        assertFalse(connection.isOpen());
        assertFalse(connection.trySend(new ServerMessage.EchoReply("too late")));
    }

    @Test
    void broadcast_reachesEveryConnection() throws Exception
    {
        connect();
        in.readLine(); // welcome

        try (Socket second = new Socket(InetAddress.getLoopbackAddress(), server.getLocalAddress().getPort()))
        {
            second.setSoTimeout(5000);
            BufferedReader secondIn = new BufferedReader(
                    new InputStreamReader(second.getInputStream(), StandardCharsets.UTF_8));
            secondIn.readLine(); // welcome

            server.broadcast(new ServerMessage.EchoReply("all"));

            assertEquals("{\"type\":\"echoReply\",\"text\":\"all\"}", in.readLine());
            assertEquals("{\"type\":\"echoReply\",\"text\":\"all\"}", secondIn.readLine());
        }
    }

    @Test
    void builder_missingProtocol_throws()
    {
        assertThrows(IllegalStateException.class, () -> new TcpServerFactory().builder().port(0).build());
    }

    @Test
    void builder_invalidPort_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> new TcpServerFactory().builder().port(70000));
    }
}
