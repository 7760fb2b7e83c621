package org.abstractica.textworld.world.server;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WorldServerApp}.
 */
class WorldServerAppTest
{
    private WorldServerApp app;
    private Socket client;
    private BufferedReader in;
    private OutputStream out;

    @AfterEach
    void tearDown() throws IOException
    {
        if (client != null)
        {
            client.close();
        }
        if (app != null)
        {
            app.close();
        }
    }

    // ========== Options ==========

    @Test
    void parse_noArguments_defaults()
    {
        assertEquals(WorldServerApp.Options.defaults(), WorldServerApp.Options.parse(new String[0]));
        assertEquals(4000, WorldServerApp.Options.defaults().port());
        assertNull(WorldServerApp.Options.defaults().worldFile());
    }

    @Test
    void parse_allFlags()
    {
        WorldServerApp.Options options = WorldServerApp.Options.parse(new String[] {
                "--port", "5000", "--tick-ms", "250", "--world", "my-world.json",
                "--nav-delay-ms", "100", "--loop-delay-ms", "300"});

        assertEquals(5000, options.port());
        assertEquals(Duration.ofMillis(250), options.tickInterval());
        assertEquals(Path.of("my-world.json"), options.worldFile());
        assertEquals(Duration.ofMillis(100), options.routeStepDelay());
        assertEquals(Duration.ofMillis(300), options.savedStepDelay());
    }

    @Test
    void parse_unknownFlag_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> WorldServerApp.Options.parse(new String[] {"--colour", "red"}));
    }

    @Test
    void parse_missingValue_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> WorldServerApp.Options.parse(new String[] {"--port"}));
    }

    @Test
    void parse_badNumber_throws()
    {
        assertThrows(IllegalArgumentException.class,
                () -> WorldServerApp.Options.parse(new String[] {"--tick-ms", "soon"}));
        assertThrows(IllegalArgumentException.class,
                () -> WorldServerApp.Options.parse(new String[] {"--port", "70000"}));
    }

    @Test
    void parse_nonPositiveTick_throws()
    {
        assertThrows(IllegalArgumentException.class,
                () -> WorldServerApp.Options.parse(new String[] {"--tick-ms", "0"}));
        assertThrows(IllegalArgumentException.class,
                () -> WorldServerApp.Options.parse(new String[] {"--tick-ms", "-5"}));
    }

    @Test
    void parse_negativeStepDelay_throws()
    {
        assertThrows(IllegalArgumentException.class,
                () -> WorldServerApp.Options.parse(new String[] {"--nav-delay-ms", "-1"}));
        assertThrows(IllegalArgumentException.class,
                () -> WorldServerApp.Options.parse(new String[] {"--loop-delay-ms", "-250"}));
        assertEquals(Duration.ZERO, WorldServerApp.Options.parse(new String[] {"--nav-delay-ms", "0"}).routeStepDelay());
    }

    // ========== Over the wire ==========

    private void connect() throws IOException
    {
        WorldServerApp.Options options = new WorldServerApp.Options(0, Duration.ofSeconds(1), null,
                Duration.ofMillis(10), Duration.ofMillis(10));
        app = new WorldServerApp(options, TestWorlds.town());
        app.start();
        client = new Socket(InetAddress.getLoopbackAddress(), app.getPort());
        client.setSoTimeout(5000);
        in = new BufferedReader(new InputStreamReader(client.getInputStream(), StandardCharsets.UTF_8));
        out = client.getOutputStream();
    }

    private void sendLine(String line) throws IOException
    {
        out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    @Test
    void commandsBeforeIdentity_areRefused() throws Exception
    {
        connect();

        sendLine("{\"type\":\"move\",\"direction\":\"e\"}");

        String reply = in.readLine();
        assertTrue(reply.startsWith("{\"type\":\"error\""), reply);
        assertTrue(reply.contains("Not authenticated"), reply);
    }

    @Test
    void selectIdentityThenMove() throws Exception
    {
        connect();

        sendLine("{\"type\":\"selectIdentity\",\"playerName\":\"alice\"}");
        String accepted = in.readLine();
        assertTrue(accepted.startsWith("{\"type\":\"identityAccepted\""), accepted);
        assertTrue(accepted.contains("\"playerName\":\"Alice\""), accepted);

        sendLine("{\"type\":\"move\",\"direction\":\"e\"}");
        String moved = in.readLine();
        assertTrue(moved.startsWith("{\"type\":\"moved\""), moved);
        assertTrue(moved.contains("\"roomId\":" + TestWorlds.roomAt(1, 0)), moved);
    }

    @Test
    void malformedLine_reportedAndConnectionKept() throws Exception
    {
        connect();

        sendLine("this is not json");
        String error = in.readLine();
        assertTrue(error.startsWith("{\"type\":\"error\""), error);
        assertTrue(error.contains("Malformed message"), error);

        sendLine("{\"type\":\"selectIdentity\",\"playerName\":\"Bob\"}");
        assertTrue(in.readLine().startsWith("{\"type\":\"identityAccepted\""));
    }

    @Test
    void secondIdentity_onSameConnection_rejected() throws Exception
    {
        connect();
        sendLine("{\"type\":\"selectIdentity\",\"playerName\":\"Alice\"}");
        in.readLine();

        sendLine("{\"type\":\"selectIdentity\",\"playerName\":\"Bob\"}");

        String rejected = in.readLine();
        assertTrue(rejected.startsWith("{\"type\":\"identityRejected\""), rejected);
        assertTrue(rejected.contains("already playing as Alice"), rejected);
    }
}
