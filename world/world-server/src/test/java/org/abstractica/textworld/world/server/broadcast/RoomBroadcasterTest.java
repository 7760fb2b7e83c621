package org.abstractica.textworld.world.server.broadcast;

import org.abstractica.textworld.world.protocol.ServerMessage;
import org.abstractica.textworld.world.server.RecordingConnection;
import org.abstractica.textworld.world.server.presence.PresenceRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link RoomBroadcaster}.
 */
class RoomBroadcasterTest
{
    private PresenceRegistry presence;
    private RoomBroadcaster broadcaster;
    private RecordingConnection alice;
    private RecordingConnection bob;
    private RecordingConnection carol;

    @BeforeEach
    void setUp()
    {
        presence = new PresenceRegistry();
        broadcaster = new RoomBroadcaster(presence);
        alice = new RecordingConnection("a");
        bob = new RecordingConnection("b");
        carol = new RecordingConnection("c");
        presence.register("Alice", alice, 1);
        presence.register("Bob", bob, 1);
        presence.register("Carol", carol, 2);
    }

    @Test
    void broadcast_reachesRoomOnly()
    {
        ServerMessage.Notice event = new ServerMessage.Notice("hello");

        assertEquals(2, broadcaster.broadcast(1, event, null));

        assertEquals(1, alice.sent().size());
        assertEquals(1, bob.sent().size());
        assertTrue(carol.sent().isEmpty());
    }

    @Test
    void broadcast_skipsExcluded()
    {
        assertEquals(1, broadcaster.broadcast(1, new ServerMessage.Notice("hi"), "alice"));

        assertTrue(alice.sent().isEmpty());
        assertEquals(1, bob.sent().size());
    }

    @Test
    void broadcast_refusedRecipientIsSkipped()
    {
        bob.setRefusing(true);

        assertEquals(1, broadcaster.broadcast(1, new ServerMessage.Notice("hi"), null));

        assertEquals(1, alice.sent().size());
        assertTrue(bob.sent().isEmpty());
    }

    @Test
    void broadcast_throwingRecipientIsSkipped()
    {
        presence.register("Dave", new RecordingConnection("d")
        {
            @Override
            public boolean trySend(Object message)
            {
                throw new IllegalStateException("broken pipe");
            }
        }, 1);

        assertEquals(2, broadcaster.broadcast(1, new ServerMessage.Notice("hi"), null));
        assertEquals(1, alice.sent().size());
    }

    @Test
    void broadcast_emptyRoom_deliversNothing()
    {
        assertEquals(0, broadcaster.broadcast(99, new ServerMessage.Notice("echo"), null));
    }

    @Test
    void sendTo_singleRecipient()
    {
        assertTrue(broadcaster.sendTo("CAROL", new ServerMessage.Notice("psst")));
        assertEquals("psst", carol.last(ServerMessage.Notice.class).text());
        assertTrue(alice.sent().isEmpty());

        assertFalse(broadcaster.sendTo("Nobody", new ServerMessage.Notice("lost")));
    }
}
