package org.abstractica.textworld.world.server.presence;

import org.abstractica.textworld.world.server.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PresenceRegistry}.
 */
class PresenceRegistryTest
{
    private PresenceRegistry registry;
    private RecordingConnection aliceConnection;
    private RecordingConnection bobConnection;

    @BeforeEach
    void setUp()
    {
        registry = new PresenceRegistry();
        aliceConnection = new RecordingConnection("a");
        bobConnection = new RecordingConnection("b");
    }

    @Test
    void register_addsEntry()
    {
        Presence presence = registry.register("Alice", aliceConnection, 1);

        assertEquals("Alice", presence.identity());
        assertEquals(1, presence.roomId());
        assertSame(aliceConnection, registry.find("alice").orElseThrow().connection());
        assertEquals(1, registry.size());
    }

    @Test
    void register_duplicate_throwsAndKeepsOriginal()
    {
        registry.register("Alice", aliceConnection, 1);

        DuplicatePresenceException e = assertThrows(DuplicatePresenceException.class,
                () -> registry.register("ALICE", bobConnection, 2));

        assertEquals("ALICE", e.getIdentity());
        Presence kept = registry.find("Alice").orElseThrow();
        assertSame(aliceConnection, kept.connection());
        assertEquals(1, kept.roomId());
    }

    @Test
    void register_concurrentSameIdentity_exactlyOneWins() throws Exception
    {
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        try
        {
            Future<?>[] futures = new Future<?>[contenders];
            for (int i = 0; i < contenders; i++)
            {
                RecordingConnection connection = new RecordingConnection("c" + i);
                futures[i] = pool.submit(() ->
                {
                    go.await();
                    try
                    {
                        registry.register("Alice", connection, 1);
                        accepted.incrementAndGet();
                    }
                    catch (DuplicatePresenceException e)
                    {
                        rejected.incrementAndGet();
                    }
                    return null;
                });
            }
            go.countDown();
            for (Future<?> future : futures)
            {
                future.get(5, TimeUnit.SECONDS);
            }
        }
        finally
        {
            pool.shutdownNow();
        }

        assertEquals(1, accepted.get());
        assertEquals(contenders - 1, rejected.get());
        assertEquals(1, registry.size());
    }

    @Test
    void unregister_removesEntry()
    {
        registry.register("Alice", aliceConnection, 1);

        assertTrue(registry.unregister("alice").isPresent());
        assertTrue(registry.find("Alice").isEmpty());
        assertTrue(registry.unregister("Alice").isEmpty());
    }

    @Test
    void unregister_otherConnection_keepsEntry()
    {
        registry.register("Alice", aliceConnection, 1);

        assertTrue(registry.unregister("Alice", bobConnection).isEmpty());
        assertTrue(registry.find("Alice").isPresent());

        assertTrue(registry.unregister("Alice", aliceConnection).isPresent());
        assertTrue(registry.find("Alice").isEmpty());
    }

    @Test
    void moveTo_updatesRoom()
    {
        registry.register("Alice", aliceConnection, 1);

        assertEquals(5, registry.moveTo("Alice", 5).orElseThrow().roomId());
        assertEquals(5, registry.find("Alice").orElseThrow().roomId());
        assertTrue(registry.moveTo("Nobody", 5).isEmpty());
    }

    @Test
    void compareAndMove_onlyFromExpectedRoom()
    {
        registry.register("Alice", aliceConnection, 1);

        assertFalse(registry.compareAndMove("Alice", 2, 3));
        assertEquals(1, registry.find("Alice").orElseThrow().roomId());

        assertTrue(registry.compareAndMove("Alice", 1, 3));
        assertEquals(3, registry.find("Alice").orElseThrow().roomId());

        // A second move still expecting room 1 loses
        assertFalse(registry.compareAndMove("Alice", 1, 4));
        assertEquals(3, registry.find("Alice").orElseThrow().roomId());
    }

    @Test
    void occupantsOf_sortedAndExcluding()
    {
        registry.register("Carol", new RecordingConnection("c"), 1);
        registry.register("alice", aliceConnection, 1);
        registry.register("Bob", bobConnection, 1);
        registry.register("Dave", new RecordingConnection("d"), 2);

        Set<String> occupants = registry.occupantsOf(1, "BOB");

        assertEquals(List.of("alice", "Carol"), List.copyOf(occupants));
        assertEquals(Set.of("Dave"), registry.occupantsOf(2, null));
        assertTrue(registry.occupantsOf(3, null).isEmpty());
    }

    @Test
    void presencesIn_followsMoves()
    {
        registry.register("Alice", aliceConnection, 1);
        registry.register("Bob", bobConnection, 1);

        registry.moveTo("Bob", 2);

        List<Presence> inOne = registry.presencesIn(1, null);
        assertEquals(1, inOne.size());
        assertEquals("Alice", inOne.get(0).identity());
        assertEquals("Bob", registry.presencesIn(2, null).get(0).identity());
    }
}
