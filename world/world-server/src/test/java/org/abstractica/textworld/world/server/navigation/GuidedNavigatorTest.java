package org.abstractica.textworld.world.server.navigation;

import org.abstractica.textworld.world.protocol.Direction;
import org.abstractica.textworld.world.protocol.RouteMode;
import org.abstractica.textworld.world.protocol.ServerMessage;
import org.abstractica.textworld.world.server.GameMessages;
import org.abstractica.textworld.world.server.RecordingConnection;
import org.abstractica.textworld.world.server.TestWorlds;
import org.abstractica.textworld.world.server.broadcast.RoomBroadcaster;
import org.abstractica.textworld.world.server.presence.PresenceRegistry;
import org.abstractica.textworld.world.server.store.TopologyStore;
import org.abstractica.textworld.world.server.topology.MovementResolver;
import org.abstractica.textworld.world.server.world.Room;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GuidedNavigator}.
 */
class GuidedNavigatorTest
{
    private static final Duration ROUTE_DELAY = Duration.ofMillis(10);
    private static final Duration SAVED_DELAY = Duration.ofMillis(20);

    private TopologyStore topology;
    private MovementResolver resolver;
    private PresenceRegistry presence;
    private GameMessages messages;
    private RecordingConnection alice;
    private ManualStepScheduler steps;
    private GuidedNavigator navigator;
    private Runnable duringNextStep;

    @BeforeEach
    void setUp()
    {
        topology = TestWorlds.town().topology();
        resolver = new MovementResolver(topology);
        presence = new PresenceRegistry();
        messages = GameMessages.loadDefault();
        alice = new RecordingConnection("a");
        presence.register("Alice", alice, TestWorlds.roomAt(0, 0));
        steps = new ManualStepScheduler();
        navigator = new GuidedNavigator(new RoomBroadcaster(presence), new PathFinder(topology, resolver), steps,
                this::step, new NavigationSettings(ROUTE_DELAY, SAVED_DELAY), messages);
    }

    private MovementResolver.Resolution step(String identity, Direction direction)
    {
        if (duringNextStep != null)
        {
            Runnable action = duringNextStep;
            duringNextStep = null;
            action.run();
        }
        Room from = topology.getRoomById(presence.find(identity).orElseThrow().roomId()).orElseThrow();
        MovementResolver.Resolution resolution = resolver.resolveMove(from, direction);
        if (resolution instanceof MovementResolver.Resolution.Moved moved)
        {
            presence.moveTo(identity, moved.to().id());
        }
        return resolution;
    }

    private long aliceRoom()
    {
        return presence.find("Alice").orElseThrow().roomId();
    }

    private static SavedRoute saved(String name, RouteMode mode, long origin, RouteStep... routeSteps)
    {
        return new SavedRoute(7, "Alice", name, mode, origin, List.of(routeSteps));
    }

    // ========== Destination routes ==========

    @Test
    void startDestination_walksToEndAndCompletes()
    {
        navigator.startDestination("Alice", aliceRoom(), TestWorlds.roomAt(2, 0), "room 2,0");

        assertEquals(new ServerMessage.RouteStarted("room 2,0", RouteMode.PATH, 2),
                alice.last(ServerMessage.RouteStarted.class));
        assertEquals(TestWorlds.roomAt(0, 0), aliceRoom(), "no step before the delay");

        assertTrue(steps.runNext());
        assertEquals(new ServerMessage.RouteProgress("E", TestWorlds.roomAt(1, 0), 1, 1, 0),
                alice.last(ServerMessage.RouteProgress.class));

        assertTrue(steps.runNext());
        assertEquals(TestWorlds.roomAt(2, 0), aliceRoom());
        assertEquals(new ServerMessage.RouteComplete("room 2,0", 2), alice.last(ServerMessage.RouteComplete.class));
        assertTrue(navigator.status("Alice").isEmpty());
        assertEquals(0, steps.pendingCount());
        assertEquals(List.of(ROUTE_DELAY, ROUTE_DELAY), steps.delays());
    }

    @Test
    void startDestination_sameRoom_completesAtOnce()
    {
        navigator.startDestination("Alice", aliceRoom(), aliceRoom(), "here");

        assertEquals(new ServerMessage.RouteComplete("here", 0), alice.last(ServerMessage.RouteComplete.class));
        assertEquals(0, steps.pendingCount());
    }

    @Test
    void startDestination_unreachable_rejected()
    {
        RouteRejectedException e = assertThrows(RouteRejectedException.class,
                () -> navigator.startDestination("Alice", aliceRoom(), TestWorlds.ISLAND, "island"));

        assertEquals(messages.format("route.noPath"), e.getMessage());
        assertTrue(navigator.status("Alice").isEmpty());
    }

    @Test
    void startDestination_replacesRunningRoute()
    {
        ExecutionState first = navigator.startDestination("Alice", aliceRoom(), TestWorlds.roomAt(2, 0), "first");
        navigator.startDestination("Alice", aliceRoom(), TestWorlds.roomAt(0, 2), "second");

        assertEquals(ExecutionStatus.STOPPED, first.getStatus());
        steps.runAll(10);
        assertEquals(TestWorlds.roomAt(0, 2), aliceRoom());
    }

    // ========== Pause and resume ==========

    @Test
    void pause_thenResumeInSameRoom_finishesRoute()
    {
        navigator.startDestination("Alice", aliceRoom(), TestWorlds.roomAt(2, 0), "east");
        steps.runNext();

        navigator.pause("Alice", aliceRoom());
        assertEquals(new ServerMessage.RoutePaused(1, TestWorlds.roomAt(1, 0)),
                alice.last(ServerMessage.RoutePaused.class));

        steps.runAll(5);
        assertEquals(TestWorlds.roomAt(1, 0), aliceRoom(), "paused route must not step");

        navigator.resume("Alice", aliceRoom());
        assertEquals(new ServerMessage.RouteResumed(1), alice.last(ServerMessage.RouteResumed.class));
        steps.runAll(5);

        assertEquals(TestWorlds.roomAt(2, 0), aliceRoom());
        assertNotNull(alice.last(ServerMessage.RouteComplete.class));
    }

    @Test
    void resume_fromOtherRoom_isStaleAndDiscarded()
    {
        navigator.startDestination("Alice", aliceRoom(), TestWorlds.roomAt(2, 0), "east");
        steps.runNext();
        navigator.pause("Alice", aliceRoom());
        presence.moveTo("Alice", TestWorlds.roomAt(1, 1));

        StaleRouteException e = assertThrows(StaleRouteException.class,
                () -> navigator.resume("Alice", aliceRoom()));

        assertEquals(TestWorlds.roomAt(1, 0), e.getPausedRoomId());
        assertEquals(TestWorlds.roomAt(1, 1), e.getCurrentRoomId());
        assertTrue(navigator.status("Alice").isEmpty());
        assertThrows(RouteRejectedException.class, () -> navigator.resume("Alice", aliceRoom()));
    }

    @Test
    void resume_withoutPause_rejected()
    {
        assertThrows(RouteRejectedException.class, () -> navigator.resume("Alice", aliceRoom()));

        navigator.startDestination("Alice", aliceRoom(), TestWorlds.roomAt(2, 0), "east");
        assertThrows(RouteRejectedException.class, () -> navigator.resume("Alice", aliceRoom()));
    }

    @Test
    void pause_withoutRoute_rejected()
    {
        RouteRejectedException e = assertThrows(RouteRejectedException.class,
                () -> navigator.pause("Alice", aliceRoom()));

        assertEquals(messages.format("route.nothingRunning"), e.getMessage());
    }

    @Test
    void pause_arrivingDuringStep_keepsCompletedStep()
    {
        navigator.startDestination("Alice", aliceRoom(), TestWorlds.roomAt(2, 0), "east");
        duringNextStep = () -> navigator.pause("Alice", aliceRoom());

        steps.runNext();

        ExecutionState state = navigator.status("Alice").orElseThrow();
        assertEquals(ExecutionStatus.PAUSED, state.getStatus());
        assertEquals(1, state.remaining());
        assertEquals(TestWorlds.roomAt(1, 0), state.getPausedRoomId());

        navigator.resume("Alice", aliceRoom());
        steps.runAll(5);
        assertEquals(TestWorlds.roomAt(2, 0), aliceRoom());
    }

    // ========== Stopping ==========

    @Test
    void manualMove_stopsRunningRoute()
    {
        navigator.startDestination("Alice", aliceRoom(), TestWorlds.roomAt(2, 0), "east");

        assertTrue(navigator.onManualMove("Alice"));

        assertEquals(new ServerMessage.RouteFailed(messages.format("route.interrupted")),
                alice.last(ServerMessage.RouteFailed.class));
        steps.runAll(5);
        assertEquals(TestWorlds.roomAt(0, 0), aliceRoom());
        assertTrue(navigator.status("Alice").isEmpty());
    }

    @Test
    void manualMove_keepsPausedRoute()
    {
        navigator.startDestination("Alice", aliceRoom(), TestWorlds.roomAt(2, 0), "east");
        navigator.pause("Alice", aliceRoom());

        assertFalse(navigator.onManualMove("Alice"));
        assertEquals(ExecutionStatus.PAUSED, navigator.status("Alice").orElseThrow().getStatus());
    }

    @Test
    void cancel_stopsRoute()
    {
        ExecutionState state = navigator.startDestination("Alice", aliceRoom(), TestWorlds.roomAt(2, 0), "east");

        navigator.cancel("Alice");

        assertEquals(ExecutionStatus.STOPPED, state.getStatus());
        assertEquals(messages.format("route.cancelled"), alice.last(ServerMessage.Notice.class).text());
        steps.runAll(5);
        assertEquals(TestWorlds.roomAt(0, 0), aliceRoom());
        assertThrows(RouteRejectedException.class, () -> navigator.cancel("Alice"));
    }

    @Test
    void discard_dropsSilently()
    {
        navigator.startDestination("Alice", aliceRoom(), TestWorlds.roomAt(2, 0), "east");
        alice.clear();

        navigator.discard("Alice");

        assertTrue(alice.sent().isEmpty());
        assertTrue(navigator.status("Alice").isEmpty());
        steps.runAll(5);
        assertEquals(TestWorlds.roomAt(0, 0), aliceRoom());
    }

    @Test
    void blockedStep_failsRoute()
    {
        navigator.startSaved("Alice", aliceRoom(), saved("westward", RouteMode.PATH, TestWorlds.roomAt(0, 0),
                new RouteStep(Direction.WEST, 42)));

        steps.runNext();

        assertEquals(new ServerMessage.RouteFailed(messages.format("route.blocked", "West")),
                alice.last(ServerMessage.RouteFailed.class));
        assertTrue(navigator.status("Alice").isEmpty());
    }

    @Test
    void divergedStep_stopsRoute()
    {
        navigator.startSaved("Alice", aliceRoom(), saved("confused", RouteMode.PATH, TestWorlds.roomAt(0, 0),
                new RouteStep(Direction.EAST, TestWorlds.roomAt(2, 2)),
                new RouteStep(Direction.EAST, TestWorlds.roomAt(2, 0))));

        steps.runAll(5);

        assertEquals(new ServerMessage.RouteFailed(messages.format("route.diverged")),
                alice.last(ServerMessage.RouteFailed.class));
        assertEquals(TestWorlds.roomAt(1, 0), aliceRoom());
    }

    // ========== Saved routes ==========

    @Test
    void loop_wrapsAndCountsLaps()
    {
        ExecutionState state = navigator.startSaved("Alice", aliceRoom(), saved("patrol", RouteMode.LOOP,
                TestWorlds.roomAt(0, 0),
                new RouteStep(Direction.EAST, TestWorlds.roomAt(1, 0)),
                new RouteStep(Direction.WEST, TestWorlds.roomAt(0, 0))));
        assertEquals(new ServerMessage.RouteStarted("patrol", RouteMode.LOOP, 2),
                alice.last(ServerMessage.RouteStarted.class));

        steps.runNext();
        steps.runNext();
        assertEquals(new ServerMessage.RouteProgress("W", TestWorlds.roomAt(0, 0), 2, 0, 0),
                alice.last(ServerMessage.RouteProgress.class));
        assertEquals(1, state.getLap());
        assertEquals(0, state.getNextIndex());

        steps.runNext();
        assertEquals(new ServerMessage.RouteProgress("E", TestWorlds.roomAt(1, 0), 1, 1, 1),
                alice.last(ServerMessage.RouteProgress.class));

        assertEquals(20, steps.runAll(20));
        assertEquals(ExecutionStatus.RUNNING, state.getStatus());
        assertEquals(11, state.getLap());
        assertTrue(alice.sent(ServerMessage.RouteComplete.class).isEmpty());
        assertTrue(steps.delays().stream().allMatch(SAVED_DELAY::equals));
    }

    @Test
    void path_endsAfterExactStepCount()
    {
        ExecutionState state = navigator.startSaved("Alice", aliceRoom(), saved("errand", RouteMode.PATH,
                TestWorlds.roomAt(0, 0),
                new RouteStep(Direction.NORTH, TestWorlds.roomAt(0, 1)),
                new RouteStep(Direction.NORTHEAST, TestWorlds.roomAt(1, 2)),
                new RouteStep(Direction.SOUTH, TestWorlds.roomAt(1, 1))));

        assertEquals(3, steps.runAll(10));

        assertEquals(0, state.getLap());
        assertEquals(ExecutionStatus.STOPPED, state.getStatus());
        assertEquals(new ServerMessage.RouteComplete("errand", 3), alice.last(ServerMessage.RouteComplete.class));
        assertEquals(TestWorlds.roomAt(1, 1), aliceRoom());
    }

    @Test
    void startSaved_elsewhere_travelsToOriginFirst()
    {
        presence.moveTo("Alice", TestWorlds.roomAt(2, 2));
        SavedRoute route = saved("errand", RouteMode.PATH, TestWorlds.roomAt(0, 0),
                new RouteStep(Direction.EAST, TestWorlds.roomAt(1, 0)));

        navigator.startSaved("Alice", aliceRoom(), route);

        assertEquals(messages.format("route.travelToOrigin", "errand"), alice.last(ServerMessage.Notice.class).text());
        steps.runAll(10);

        assertEquals(TestWorlds.roomAt(1, 0), aliceRoom());
        List<ServerMessage.RouteStarted> started = alice.sent(ServerMessage.RouteStarted.class);
        assertEquals(2, started.size());
        assertEquals(new ServerMessage.RouteStarted("errand", RouteMode.PATH, 1), started.get(1));
        assertEquals(2, alice.sent(ServerMessage.RouteComplete.class).size());
    }

    @Test
    void startSaved_originUnreachable_rejected()
    {
        presence.moveTo("Alice", TestWorlds.TRAIL);

        RouteRejectedException e = assertThrows(RouteRejectedException.class, () -> navigator.startSaved("Alice",
                aliceRoom(), saved("home", RouteMode.PATH, TestWorlds.roomAt(0, 0),
                        new RouteStep(Direction.EAST, TestWorlds.roomAt(1, 0)))));

        assertEquals(messages.format("route.noOriginPath"), e.getMessage());
    }
}
