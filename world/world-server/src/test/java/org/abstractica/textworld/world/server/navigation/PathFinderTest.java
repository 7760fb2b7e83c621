package org.abstractica.textworld.world.server.navigation;

import org.abstractica.textworld.world.protocol.Direction;
import org.abstractica.textworld.world.server.TestWorlds;
import org.abstractica.textworld.world.server.store.InMemoryTopologyStore;
import org.abstractica.textworld.world.server.store.TopologyStore;
import org.abstractica.textworld.world.server.topology.MovementResolver;
import org.abstractica.textworld.world.server.world.Room;
import org.abstractica.textworld.world.server.world.WorldMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link PathFinder}.
 */
class PathFinderTest
{
    private TopologyStore topology;
    private MovementResolver resolver;
    private PathFinder pathFinder;

    @BeforeEach
    void setUp()
    {
        topology = TestWorlds.town().topology();
        resolver = new MovementResolver(topology);
        pathFinder = new PathFinder(topology, resolver);
    }

    /**
     * Walks a route with the resolver and checks every step lands where it says.
     */
    private void assertWalkable(Route route)
    {
        Room current = topology.getRoomById(route.originRoomId()).orElseThrow();
        for (RouteStep step : route.steps())
        {
            MovementResolver.Resolution.Moved moved = assertInstanceOf(MovementResolver.Resolution.Moved.class,
                    resolver.resolveMove(current, step.direction()));
            assertEquals(step.roomId(), moved.to().id());
            current = moved.to();
        }
        assertEquals(route.destinationRoomId(), current.id());
    }

    @Test
    void shortestPath_sameRoom_isEmptyRoute()
    {
        Route route = pathFinder.shortestPath(TestWorlds.roomAt(1, 1), TestWorlds.roomAt(1, 1)).orElseThrow();

        assertTrue(route.isEmpty());
    }

    @Test
    void shortestPath_straightLine()
    {
        Route route = pathFinder.shortestPath(TestWorlds.roomAt(0, 0), TestWorlds.roomAt(2, 0)).orElseThrow();

        assertEquals(List.of(
                new RouteStep(Direction.EAST, TestWorlds.roomAt(1, 0)),
                new RouteStep(Direction.EAST, TestWorlds.roomAt(2, 0))), route.steps());
    }

    @Test
    void shortestPath_usesDiagonals()
    {
        Route route = pathFinder.shortestPath(TestWorlds.roomAt(0, 0), TestWorlds.roomAt(2, 2)).orElseThrow();

        assertEquals(2, route.size());
        assertEquals(Direction.NORTHEAST, route.steps().get(0).direction());
        assertEquals(Direction.NORTHEAST, route.steps().get(1).direction());
    }

    @Test
    void shortestPath_longCorridor_hasOneStepPerRoom()
    {
        InMemoryTopologyStore corridor = new InMemoryTopologyStore();
        corridor.addMap(new WorldMap(1, "Corridor", null));
        for (int x = 0; x <= 6; x++)
        {
            corridor.addRoom(new Room(x + 1, 1, x, 0, "hall " + x, null, null, null));
        }
        PathFinder corridorFinder = new PathFinder(corridor, new MovementResolver(corridor));

        Route route = corridorFinder.shortestPath(1, 7).orElseThrow();

        assertEquals(6, route.size());
        assertTrue(route.steps().stream().allMatch(step -> step.direction() == Direction.EAST));
    }

    @Test
    void shortestPath_crossesPortal()
    {
        Route route = pathFinder.shortestPath(TestWorlds.roomAt(0, 0), TestWorlds.TRAIL).orElseThrow();

        assertEquals(5, route.size());
        assertEquals(new RouteStep(Direction.NORTH, TestWorlds.WILD_GATE), route.steps().get(3));
        assertEquals(new RouteStep(Direction.NORTH, TestWorlds.TRAIL), route.steps().get(4));
        assertWalkable(route);
    }

    @Test
    void shortestPath_oneWayPortal_noWayBack()
    {
        assertTrue(pathFinder.shortestPath(TestWorlds.TRAIL, TestWorlds.roomAt(0, 0)).isEmpty());
    }

    @Test
    void shortestPath_disconnected_isUnreachable()
    {
        assertTrue(pathFinder.shortestPath(TestWorlds.roomAt(0, 0), TestWorlds.ISLAND).isEmpty());
    }

    @Test
    void shortestPath_missingRoom_isUnreachable()
    {
        assertTrue(pathFinder.shortestPath(TestWorlds.roomAt(0, 0), 999).isEmpty());
        assertTrue(pathFinder.shortestPath(999, TestWorlds.roomAt(0, 0)).isEmpty());
    }

    @Test
    void shortestPath_everyPairIsWalkable()
    {
        for (long from = 1; from <= 10; from++)
        {
            for (long to = 1; to <= 10; to++)
            {
                Route route = pathFinder.shortestPath(from, to).orElseThrow();
                assertWalkable(route);
                assertTrue(route.size() <= 3, from + " -> " + to);
            }
        }
    }
}
