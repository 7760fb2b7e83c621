package org.abstractica.textworld.world.server.navigation;

import org.abstractica.textworld.world.protocol.Direction;
import org.abstractica.textworld.world.server.store.TopologyStore;
import org.abstractica.textworld.world.server.topology.MovementResolver;
import org.abstractica.textworld.world.server.world.Room;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;

/**
 * Finds the shortest walkable route between two rooms.
 *
 * <p>The graph is exactly what {@link MovementResolver} allows: grid steps in
 * the eight horizontal directions plus portals whose target exists, with a
 * portal replacing the grid step in its own direction. Every step costs the
 * same, so a breadth-first search yields a shortest route. Neighbours are
 * expanded in {@link Direction#HORIZONTAL} order, which decides between
 * equally short routes.</p>
 */
public class PathFinder
{
    private record Arrival(long fromRoomId, Direction direction) {}

    private final TopologyStore topology;
    private final MovementResolver resolver;

    public PathFinder(TopologyStore topology, MovementResolver resolver)
    {
        this.topology = Objects.requireNonNull(topology, "topology");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Computes the shortest route.
     *
     * @param originRoomId      start room
     * @param destinationRoomId goal room
     * @return the route, with no steps if both are the same room, or empty if
     *         either room is missing or the goal cannot be reached
     */
    public Optional<Route> shortestPath(long originRoomId, long destinationRoomId)
    {
        Optional<Room> origin = topology.getRoomById(originRoomId);
        if (origin.isEmpty() || topology.getRoomById(destinationRoomId).isEmpty())
        {
            return Optional.empty();
        }
        if (originRoomId == destinationRoomId)
        {
            return Optional.of(new Route(originRoomId, destinationRoomId, List.of()));
        }

        Map<Long, Arrival> walkBackward = new HashMap<>();
        Map<Long, Room> visited = new HashMap<>();
        Queue<Room> workQueue = new ArrayDeque<>();
        visited.put(originRoomId, origin.get());
        workQueue.add(origin.get());

        while (!workQueue.isEmpty())
        {
            Room room = workQueue.remove();
            for (Direction direction : Direction.HORIZONTAL)
            {
                MovementResolver.Resolution resolution = resolver.resolveMove(room, direction);
                if (!(resolution instanceof MovementResolver.Resolution.Moved moved))
                {
                    continue;
                }
                Room next = moved.to();
                if (visited.containsKey(next.id()))
                {
                    continue;
                }
                visited.put(next.id(), next);
                walkBackward.put(next.id(), new Arrival(room.id(), direction));
                if (next.id() == destinationRoomId)
                {
                    return Optional.of(walkBack(originRoomId, destinationRoomId, walkBackward));
                }
                workQueue.add(next);
            }
        }
        return Optional.empty();
    }

    private static Route walkBack(long originRoomId, long destinationRoomId, Map<Long, Arrival> walkBackward)
    {
        List<RouteStep> steps = new ArrayList<>();
        long roomId = destinationRoomId;
        while (roomId != originRoomId)
        {
            Arrival arrival = walkBackward.get(roomId);
            steps.add(new RouteStep(arrival.direction(), roomId));
            roomId = arrival.fromRoomId();
        }
        Collections.reverse(steps);
        return new Route(originRoomId, destinationRoomId, steps);
    }
}
