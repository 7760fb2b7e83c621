package org.abstractica.textworld.world.server.topology;

import org.abstractica.textworld.world.protocol.Direction;
import org.abstractica.textworld.world.server.store.TopologyStore;
import org.abstractica.textworld.world.server.world.Portal;
import org.abstractica.textworld.world.server.world.Room;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides where a step from a room leads.
 *
 * <p>A room's portal overrides the grid in its own direction: the step goes
 * to the portal's target room even if a same-map neighbour exists that way.
 * Every other horizontal direction leads to the unit-step neighbour on the
 * same map when that room exists.</p>
 */
public class MovementResolver
{
    private final TopologyStore topology;

    public MovementResolver(TopologyStore topology)
    {
        this.topology = Objects.requireNonNull(topology, "topology");
    }

    /**
     * Outcome of trying to step from a room.
     */
    public sealed interface Resolution
    {
        Direction direction();

        /**
         * The step leads to another room.
         *
         * @param from          starting room
         * @param to            destination room
         * @param direction     direction walked
         * @param mapTransition true if the destination lies on another map
         */
        record Moved(Room from, Room to, Direction direction, boolean mapTransition) implements Resolution {}

        /**
         * Nothing lies that way, or a portal points at a room that no longer exists.
         */
        record Blocked(Direction direction, boolean stalePortal) implements Resolution {}

        /**
         * Up and down are recognised but lead nowhere yet.
         */
        record Unsupported(Direction direction) implements Resolution {}
    }

    /**
     * Returns the open state of every direction.
     *
     * <p>A horizontal direction is open if the room's portal points that way
     * or the same-map neighbour exists. Vertical directions are never open.
     * A portal counts as open even if its target has gone; taking it is then
     * blocked.</p>
     *
     * @param room the room
     * @return open flag per direction, in declaration order
     */
    public Map<Direction, Boolean> exits(Room room)
    {
        Objects.requireNonNull(room, "room");
        Map<Direction, Boolean> exits = new EnumMap<>(Direction.class);
        for (Direction direction : Direction.values())
        {
            if (direction.isVertical())
            {
                exits.put(direction, false);
            }
            else if (room.hasPortalTowards(direction))
            {
                exits.put(direction, true);
            }
            else
            {
                exits.put(direction, neighbour(room, direction).isPresent());
            }
        }
        return exits;
    }

    /**
     * Returns the open directions in declaration order.
     */
    public List<Direction> openExits(Room room)
    {
        List<Direction> open = new ArrayList<>();
        for (Map.Entry<Direction, Boolean> entry : exits(room).entrySet())
        {
            if (entry.getValue())
            {
                open.add(entry.getKey());
            }
        }
        return open;
    }

    /**
     * Resolves a step from a room.
     *
     * @param room      starting room
     * @param direction direction to walk
     * @return where the step leads
     */
    public Resolution resolveMove(Room room, Direction direction)
    {
        Objects.requireNonNull(room, "room");
        Objects.requireNonNull(direction, "direction");

        if (direction.isVertical())
        {
            return new Resolution.Unsupported(direction);
        }

        if (room.hasPortalTowards(direction))
        {
            Portal portal = room.portal();
            Optional<Room> target = topology.getRoomByCoords(portal.targetMapId(), portal.targetX(), portal.targetY());
            if (target.isEmpty())
            {
                return new Resolution.Blocked(direction, true);
            }
            Room to = target.get();
            return new Resolution.Moved(room, to, direction, to.mapId() != room.mapId());
        }

        Optional<Room> next = neighbour(room, direction);
        if (next.isEmpty())
        {
            return new Resolution.Blocked(direction, false);
        }
        return new Resolution.Moved(room, next.get(), direction, false);
    }

    private Optional<Room> neighbour(Room room, Direction direction)
    {
        return topology.getRoomByCoords(room.mapId(), room.x() + direction.dx(), room.y() + direction.dy());
    }
}
