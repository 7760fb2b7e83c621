package org.abstractica.textworld.world.server.navigation;

import java.util.List;

/**
 * A walkable sequence of steps between two rooms.
 *
 * <p>A route from a room to itself has no steps.</p>
 */
public record Route(long originRoomId, long destinationRoomId, List<RouteStep> steps)
{
    public Route
    {
        steps = List.copyOf(steps);
    }

    public int size()
    {
        return steps.size();
    }

    public boolean isEmpty()
    {
        return steps.isEmpty();
    }
}
