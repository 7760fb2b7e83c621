package org.abstractica.textworld.world.server.navigation;

import org.abstractica.textworld.world.protocol.RouteMode;

import java.util.List;
import java.util.Objects;

/**
 * A named route recorded by a player, walked from its origin room.
 *
 * @param id           route id; 0 until stored
 * @param owner        owning player name
 * @param name         route name
 * @param mode         path or loop
 * @param originRoomId room the route starts from
 * @param steps        steps in walking order
 */
public record SavedRoute(long id, String owner, String name, RouteMode mode, long originRoomId, List<RouteStep> steps)
{
    public SavedRoute
    {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(mode, "mode");
        steps = List.copyOf(steps);
    }

    public SavedRoute withId(long newId)
    {
        return new SavedRoute(newId, owner, name, mode, originRoomId, steps);
    }

    public Route toRoute()
    {
        long destination = steps.isEmpty() ? originRoomId : steps.get(steps.size() - 1).roomId();
        return new Route(originRoomId, destination, steps);
    }
}
