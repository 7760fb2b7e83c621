package org.abstractica.textworld.world.server.navigation;

import org.abstractica.textworld.world.protocol.Direction;

import java.util.Objects;

/**
 * One step of a route: the direction to walk and the room it ends in.
 */
public record RouteStep(Direction direction, long roomId)
{
    public RouteStep
    {
        Objects.requireNonNull(direction, "direction");
    }
}
