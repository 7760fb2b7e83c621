package org.abstractica.textworld.world.protocol;

/**
 * A saved route as listed to its owner.
 */
public record RouteSummary(long routeId, String name, RouteMode mode, long originRoomId, String originRoomName, int steps)
{
}
