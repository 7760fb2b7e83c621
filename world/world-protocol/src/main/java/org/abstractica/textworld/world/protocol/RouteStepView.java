package org.abstractica.textworld.world.protocol;

/**
 * One step of a route.
 *
 * @param direction short direction code
 * @param roomId    room the step ends in
 * @param roomName  name of that room
 */
public record RouteStepView(String direction, long roomId, String roomName)
{
}
