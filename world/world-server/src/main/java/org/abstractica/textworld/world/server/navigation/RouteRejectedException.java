package org.abstractica.textworld.world.server.navigation;

/**
 * Thrown when a route request cannot be carried out. The message is meant
 * for the player.
 */
public class RouteRejectedException extends RuntimeException
{
    public RouteRejectedException(String message)
    {
        super(message);
    }
}
