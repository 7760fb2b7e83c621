package org.abstractica.textworld.world.protocol;

import java.util.List;

/**
 * Messages sent from client to server.
 */
public sealed interface ClientMessage permits
        ClientMessage.SelectIdentity,
        ClientMessage.Move,
        ClientMessage.Look,
        ClientMessage.Say,
        ClientMessage.Harvest,
        ClientMessage.ComputeRoute,
        ClientMessage.StartRoute,
        ClientMessage.SaveRoute,
        ClientMessage.ListRoutes,
        ClientMessage.StartSavedRoute,
        ClientMessage.StopRoute,
        ClientMessage.ContinueRoute,
        ClientMessage.CancelRoute
{
    /**
     * Enter the world as the named player.
     *
     * @param playerName the player to play as
     */
    record SelectIdentity(String playerName) implements ClientMessage
    {
    }

    /**
     * Move one room.
     *
     * @param direction direction as typed, such as {@code "n"} or {@code "northeast"}
     */
    record Move(String direction) implements ClientMessage
    {
    }

    /**
     * Look around the room, or at something in it.
     *
     * @param target what to look at; blank looks at the room
     */
    record Look(String target) implements ClientMessage
    {
    }

    /**
     * Speak to everyone in the room.
     *
     * @param text what to say
     */
    record Say(String text) implements ClientMessage
    {
    }

    /**
     * Start harvesting an actor in the room.
     *
     * @param target part of the actor's name
     */
    record Harvest(String target) implements ClientMessage
    {
    }

    /**
     * Ask for the shortest route to a room without walking it.
     *
     * @param destinationRoomId the room to reach
     */
    record ComputeRoute(long destinationRoomId) implements ClientMessage
    {
    }

    /**
     * Walk the shortest route to a room automatically.
     *
     * @param destinationRoomId the room to reach
     */
    record StartRoute(long destinationRoomId) implements ClientMessage
    {
    }

    /**
     * Record a route that starts in the current room.
     *
     * @param name       route name
     * @param mode       path or loop
     * @param directions direction codes in walking order
     */
    record SaveRoute(String name, RouteMode mode, List<String> directions) implements ClientMessage
    {
    }

    /**
     * List the player's saved routes.
     */
    record ListRoutes() implements ClientMessage
    {
    }

    /**
     * Walk a saved route, travelling to its origin first if needed.
     *
     * @param routeId the saved route id
     */
    record StartSavedRoute(long routeId) implements ClientMessage
    {
    }

    /**
     * Pause the running route; it can be continued from the same room.
     */
    record StopRoute() implements ClientMessage
    {
    }

    /**
     * Continue a paused route.
     */
    record ContinueRoute() implements ClientMessage
    {
    }

    /**
     * Abandon the current route.
     */
    record CancelRoute() implements ClientMessage
    {
    }
}
