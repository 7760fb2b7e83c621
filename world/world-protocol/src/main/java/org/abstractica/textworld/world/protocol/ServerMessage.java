package org.abstractica.textworld.world.protocol;

import java.util.List;

/**
 * Messages sent from server to client.
 */
public sealed interface ServerMessage permits
        ServerMessage.IdentityAccepted,
        ServerMessage.IdentityRejected,
        ServerMessage.RoomState,
        ServerMessage.Description,
        ServerMessage.Moved,
        ServerMessage.MoveBlocked,
        ServerMessage.MapData,
        ServerMessage.PeerJoined,
        ServerMessage.PeerLeft,
        ServerMessage.RoomMessage,
        ServerMessage.GroundUpdated,
        ServerMessage.Notice,
        ServerMessage.Error,
        ServerMessage.RouteComputed,
        ServerMessage.RouteStarted,
        ServerMessage.RouteProgress,
        ServerMessage.RoutePaused,
        ServerMessage.RouteResumed,
        ServerMessage.RouteComplete,
        ServerMessage.RouteFailed,
        ServerMessage.RouteSaved,
        ServerMessage.RouteList
{
    /**
     * The player entered the world.
     *
     * @param playerName the accepted player
     * @param room       the room they appear in
     * @param map        the map that room belongs to
     */
    record IdentityAccepted(String playerName, RoomSnapshot room, MapData map) implements ServerMessage
    {
    }

    /**
     * The player could not enter the world.
     *
     * @param reason why
     */
    record IdentityRejected(String reason) implements ServerMessage
    {
    }

    /**
     * Current view of the player's room.
     */
    record RoomState(RoomSnapshot room) implements ServerMessage
    {
    }

    /**
     * Result of looking at something in the room.
     *
     * @param subject what was looked at
     * @param text    its description
     */
    record Description(String subject, String text) implements ServerMessage
    {
    }

    /**
     * The player moved.
     *
     * @param direction  direction code of the move
     * @param room       the room arrived in
     * @param mapChanged true if a portal led onto another map
     */
    record Moved(String direction, RoomSnapshot room, boolean mapChanged) implements ServerMessage
    {
    }

    /**
     * A move could not be made.
     *
     * @param direction direction code, or the input if it was not a direction
     * @param message   text for the player
     */
    record MoveBlocked(String direction, String message) implements ServerMessage
    {
    }

    /**
     * Rooms of a map, sent on entering the world and after changing maps.
     */
    record MapData(long mapId, String mapName, int minX, int maxX, int minY, int maxY, List<MapCell> rooms)
            implements ServerMessage
    {
    }

    /**
     * Another player entered the room.
     */
    record PeerJoined(long roomId, String playerName, String message) implements ServerMessage
    {
    }

    /**
     * Another player left the room.
     */
    record PeerLeft(long roomId, String playerName, String message) implements ServerMessage
    {
    }

    /**
     * Something said or happening in the room.
     *
     * @param roomId  room the event happened in
     * @param speaker speaking player, or null for world events
     * @param text    the text
     */
    record RoomMessage(long roomId, String speaker, String text) implements ServerMessage
    {
    }

    /**
     * Items on the ground changed.
     */
    record GroundUpdated(long roomId, List<ItemView> items) implements ServerMessage
    {
    }

    /**
     * Private information for this player only.
     */
    record Notice(String text) implements ServerMessage
    {
    }

    /**
     * A request failed.
     */
    record Error(String message) implements ServerMessage
    {
    }

    /**
     * Shortest route to a room.
     *
     * @param destinationRoomId the destination
     * @param steps             steps to walk; empty when already there
     */
    record RouteComputed(long destinationRoomId, List<RouteStepView> steps) implements ServerMessage
    {
    }

    /**
     * A guided route started.
     */
    record RouteStarted(String name, RouteMode mode, int totalSteps) implements ServerMessage
    {
    }

    /**
     * One step of a guided route was walked.
     *
     * @param direction      direction code of the step
     * @param roomId         room reached
     * @param stepsCompleted steps done in the current lap
     * @param remaining      steps left in the current lap
     * @param lap            completed laps (loops only)
     */
    record RouteProgress(String direction, long roomId, int stepsCompleted, int remaining, int lap)
            implements ServerMessage
    {
    }

    /**
     * The route was paused.
     */
    record RoutePaused(int remaining, long roomId) implements ServerMessage
    {
    }

    /**
     * A paused route continues.
     */
    record RouteResumed(int remaining) implements ServerMessage
    {
    }

    /**
     * A path route reached its end.
     */
    record RouteComplete(String name, int steps) implements ServerMessage
    {
    }

    /**
     * A route stopped before its end.
     */
    record RouteFailed(String reason) implements ServerMessage
    {
    }

    /**
     * A route was saved.
     */
    record RouteSaved(RouteSummary route) implements ServerMessage
    {
    }

    /**
     * The player's saved routes.
     */
    record RouteList(List<RouteSummary> routes) implements ServerMessage
    {
    }
}
