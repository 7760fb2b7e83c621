package org.abstractica.textworld.world.server.navigation;

/**
 * Thrown when a paused route is continued from a room other than the one it
 * was paused in. The paused route is discarded.
 */
public class StaleRouteException extends RouteRejectedException
{
    private final long pausedRoomId;
    private final long currentRoomId;

    public StaleRouteException(String message, long pausedRoomId, long currentRoomId)
    {
        super(message);
        this.pausedRoomId = pausedRoomId;
        this.currentRoomId = currentRoomId;
    }

    public long getPausedRoomId()
    {
        return pausedRoomId;
    }

    public long getCurrentRoomId()
    {
        return currentRoomId;
    }
}
