package org.abstractica.textworld.world.server.presence;

import org.abstractica.textworld.Connection;

import java.util.Objects;

/**
 * A connected player and the room they stand in.
 *
 * @param identity   player name as selected
 * @param connection the player's connection
 * @param roomId     current room
 */
public record Presence(String identity, Connection connection, long roomId)
{
    public Presence
    {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(connection, "connection");
    }

    public Presence withRoom(long newRoomId)
    {
        return new Presence(identity, connection, newRoomId);
    }
}
