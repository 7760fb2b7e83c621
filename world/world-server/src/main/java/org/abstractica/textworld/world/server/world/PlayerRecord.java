package org.abstractica.textworld.world.server.world;

import java.util.Objects;

/**
 * A stored player and the room they were last in.
 */
public record PlayerRecord(String name, long roomId)
{
    public PlayerRecord
    {
        Objects.requireNonNull(name, "name");
    }

    public PlayerRecord withRoom(long newRoomId)
    {
        return new PlayerRecord(name, newRoomId);
    }
}
