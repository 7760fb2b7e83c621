package org.abstractica.textworld.world.server.store;

import org.abstractica.textworld.world.server.world.PlayerRecord;

import java.util.Optional;

/**
 * Storage of players and their last room.
 */
public interface PlayerStore
{
    /**
     * Looks up a player, ignoring case.
     */
    Optional<PlayerRecord> getPlayerByName(String name);

    /**
     * Records the room a player is in.
     *
     * @throws IllegalArgumentException if the player does not exist
     */
    void updatePlayerRoom(String name, long roomId);
}
