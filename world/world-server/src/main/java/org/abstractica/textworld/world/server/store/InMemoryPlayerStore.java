package org.abstractica.textworld.world.server.store;

import org.abstractica.textworld.world.server.world.PlayerRecord;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Players held in memory, keyed by lower-cased name.
 */
public class InMemoryPlayerStore implements PlayerStore
{
    private final Map<String, PlayerRecord> players = new ConcurrentHashMap<>();

    /**
     * Adds a player.
     *
     * @throws IllegalArgumentException if the name is taken
     */
    public void addPlayer(PlayerRecord player)
    {
        Objects.requireNonNull(player, "player");
        if (players.putIfAbsent(key(player.name()), player) != null)
        {
            throw new IllegalArgumentException("Duplicate player: " + player.name());
        }
    }

    @Override
    public Optional<PlayerRecord> getPlayerByName(String name)
    {
        if (name == null)
        {
            return Optional.empty();
        }
        return Optional.ofNullable(players.get(key(name)));
    }

    @Override
    public void updatePlayerRoom(String name, long roomId)
    {
        Objects.requireNonNull(name, "name");
        PlayerRecord updated = players.computeIfPresent(key(name), (key, player) -> player.withRoom(roomId));
        if (updated == null)
        {
            throw new IllegalArgumentException("Unknown player: " + name);
        }
    }

    private static String key(String name)
    {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
