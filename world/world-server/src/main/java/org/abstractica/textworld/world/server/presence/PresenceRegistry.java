package org.abstractica.textworld.world.server.presence;

import org.abstractica.textworld.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Who is connected and which room each of them is in.
 *
 * <p>Identities compare without regard to case. Every mutation is a single
 * atomic operation on the backing map, so concurrent callers never see a
 * half-applied change.</p>
 */
public class PresenceRegistry
{
    private static final Logger LOG = LoggerFactory.getLogger(PresenceRegistry.class);

    private final Map<String, Presence> entries = new ConcurrentHashMap<>();

    /**
     * Adds an identity to the world.
     *
     * @param identity   player name
     * @param connection the player's connection
     * @param roomId     starting room
     * @return the new entry
     * @throws DuplicatePresenceException if the identity is already present
     */
    public Presence register(String identity, Connection connection, long roomId)
    {
        Presence presence = new Presence(identity, connection, roomId);
        Presence existing = entries.putIfAbsent(key(identity), presence);
        if (existing != null)
        {
            LOG.warn("Rejected second presence for {} (connection {} already holds it)",
                    identity, existing.connection().getId());
            throw new DuplicatePresenceException(identity);
        }
        LOG.debug("Registered {} in room {}", identity, roomId);
        return presence;
    }

    /**
     * Removes an identity.
     *
     * @return the removed entry, or empty if absent
     */
    public Optional<Presence> unregister(String identity)
    {
        Objects.requireNonNull(identity, "identity");
        return Optional.ofNullable(entries.remove(key(identity)));
    }

    /**
     * Removes an identity only while it is held by the given connection.
     *
     * @return the removed entry, or empty if absent or held by another connection
     */
    public Optional<Presence> unregister(String identity, Connection connection)
    {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(connection, "connection");
        Presence[] removed = new Presence[1];
        entries.computeIfPresent(key(identity), (key, presence) ->
        {
            if (presence.connection() == connection)
            {
                removed[0] = presence;
                return null;
            }
            return presence;
        });
        return Optional.ofNullable(removed[0]);
    }

    public Optional<Presence> find(String identity)
    {
        if (identity == null)
        {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(key(identity)));
    }

    /**
     * Moves an identity to a room unconditionally.
     *
     * @return the updated entry, or empty if the identity is absent
     */
    public Optional<Presence> moveTo(String identity, long roomId)
    {
        Objects.requireNonNull(identity, "identity");
        return Optional.ofNullable(entries.computeIfPresent(key(identity),
                (key, presence) -> presence.withRoom(roomId)));
    }

    /**
     * Moves an identity only if it is still in the expected room.
     *
     * <p>Of two concurrent moves starting from the same room, exactly one succeeds.</p>
     *
     * @param identity       player name
     * @param expectedRoomId room the caller believes the player is in
     * @param roomId         destination room
     * @return true if moved
     */
    public boolean compareAndMove(String identity, long expectedRoomId, long roomId)
    {
        Objects.requireNonNull(identity, "identity");
        boolean[] moved = new boolean[1];
        entries.computeIfPresent(key(identity), (key, presence) ->
        {
            if (presence.roomId() != expectedRoomId)
            {
                return presence;
            }
            moved[0] = true;
            return presence.withRoom(roomId);
        });
        return moved[0];
    }

    /**
     * Returns the identities in a room, sorted by name.
     *
     * @param roomId    the room
     * @param excluding identity to leave out, may be null
     */
    public Set<String> occupantsOf(long roomId, String excluding)
    {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (Presence presence : presencesIn(roomId, excluding))
        {
            names.add(presence.identity());
        }
        return Collections.unmodifiableSet(names);
    }

    /**
     * Returns the entries in a room, sorted by identity.
     *
     * @param roomId    the room
     * @param excluding identity to leave out, may be null
     */
    public List<Presence> presencesIn(long roomId, String excluding)
    {
        String excludedKey = excluding == null ? null : key(excluding);
        List<Presence> result = new ArrayList<>();
        for (Map.Entry<String, Presence> entry : entries.entrySet())
        {
            if (entry.getValue().roomId() == roomId && !entry.getKey().equals(excludedKey))
            {
                result.add(entry.getValue());
            }
        }
        result.sort(Comparator.comparing(Presence::identity, String.CASE_INSENSITIVE_ORDER));
        return result;
    }

    public Collection<Presence> all()
    {
        return Collections.unmodifiableCollection(entries.values());
    }

    public int size()
    {
        return entries.size();
    }

    private static String key(String identity)
    {
        return identity.trim().toLowerCase(Locale.ROOT);
    }
}
