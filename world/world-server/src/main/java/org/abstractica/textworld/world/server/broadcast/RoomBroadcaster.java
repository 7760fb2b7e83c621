package org.abstractica.textworld.world.server.broadcast;

import org.abstractica.textworld.world.server.presence.Presence;
import org.abstractica.textworld.world.server.presence.PresenceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Delivers events to the players in a room.
 *
 * <p>Sends never block. A recipient whose queue is full, or whose send
 * throws, misses the event; nothing is retried and the caller is not told.</p>
 */
public class RoomBroadcaster
{
    private static final Logger LOG = LoggerFactory.getLogger(RoomBroadcaster.class);

    private final PresenceRegistry presence;

    public RoomBroadcaster(PresenceRegistry presence)
    {
        this.presence = Objects.requireNonNull(presence, "presence");
    }

    /**
     * Sends an event to everyone in a room.
     *
     * @param roomId    the room
     * @param event     the event
     * @param excluding identity to skip, may be null
     * @return number of recipients the event was queued for
     */
    public int broadcast(long roomId, Object event, String excluding)
    {
        Objects.requireNonNull(event, "event");
        int delivered = 0;
        for (Presence recipient : presence.presencesIn(roomId, excluding))
        {
            if (deliver(recipient, event))
            {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Sends an event to one player.
     *
     * @return true if queued
     */
    public boolean sendTo(String identity, Object event)
    {
        Objects.requireNonNull(event, "event");
        Optional<Presence> recipient = presence.find(identity);
        return recipient.isPresent() && deliver(recipient.get(), event);
    }

    private boolean deliver(Presence recipient, Object event)
    {
        try
        {
            if (recipient.connection().trySend(event))
            {
                return true;
            }
            LOG.debug("Dropped {} for {}: connection refused it", event.getClass().getSimpleName(),
                    recipient.identity());
        }
        catch (Exception e)
        {
            LOG.debug("Dropped {} for {}: {}", event.getClass().getSimpleName(), recipient.identity(),
                    e.toString());
        }
        return false;
    }
}
