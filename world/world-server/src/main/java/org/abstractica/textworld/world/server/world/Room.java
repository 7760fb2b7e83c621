package org.abstractica.textworld.world.server.world;

import org.abstractica.textworld.world.protocol.Direction;

import java.util.Objects;
import java.util.Optional;

/**
 * A room at grid position (x, y) on one map.
 *
 * @param id          room id
 * @param mapId       owning map
 * @param x           grid x, growing east
 * @param y           grid y, growing north
 * @param name        room name
 * @param description room description
 * @param roomType    room type tag, {@code "normal"} unless set
 * @param portal      the room's outbound portal, or null
 */
public record Room(long id, long mapId, int x, int y, String name, String description, String roomType, Portal portal)
{
    public static final String DEFAULT_TYPE = "normal";

    public Room
    {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        roomType = roomType == null || roomType.isBlank() ? DEFAULT_TYPE : roomType;
    }

    public Optional<Portal> findPortal()
    {
        return Optional.ofNullable(portal);
    }

    public boolean hasPortalTowards(Direction direction)
    {
        return portal != null && portal.direction() == direction;
    }
}
