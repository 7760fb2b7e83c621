package org.abstractica.textworld.world.server.world;

import org.abstractica.textworld.world.protocol.Direction;

import java.util.Objects;

/**
 * One-way link from a room to a room on another map (or elsewhere on the
 * same map).
 *
 * <p>Portals are never mirrored: the target room gets no link back unless it
 * declares its own portal.</p>
 *
 * @param direction   direction the portal is taken in
 * @param targetMapId map of the target room
 * @param targetX     x of the target room
 * @param targetY     y of the target room
 */
public record Portal(Direction direction, long targetMapId, int targetX, int targetY)
{
    public Portal
    {
        Objects.requireNonNull(direction, "direction");
        if (direction.isVertical())
        {
            throw new IllegalArgumentException("Portals must be horizontal: " + direction);
        }
    }
}
