package org.abstractica.textworld.world.server.world;

import java.util.Collection;

/**
 * Smallest rectangle holding every room of a map.
 */
public record MapBounds(int minX, int maxX, int minY, int maxY)
{
    public static final MapBounds EMPTY = new MapBounds(0, 0, 0, 0);

    public int width()
    {
        return maxX - minX + 1;
    }

    public int height()
    {
        return maxY - minY + 1;
    }

    public static MapBounds of(Collection<Room> rooms)
    {
        if (rooms.isEmpty())
        {
            return EMPTY;
        }
        int minX = Integer.MAX_VALUE;
        int maxX = Integer.MIN_VALUE;
        int minY = Integer.MAX_VALUE;
        int maxY = Integer.MIN_VALUE;
        for (Room room : rooms)
        {
            minX = Math.min(minX, room.x());
            maxX = Math.max(maxX, room.x());
            minY = Math.min(minY, room.y());
            maxY = Math.max(maxY, room.y());
        }
        return new MapBounds(minX, maxX, minY, maxY);
    }
}
