package org.abstractica.textworld.world.protocol;

/**
 * One room of a map as sent for map rendering.
 */
public record MapCell(long roomId, String name, int x, int y, String roomType, boolean portal)
{
}
