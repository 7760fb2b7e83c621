package org.abstractica.textworld.world.protocol;

/**
 * A stack of items lying in a room.
 */
public record ItemView(String name, int quantity)
{
}
