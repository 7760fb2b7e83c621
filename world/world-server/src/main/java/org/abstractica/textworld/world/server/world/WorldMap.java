package org.abstractica.textworld.world.server.world;

import java.util.Objects;

/**
 * A named map holding a set of rooms on its own coordinate grid.
 *
 * @param id          map id
 * @param name        unique map name
 * @param description map description
 */
public record WorldMap(long id, String name, String description)
{
    public WorldMap
    {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
    }
}
