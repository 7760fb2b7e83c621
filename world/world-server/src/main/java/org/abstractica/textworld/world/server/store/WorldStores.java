package org.abstractica.textworld.world.server.store;

import java.util.Objects;

/**
 * The set of stores a running world reads and writes.
 */
public record WorldStores(
        TopologyStore topology,
        ActorStore actors,
        InventoryStore inventory,
        PlayerStore players,
        RouteStore routes
)
{
    public WorldStores
    {
        Objects.requireNonNull(topology, "topology");
        Objects.requireNonNull(actors, "actors");
        Objects.requireNonNull(inventory, "inventory");
        Objects.requireNonNull(players, "players");
        Objects.requireNonNull(routes, "routes");
    }
}
