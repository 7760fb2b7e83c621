package org.abstractica.textworld.world.server.seed;

import java.util.List;
import java.util.Map;

/**
 * Contents of a world seed document.
 *
 * <p>Missing lists are read as empty. Optional numbers are boxed so the
 * loader can tell an absent value from zero.</p>
 */
public record WorldSeed(
        List<MapSeed> maps,
        List<RoomSeed> rooms,
        List<ActorSeed> actors,
        List<PlayerSeed> players,
        List<ItemSeed> items
)
{
    public WorldSeed
    {
        maps = maps == null ? List.of() : List.copyOf(maps);
        rooms = rooms == null ? List.of() : List.copyOf(rooms);
        actors = actors == null ? List.of() : List.copyOf(actors);
        players = players == null ? List.of() : List.copyOf(players);
        items = items == null ? List.of() : List.copyOf(items);
    }

    public record MapSeed(long id, String name, String description) {}

    /**
     * @param roomType defaults to {@code normal}
     * @param portal   may be null
     */
    public record RoomSeed(long id, long mapId, int x, int y, String name, String description, String roomType,
                           PortalSeed portal) {}

    /**
     * @param direction compass code or name, such as {@code "N"} or {@code "north"}
     */
    public record PortalSeed(String direction, long targetMapId, int targetX, int targetY) {}

    public record ActorSeed(
            long instanceId,
            Long npcId,
            long roomId,
            String name,
            String description,
            String type,
            Long baseCycleTime,
            Long harvestableTime,
            Long cooldownTime,
            Map<String, Integer> outputItems,
            Map<String, Object> state,
            Boolean active,
            Integer slot
    ) {}

    public record PlayerSeed(String name, long roomId) {}

    public record ItemSeed(long roomId, String name, int quantity) {}
}
