package org.abstractica.textworld.world.protocol;

import java.util.List;

/**
 * Everything a player sees on entering or looking around a room.
 *
 * @param roomId      room id
 * @param mapId       id of the map the room belongs to
 * @param mapName     name of that map
 * @param name        room name
 * @param description room description
 * @param x           grid x coordinate
 * @param y           grid y coordinate
 * @param players     other players present, sorted by name
 * @param actors      actors present, in slot order
 * @param items       items on the ground
 * @param exits       open exits as short codes, in compass order
 */
public record RoomSnapshot(
        long roomId,
        long mapId,
        String mapName,
        String name,
        String description,
        int x,
        int y,
        List<String> players,
        List<ActorView> actors,
        List<ItemView> items,
        List<String> exits
)
{
}
