package org.abstractica.textworld.world.server.store;

import org.abstractica.textworld.world.server.world.Room;
import org.abstractica.textworld.world.server.world.WorldMap;

import java.util.List;
import java.util.Optional;

/**
 * Read access to maps and rooms.
 *
 * <p>Topology does not change while the world is running. Implementations
 * must be safe for concurrent readers.</p>
 */
public interface TopologyStore
{
    Optional<Room> getRoomById(long roomId);

    /**
     * Looks up the room at a grid position.
     *
     * @param mapId the map
     * @param x     grid x
     * @param y     grid y
     * @return the room, or empty if no room is there
     */
    Optional<Room> getRoomByCoords(long mapId, int x, int y);

    List<Room> getRoomsByMap(long mapId);

    Optional<WorldMap> getMapById(long mapId);

    Optional<WorldMap> getMapByName(String name);

    List<WorldMap> getAllMaps();
}
