package org.abstractica.textworld.world.server.store;

import org.abstractica.textworld.world.server.world.Room;
import org.abstractica.textworld.world.server.world.WorldMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Topology held in memory.
 *
 * <p>Rooms are unique by (map, x, y); adding a second room at the same
 * position is rejected.</p>
 */
public class InMemoryTopologyStore implements TopologyStore
{
    private static final Logger LOG = LoggerFactory.getLogger(InMemoryTopologyStore.class);

    private record Coordinates(long mapId, int x, int y) {}

    private final Map<Long, WorldMap> maps = new ConcurrentHashMap<>();
    private final Map<String, WorldMap> mapsByName = new ConcurrentHashMap<>();
    private final Map<Long, Room> rooms = new ConcurrentHashMap<>();
    private final Map<Coordinates, Room> roomsByCoords = new ConcurrentHashMap<>();

    /**
     * Adds a map.
     *
     * @throws IllegalArgumentException if the id or name is taken
     */
    public synchronized void addMap(WorldMap map)
    {
        Objects.requireNonNull(map, "map");
        String key = map.name().toLowerCase(Locale.ROOT);
        if (maps.containsKey(map.id()) || mapsByName.containsKey(key))
        {
            throw new IllegalArgumentException("Duplicate map: " + map.id() + " " + map.name());
        }
        maps.put(map.id(), map);
        mapsByName.put(key, map);
    }

    /**
     * Adds a room.
     *
     * @throws IllegalArgumentException if the map is unknown, the id is taken
     *                                  or another room holds the same position
     */
    public synchronized void addRoom(Room room)
    {
        Objects.requireNonNull(room, "room");
        if (!maps.containsKey(room.mapId()))
        {
            throw new IllegalArgumentException("Unknown map " + room.mapId() + " for room " + room.id());
        }
        if (rooms.containsKey(room.id()))
        {
            throw new IllegalArgumentException("Duplicate room id: " + room.id());
        }
        Coordinates coordinates = new Coordinates(room.mapId(), room.x(), room.y());
        Room existing = roomsByCoords.get(coordinates);
        if (existing != null)
        {
            throw new IllegalArgumentException("Room " + room.id() + " collides with room " + existing.id()
                    + " at map " + room.mapId() + " (" + room.x() + ", " + room.y() + ")");
        }
        rooms.put(room.id(), room);
        roomsByCoords.put(coordinates, room);
        LOG.debug("Added room {} '{}' at map {} ({}, {})", room.id(), room.name(), room.mapId(), room.x(), room.y());
    }

    @Override
    public Optional<Room> getRoomById(long roomId)
    {
        return Optional.ofNullable(rooms.get(roomId));
    }

    @Override
    public Optional<Room> getRoomByCoords(long mapId, int x, int y)
    {
        return Optional.ofNullable(roomsByCoords.get(new Coordinates(mapId, x, y)));
    }

    @Override
    public List<Room> getRoomsByMap(long mapId)
    {
        List<Room> result = new ArrayList<>();
        for (Room room : rooms.values())
        {
            if (room.mapId() == mapId)
            {
                result.add(room);
            }
        }
        result.sort(Comparator.comparingInt(Room::y).reversed().thenComparingInt(Room::x));
        return result;
    }

    @Override
    public Optional<WorldMap> getMapById(long mapId)
    {
        return Optional.ofNullable(maps.get(mapId));
    }

    @Override
    public Optional<WorldMap> getMapByName(String name)
    {
        if (name == null)
        {
            return Optional.empty();
        }
        return Optional.ofNullable(mapsByName.get(name.toLowerCase(Locale.ROOT)));
    }

    @Override
    public List<WorldMap> getAllMaps()
    {
        List<WorldMap> result = new ArrayList<>(maps.values());
        result.sort(Comparator.comparingLong(WorldMap::id));
        return result;
    }

    public int roomCount()
    {
        return rooms.size();
    }
}
