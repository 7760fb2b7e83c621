package org.abstractica.textworld.world.server;

import org.abstractica.textworld.world.protocol.ActorView;
import org.abstractica.textworld.world.protocol.Direction;
import org.abstractica.textworld.world.protocol.ItemView;
import org.abstractica.textworld.world.protocol.MapCell;
import org.abstractica.textworld.world.protocol.RoomSnapshot;
import org.abstractica.textworld.world.protocol.ServerMessage;
import org.abstractica.textworld.world.server.npc.ActorInstance;
import org.abstractica.textworld.world.server.npc.ActorState;
import org.abstractica.textworld.world.server.presence.PresenceRegistry;
import org.abstractica.textworld.world.server.store.WorldStores;
import org.abstractica.textworld.world.server.topology.MovementResolver;
import org.abstractica.textworld.world.server.world.MapBounds;
import org.abstractica.textworld.world.server.world.Room;
import org.abstractica.textworld.world.server.world.WorldMap;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the room and map views sent to players.
 */
public class RoomSnapshots
{
    private final WorldStores stores;
    private final PresenceRegistry presence;
    private final MovementResolver resolver;

    public RoomSnapshots(WorldStores stores, PresenceRegistry presence, MovementResolver resolver)
    {
        this.stores = Objects.requireNonNull(stores, "stores");
        this.presence = Objects.requireNonNull(presence, "presence");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    /**
     * Describes a room as seen by one player.
     *
     * @param room      the room
     * @param viewer    player to leave out of the player list, may be null
     * @param nowMs     current time, for actor status labels
     */
    public RoomSnapshot snapshot(Room room, String viewer, long nowMs)
    {
        Objects.requireNonNull(room, "room");
        String mapName = stores.topology().getMapById(room.mapId()).map(WorldMap::name).orElse("");

        List<ActorInstance> present = new ArrayList<>(stores.actors().getActorsInRoom(room.id()));
        present.sort(Comparator.comparingInt(ActorInstance::slot).thenComparingLong(ActorInstance::instanceId));
        List<ActorView> actors = new ArrayList<>();
        for (ActorInstance actor : present)
        {
            actors.add(new ActorView(actor.instanceId(), actor.name(), ActorState.statusLabel(actor.state(), nowMs)));
        }

        List<String> exits = new ArrayList<>();
        for (Direction direction : resolver.openExits(room))
        {
            exits.add(direction.code());
        }

        return new RoomSnapshot(room.id(), room.mapId(), mapName, room.name(), room.description(), room.x(), room.y(),
                List.copyOf(presence.occupantsOf(room.id(), viewer)), actors, groundItems(room.id()), exits);
    }

    /**
     * Items lying in a room, sorted by name.
     */
    public List<ItemView> groundItems(long roomId)
    {
        List<ItemView> items = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : stores.inventory().getItems(roomId).entrySet())
        {
            items.add(new ItemView(entry.getKey(), entry.getValue()));
        }
        return items;
    }

    /**
     * All rooms of a map.
     *
     * @throws IllegalArgumentException if the map is unknown
     */
    public ServerMessage.MapData mapData(long mapId)
    {
        WorldMap map = stores.topology().getMapById(mapId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown map: " + mapId));
        List<Room> rooms = stores.topology().getRoomsByMap(mapId);
        MapBounds bounds = MapBounds.of(rooms);
        List<MapCell> cells = new ArrayList<>();
        for (Room room : rooms)
        {
            cells.add(new MapCell(room.id(), room.name(), room.x(), room.y(), room.roomType(), room.portal() != null));
        }
        return new ServerMessage.MapData(map.id(), map.name(), bounds.minX(), bounds.maxX(), bounds.minY(),
                bounds.maxY(), cells);
    }
}
