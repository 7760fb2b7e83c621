package org.abstractica.textworld.world.server.seed;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.abstractica.textworld.world.protocol.Direction;
import org.abstractica.textworld.world.server.npc.ActorBehaviors;
import org.abstractica.textworld.world.server.npc.ActorInstance;
import org.abstractica.textworld.world.server.store.InMemoryActorStore;
import org.abstractica.textworld.world.server.store.InMemoryInventoryStore;
import org.abstractica.textworld.world.server.store.InMemoryPlayerStore;
import org.abstractica.textworld.world.server.store.InMemoryRouteStore;
import org.abstractica.textworld.world.server.store.InMemoryTopologyStore;
import org.abstractica.textworld.world.server.store.WorldStores;
import org.abstractica.textworld.world.server.world.PlayerRecord;
import org.abstractica.textworld.world.server.world.Portal;
import org.abstractica.textworld.world.server.world.Room;
import org.abstractica.textworld.world.server.world.WorldMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads a world seed document and fills in-memory stores from it.
 *
 * <pre>{@code
 * WorldStores stores = new WorldSeedLoader().populate(WorldSeedLoader.readDefault());
 * }</pre>
 */
public class WorldSeedLoader
{
    private static final Logger LOG = LoggerFactory.getLogger(WorldSeedLoader.class);

    public static final String DEFAULT_RESOURCE = "world.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ActorBehaviors behaviors;

    public WorldSeedLoader()
    {
        this(ActorBehaviors.defaults());
    }

    public WorldSeedLoader(ActorBehaviors behaviors)
    {
        this.behaviors = Objects.requireNonNull(behaviors, "behaviors");
    }

    // ========== Reading ==========

    public static WorldSeed read(InputStream in) throws IOException
    {
        Objects.requireNonNull(in, "in");
        return MAPPER.readValue(in, WorldSeed.class);
    }

    public static WorldSeed read(Path file) throws IOException
    {
        try (InputStream in = Files.newInputStream(file))
        {
            return read(in);
        }
    }

    /**
     * Reads the bundled world.
     *
     * @throws IllegalStateException if the resource is missing
     */
    public static WorldSeed readDefault()
    {
        try (InputStream in = WorldSeedLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE))
        {
            if (in == null)
            {
                throw new IllegalStateException("Missing resource " + DEFAULT_RESOURCE);
            }
            return read(in);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException("Cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    // ========== Populating ==========

    /**
     * Builds fresh stores holding the seeded world.
     *
     * @param seed the seed
     * @return the stores
     * @throws IllegalArgumentException if the seed is inconsistent, such as a
     *         room on an unknown map or an actor in an unknown room
     */
    public WorldStores populate(WorldSeed seed)
    {
        Objects.requireNonNull(seed, "seed");
        InMemoryTopologyStore topology = new InMemoryTopologyStore();
        InMemoryActorStore actors = new InMemoryActorStore();
        InMemoryInventoryStore inventory = new InMemoryInventoryStore();
        InMemoryPlayerStore players = new InMemoryPlayerStore();

        for (WorldSeed.MapSeed map : seed.maps())
        {
            topology.addMap(new WorldMap(map.id(), map.name(), map.description()));
        }
        for (WorldSeed.RoomSeed room : seed.rooms())
        {
            topology.addRoom(toRoom(room));
        }
        for (WorldSeed.ActorSeed actor : seed.actors())
        {
            actors.addActor(toActor(actor, topology));
        }
        for (WorldSeed.PlayerSeed player : seed.players())
        {
            if (topology.getRoomById(player.roomId()).isEmpty())
            {
                LOG.warn("Player {} starts in unknown room {}", player.name(), player.roomId());
            }
            players.addPlayer(new PlayerRecord(player.name(), player.roomId()));
        }
        for (WorldSeed.ItemSeed item : seed.items())
        {
            requireRoom(topology, item.roomId(), "item " + item.name());
            inventory.addItem(item.roomId(), item.name(), item.quantity());
        }

        LOG.info("Loaded world: {} maps, {} rooms, {} actors, {} players",
                seed.maps().size(), topology.roomCount(), seed.actors().size(), seed.players().size());
        return new WorldStores(topology, actors, inventory, players, new InMemoryRouteStore());
    }

    private static Room toRoom(WorldSeed.RoomSeed seed)
    {
        Portal portal = null;
        if (seed.portal() != null)
        {
            WorldSeed.PortalSeed p = seed.portal();
            portal = new Portal(Direction.fromCode(p.direction()), p.targetMapId(), p.targetX(), p.targetY());
        }
        return new Room(seed.id(), seed.mapId(), seed.x(), seed.y(), seed.name(), seed.description(),
                seed.roomType(), portal);
    }

    private ActorInstance toActor(WorldSeed.ActorSeed seed, InMemoryTopologyStore topology)
    {
        requireRoom(topology, seed.roomId(), "actor " + seed.name());
        String type = seed.type() == null ? ActorBehaviors.RHYTHM : seed.type();
        if (!behaviors.isKnownType(type))
        {
            LOG.warn("Actor {} has unknown type {}, it will only count cycles", seed.name(), type);
        }
        return new ActorInstance(
                seed.instanceId(),
                seed.npcId() == null ? seed.instanceId() : seed.npcId(),
                seed.roomId(),
                seed.name(),
                seed.description(),
                type,
                seed.baseCycleTime() == null ? ActorInstance.DEFAULT_BASE_CYCLE_TIME : seed.baseCycleTime(),
                seed.harvestableTime() == null ? ActorInstance.DEFAULT_HARVESTABLE_TIME : seed.harvestableTime(),
                seed.cooldownTime() == null ? ActorInstance.DEFAULT_COOLDOWN_TIME : seed.cooldownTime(),
                seed.outputItems(),
                seed.state(),
                0,
                seed.active() == null || seed.active(),
                seed.slot() == null ? 0 : seed.slot());
    }

    private static void requireRoom(InMemoryTopologyStore topology, long roomId, String what)
    {
        if (topology.getRoomById(roomId).isEmpty())
        {
            throw new IllegalArgumentException("Unknown room " + roomId + " for " + what);
        }
    }
}
