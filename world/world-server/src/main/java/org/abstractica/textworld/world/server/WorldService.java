package org.abstractica.textworld.world.server;

import org.abstractica.textworld.Connection;
import org.abstractica.textworld.world.protocol.Direction;
import org.abstractica.textworld.world.protocol.RouteMode;
import org.abstractica.textworld.world.protocol.RouteStepView;
import org.abstractica.textworld.world.protocol.RouteSummary;
import org.abstractica.textworld.world.protocol.ServerMessage;
import org.abstractica.textworld.world.server.broadcast.RoomBroadcaster;
import org.abstractica.textworld.world.server.navigation.GuidedNavigator;
import org.abstractica.textworld.world.server.navigation.NavigationSettings;
import org.abstractica.textworld.world.server.navigation.PathFinder;
import org.abstractica.textworld.world.server.navigation.Route;
import org.abstractica.textworld.world.server.navigation.RouteRejectedException;
import org.abstractica.textworld.world.server.navigation.RouteStep;
import org.abstractica.textworld.world.server.navigation.SavedRoute;
import org.abstractica.textworld.world.server.navigation.StepScheduler;
import org.abstractica.textworld.world.server.npc.ActorInstance;
import org.abstractica.textworld.world.server.npc.CycleScheduler;
import org.abstractica.textworld.world.server.presence.DuplicatePresenceException;
import org.abstractica.textworld.world.server.presence.Presence;
import org.abstractica.textworld.world.server.presence.PresenceRegistry;
import org.abstractica.textworld.world.server.store.WorldStores;
import org.abstractica.textworld.world.server.topology.MovementResolver;
import org.abstractica.textworld.world.server.world.PlayerRecord;
import org.abstractica.textworld.world.server.world.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Player commands against the live world.
 *
 * <p>Every operation answers the acting player through the
 * {@link RoomBroadcaster} and tells bystanders what they can see. Failures
 * the player caused are answered with a message to that player only; nothing
 * here throws for bad input.</p>
 */
public class WorldService
{
    private static final Logger LOG = LoggerFactory.getLogger(WorldService.class);

    private final WorldStores stores;
    private final PresenceRegistry presence;
    private final RoomBroadcaster broadcaster;
    private final CycleScheduler scheduler;
    private final GameMessages messages;
    private final LongSupplier clock;
    private final MovementResolver resolver;
    private final PathFinder pathFinder;
    private final RoomSnapshots snapshots;
    private final GuidedNavigator navigator;

    public WorldService(
            WorldStores stores,
            PresenceRegistry presence,
            RoomBroadcaster broadcaster,
            CycleScheduler scheduler,
            StepScheduler stepScheduler,
            NavigationSettings settings,
            GameMessages messages,
            LongSupplier clock
    )
    {
        this.stores = Objects.requireNonNull(stores, "stores");
        this.presence = Objects.requireNonNull(presence, "presence");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.messages = Objects.requireNonNull(messages, "messages");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.resolver = new MovementResolver(stores.topology());
        this.pathFinder = new PathFinder(stores.topology(), resolver);
        this.snapshots = new RoomSnapshots(stores, presence, resolver);
        this.navigator = new GuidedNavigator(broadcaster, pathFinder, stepScheduler,
                (identity, direction) -> move(identity, direction, MoveOrigin.GUIDED), settings, messages);
    }

    public GuidedNavigator getNavigator()
    {
        return navigator;
    }

    public MovementResolver getResolver()
    {
        return resolver;
    }

    // ========== Presence ==========

    /**
     * Enters the world as a stored player.
     *
     * @param connection the requesting connection
     * @param playerName name as typed
     * @return the canonical player name if accepted
     */
    public Optional<String> selectIdentity(Connection connection, String playerName)
    {
        Objects.requireNonNull(connection, "connection");
        String requested = playerName == null ? "" : playerName.trim();
        Optional<PlayerRecord> player = requested.isEmpty()
                ? Optional.empty()
                : stores.players().getPlayerByName(requested);
        if (player.isEmpty())
        {
            return reject(connection, messages.format("identity.unknown", requested));
        }
        String name = player.get().name();
        Optional<Room> room = stores.topology().getRoomById(player.get().roomId());
        if (room.isEmpty())
        {
            return reject(connection, messages.format("identity.noRoom", name));
        }

        try
        {
            presence.register(name, connection, room.get().id());
        }
        catch (DuplicatePresenceException e)
        {
            return reject(connection, messages.format("identity.taken", name));
        }

        LOG.info("{} entered the world in room {} (connection {})", name, room.get().id(), connection.getId());
        broadcaster.sendTo(name, new ServerMessage.IdentityAccepted(name,
                snapshots.snapshot(room.get(), name, clock.getAsLong()), snapshots.mapData(room.get().mapId())));
        broadcaster.broadcast(room.get().id(), new ServerMessage.PeerJoined(room.get().id(), name,
                messages.format("player.enteredGame", name)), name);
        return Optional.of(name);
    }

    private Optional<String> reject(Connection connection, String reason)
    {
        LOG.warn("Rejected identity on connection {}: {}", connection.getId(), reason);
        connection.trySend(new ServerMessage.IdentityRejected(reason));
        return Optional.empty();
    }

    /**
     * Removes a player whose connection has gone. A presence now held by
     * another connection is left alone.
     */
    public void disconnect(String identity, Connection connection)
    {
        Optional<Presence> removed = presence.unregister(identity, connection);
        if (removed.isEmpty())
        {
            return;
        }
        String name = removed.get().identity();
        navigator.discard(name);
        scheduler.interruptHarvest(name);
        long roomId = removed.get().roomId();
        broadcaster.broadcast(roomId, new ServerMessage.PeerLeft(roomId, name,
                messages.format("player.leftGame", name)), name);
        LOG.info("{} left the world from room {}", name, roomId);
    }

    // ========== Movement ==========

    /**
     * Moves a player by typed direction.
     */
    public void move(String identity, String directionText)
    {
        String text = directionText == null ? "" : directionText.trim();
        Optional<Direction> direction = Direction.parse(text);
        if (direction.isEmpty())
        {
            broadcaster.sendTo(identity, new ServerMessage.MoveBlocked(text, messages.format("move.invalid", text)));
            return;
        }
        move(identity, direction.get(), MoveOrigin.MANUAL);
    }

    /**
     * Moves a player one step and tells everyone concerned.
     *
     * <p>A manual move stops any running route before stepping.</p>
     *
     * @return where the step led
     * @throws IllegalStateException if the player is not in the world
     */
    public MovementResolver.Resolution move(String identity, Direction direction, MoveOrigin origin)
    {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(origin, "origin");
        Presence mover = requirePresence(identity);
        Room from = requireRoom(mover.roomId());
        String name = mover.identity();

        if (origin == MoveOrigin.MANUAL)
        {
            navigator.onManualMove(name);
        }

        MovementResolver.Resolution resolution = resolver.resolveMove(from, direction);
        if (resolution instanceof MovementResolver.Resolution.Moved moved)
        {
            Room to = moved.to();
            if (!presence.compareAndMove(name, from.id(), to.id()))
            {
                reportBlocked(name, origin, direction, messages.format("move.concurrent"));
                return new MovementResolver.Resolution.Blocked(direction, false);
            }
            stores.players().updatePlayerRoom(name, to.id());
            scheduler.interruptHarvest(name);

            broadcaster.broadcast(from.id(), new ServerMessage.PeerLeft(from.id(), name,
                    messages.format("player.leftTo", name, direction.displayName())), name);
            broadcaster.broadcast(to.id(), new ServerMessage.PeerJoined(to.id(), name,
                    messages.format("player.entersFrom", name, direction.opposite().displayName())), name);
            broadcaster.sendTo(name, new ServerMessage.Moved(direction.code(),
                    snapshots.snapshot(to, name, clock.getAsLong()), moved.mapTransition()));
            if (moved.mapTransition())
            {
                broadcaster.sendTo(name, snapshots.mapData(to.mapId()));
            }
            LOG.debug("{} moved {} from room {} to room {}", name, direction.code(), from.id(), to.id());
        }
        else if (resolution instanceof MovementResolver.Resolution.Blocked blocked)
        {
            if (blocked.stalePortal())
            {
                LOG.warn("Portal {} of room {} leads to a missing room", direction.code(), from.id());
            }
            // A dead portal reads the same as a wall
            reportBlocked(name, origin, direction, messages.format("move.wall", direction.displayName()));
        }
        else
        {
            reportBlocked(name, origin, direction, messages.format("move.vertical"));
        }
        return resolution;
    }

    /**
     * Tells a player their step went nowhere. Guided steps stay quiet; the
     * navigator reports the failed route instead.
     */
    private void reportBlocked(String name, MoveOrigin origin, Direction direction, String text)
    {
        if (origin == MoveOrigin.MANUAL)
        {
            broadcaster.sendTo(name, new ServerMessage.MoveBlocked(direction.code(), text));
        }
    }

    // ========== Room interaction ==========

    /**
     * Looks around the room, or at the actors whose name contains the target.
     */
    public void look(String identity, String target)
    {
        Presence viewer = requirePresence(identity);
        Room room = requireRoom(viewer.roomId());
        if (target == null || target.isBlank())
        {
            broadcaster.sendTo(viewer.identity(), new ServerMessage.RoomState(
                    snapshots.snapshot(room, viewer.identity(), clock.getAsLong())));
            return;
        }
        List<ActorInstance> matches = findActors(room.id(), target);
        if (matches.isEmpty())
        {
            broadcaster.sendTo(viewer.identity(), new ServerMessage.Error(messages.format("look.notHere", target.trim())));
            return;
        }
        for (ActorInstance actor : matches)
        {
            broadcaster.sendTo(viewer.identity(), new ServerMessage.Description(actor.name(), actor.description()));
        }
    }

    /**
     * Speaks to everyone in the room, the speaker included.
     */
    public void say(String identity, String text)
    {
        Presence speaker = requirePresence(identity);
        if (text == null || text.isBlank())
        {
            broadcaster.sendTo(speaker.identity(), new ServerMessage.Error(messages.format("say.empty")));
            return;
        }
        broadcaster.broadcast(speaker.roomId(),
                new ServerMessage.RoomMessage(speaker.roomId(), speaker.identity(), text.trim()), null);
    }

    /**
     * Asks to harvest the first actor in the room whose name contains the
     * target. The request is checked and applied on the next scheduler tick.
     */
    public void harvest(String identity, String target)
    {
        Presence harvester = requirePresence(identity);
        String text = target == null ? "" : target.trim();
        List<ActorInstance> matches = text.isEmpty() ? List.of() : findActors(harvester.roomId(), text);
        if (matches.isEmpty())
        {
            broadcaster.sendTo(harvester.identity(), new ServerMessage.Error(messages.format("look.notHere", text)));
            return;
        }
        scheduler.requestHarvest(harvester.identity(), harvester.roomId(), matches.get(0).instanceId());
    }

    private List<ActorInstance> findActors(long roomId, String target)
    {
        String needle = target.trim().toLowerCase(Locale.ROOT);
        List<ActorInstance> matches = new ArrayList<>();
        for (ActorInstance actor : stores.actors().getActorsInRoom(roomId))
        {
            if (actor.name().toLowerCase(Locale.ROOT).contains(needle))
            {
                matches.add(actor);
            }
        }
        matches.sort((a, b) -> Integer.compare(a.slot(), b.slot()));
        return matches;
    }

    // ========== Routes ==========

    /**
     * Sends the shortest route to a room without walking it.
     */
    public void computeRoute(String identity, long destinationRoomId)
    {
        Presence player = requirePresence(identity);
        Optional<Route> route = pathFinder.shortestPath(player.roomId(), destinationRoomId);
        if (route.isEmpty())
        {
            broadcaster.sendTo(player.identity(), new ServerMessage.Error(messages.format("route.noPath")));
            return;
        }
        List<RouteStepView> steps = new ArrayList<>();
        for (RouteStep step : route.get().steps())
        {
            String roomName = stores.topology().getRoomById(step.roomId()).map(Room::name).orElse("");
            steps.add(new RouteStepView(step.direction().code(), step.roomId(), roomName));
        }
        broadcaster.sendTo(player.identity(), new ServerMessage.RouteComputed(destinationRoomId, steps));
    }

    /**
     * Walks the shortest route to a room.
     */
    public void startRoute(String identity, long destinationRoomId)
    {
        Presence player = requirePresence(identity);
        String name = stores.topology().getRoomById(destinationRoomId)
                .map(Room::name)
                .orElse(messages.format("route.destination"));
        try
        {
            navigator.startDestination(player.identity(), player.roomId(), destinationRoomId, name);
        }
        catch (RouteRejectedException e)
        {
            broadcaster.sendTo(player.identity(), new ServerMessage.Error(e.getMessage()));
        }
    }

    /**
     * Records a route starting in the player's current room. Each direction
     * must lead somewhere from the room the previous one reached, and a loop
     * must come back to where it started.
     */
    public void saveRoute(String identity, String name, RouteMode mode, List<String> directions)
    {
        Presence player = requirePresence(identity);
        String owner = player.identity();
        if (name == null || name.isBlank())
        {
            broadcaster.sendTo(owner, new ServerMessage.Error(messages.format("route.emptyName")));
            return;
        }
        if (directions == null || directions.isEmpty())
        {
            broadcaster.sendTo(owner, new ServerMessage.Error(messages.format("route.noSteps")));
            return;
        }
        RouteMode routeMode = mode == null ? RouteMode.PATH : mode;

        Room origin = requireRoom(player.roomId());
        Room current = origin;
        List<RouteStep> steps = new ArrayList<>();
        for (int i = 0; i < directions.size(); i++)
        {
            String text = directions.get(i) == null ? "" : directions.get(i).trim();
            Optional<Direction> direction = Direction.parse(text);
            MovementResolver.Resolution resolution = direction.isPresent()
                    ? resolver.resolveMove(current, direction.get())
                    : null;
            if (!(resolution instanceof MovementResolver.Resolution.Moved moved))
            {
                broadcaster.sendTo(owner, new ServerMessage.Error(messages.format("route.stepBlocked", i + 1, text)));
                return;
            }
            steps.add(new RouteStep(direction.get(), moved.to().id()));
            current = moved.to();
        }
        if (routeMode == RouteMode.LOOP && current.id() != origin.id())
        {
            broadcaster.sendTo(owner, new ServerMessage.Error(messages.format("route.loopNotClosed")));
            return;
        }

        SavedRoute saved = stores.routes().saveRoute(new SavedRoute(0, owner, name.trim(), routeMode, origin.id(), steps));
        LOG.info("{} saved {} route {} ({} steps)", owner, routeMode, saved.name(), steps.size());
        broadcaster.sendTo(owner, new ServerMessage.RouteSaved(summarize(saved)));
    }

    public void listRoutes(String identity)
    {
        Presence player = requirePresence(identity);
        List<RouteSummary> summaries = new ArrayList<>();
        for (SavedRoute route : stores.routes().getRoutesByOwner(player.identity()))
        {
            summaries.add(summarize(route));
        }
        broadcaster.sendTo(player.identity(), new ServerMessage.RouteList(summaries));
    }

    /**
     * Walks one of the player's saved routes.
     */
    public void startSavedRoute(String identity, long routeId)
    {
        Presence player = requirePresence(identity);
        Optional<SavedRoute> route = stores.routes().getRouteById(routeId);
        if (route.isEmpty() || !route.get().owner().equalsIgnoreCase(player.identity()))
        {
            LOG.warn("{} asked for route {} they do not own", player.identity(), routeId);
            broadcaster.sendTo(player.identity(), new ServerMessage.Error(messages.format("auth.denied")));
            return;
        }
        try
        {
            navigator.startSaved(player.identity(), player.roomId(), route.get());
        }
        catch (RouteRejectedException e)
        {
            broadcaster.sendTo(player.identity(), new ServerMessage.Error(e.getMessage()));
        }
    }

    public void pauseRoute(String identity)
    {
        Presence player = requirePresence(identity);
        try
        {
            navigator.pause(player.identity(), player.roomId());
        }
        catch (RouteRejectedException e)
        {
            broadcaster.sendTo(player.identity(), new ServerMessage.Error(e.getMessage()));
        }
    }

    public void continueRoute(String identity)
    {
        Presence player = requirePresence(identity);
        try
        {
            navigator.resume(player.identity(), player.roomId());
        }
        catch (RouteRejectedException e)
        {
            broadcaster.sendTo(player.identity(), new ServerMessage.Error(e.getMessage()));
        }
    }

    public void cancelRoute(String identity)
    {
        Presence player = requirePresence(identity);
        try
        {
            navigator.cancel(player.identity());
        }
        catch (RouteRejectedException e)
        {
            broadcaster.sendTo(player.identity(), new ServerMessage.Error(e.getMessage()));
        }
    }

    private RouteSummary summarize(SavedRoute route)
    {
        String originName = stores.topology().getRoomById(route.originRoomId()).map(Room::name).orElse("");
        return new RouteSummary(route.id(), route.name(), route.mode(), route.originRoomId(), originName,
                route.steps().size());
    }

    // ========== Lookups ==========

    private Presence requirePresence(String identity)
    {
        return presence.find(identity)
                .orElseThrow(() -> new IllegalStateException("Not in the world: " + identity));
    }

    private Room requireRoom(long roomId)
    {
        return stores.topology().getRoomById(roomId)
                .orElseThrow(() -> new IllegalStateException("Unknown room: " + roomId));
    }
}
