package org.abstractica.textworld.world.server;

import org.abstractica.textworld.CloseReason;
import org.abstractica.textworld.Connection;
import org.abstractica.textworld.Protocol;
import org.abstractica.textworld.Server;
import org.abstractica.textworld.handlers.MessageHandler;
import org.abstractica.textworld.impl.protocol.JsonProtocol;
import org.abstractica.textworld.impl.session.TcpServerFactory;
import org.abstractica.textworld.world.protocol.ClientMessage;
import org.abstractica.textworld.world.protocol.ServerMessage;
import org.abstractica.textworld.world.server.broadcast.RoomBroadcaster;
import org.abstractica.textworld.world.server.navigation.ExecutorStepScheduler;
import org.abstractica.textworld.world.server.navigation.NavigationSettings;
import org.abstractica.textworld.world.server.npc.ActorBehaviors;
import org.abstractica.textworld.world.server.npc.CycleScheduler;
import org.abstractica.textworld.world.server.presence.Presence;
import org.abstractica.textworld.world.server.presence.PresenceRegistry;
import org.abstractica.textworld.world.server.seed.WorldSeed;
import org.abstractica.textworld.world.server.seed.WorldSeedLoader;
import org.abstractica.textworld.world.server.store.WorldStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Text world server: accepts players over TCP and runs the live world.
 *
 * <p>Wires the world stores, presence registry, actor scheduler and guided
 * navigation to a {@link Server}, registers one handler per client message
 * and offers a small console for operators.</p>
 */
public class WorldServerApp implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(WorldServerApp.class);

    private final Options options;
    private final Server server;
    private final PresenceRegistry presence;
    private final CycleScheduler scheduler;
    private final ExecutorStepScheduler stepScheduler;
    private final WorldService world;
    private final GameMessages messages;

    public WorldServerApp(Options options, WorldStores stores)
    {
        this.options = Objects.requireNonNull(options, "options");
        Objects.requireNonNull(stores, "stores");
        this.messages = GameMessages.loadDefault();
        this.presence = new PresenceRegistry();
        RoomBroadcaster broadcaster = new RoomBroadcaster(presence);
        this.scheduler = new CycleScheduler(stores.actors(), stores.inventory(), broadcaster,
                ActorBehaviors.defaults(), messages, options.tickInterval());
        this.stepScheduler = new ExecutorStepScheduler(2);
        this.world = new WorldService(stores, presence, broadcaster, scheduler, stepScheduler,
                new NavigationSettings(options.routeStepDelay(), options.savedStepDelay()), messages,
                System::currentTimeMillis);

        Protocol protocol = new JsonProtocol.Builder()
                .clientMessages(ClientMessage.class)
                .serverMessages(ServerMessage.class)
                .build();
        this.server = new TcpServerFactory().builder()
                .port(options.port())
                .protocol(protocol)
                .build();

        registerMessageHandlers();
        registerLifecycleCallbacks();
    }

    private void registerMessageHandlers()
    {
        server.onMessage(ClientMessage.SelectIdentity.class, this::handleSelectIdentity);
        server.onMessage(ClientMessage.Move.class, whenPlaying((name, move) -> world.move(name, move.direction())));
        server.onMessage(ClientMessage.Look.class, whenPlaying((name, look) -> world.look(name, look.target())));
        server.onMessage(ClientMessage.Say.class, whenPlaying((name, say) -> world.say(name, say.text())));
        server.onMessage(ClientMessage.Harvest.class,
                whenPlaying((name, harvest) -> world.harvest(name, harvest.target())));
        server.onMessage(ClientMessage.ComputeRoute.class,
                whenPlaying((name, route) -> world.computeRoute(name, route.destinationRoomId())));
        server.onMessage(ClientMessage.StartRoute.class,
                whenPlaying((name, route) -> world.startRoute(name, route.destinationRoomId())));
        server.onMessage(ClientMessage.SaveRoute.class,
                whenPlaying((name, route) -> world.saveRoute(name, route.name(), route.mode(), route.directions())));
        server.onMessage(ClientMessage.ListRoutes.class, whenPlaying((name, list) -> world.listRoutes(name)));
        server.onMessage(ClientMessage.StartSavedRoute.class,
                whenPlaying((name, route) -> world.startSavedRoute(name, route.routeId())));
        server.onMessage(ClientMessage.StopRoute.class, whenPlaying((name, stop) -> world.pauseRoute(name)));
        server.onMessage(ClientMessage.ContinueRoute.class, whenPlaying((name, cont) -> world.continueRoute(name)));
        server.onMessage(ClientMessage.CancelRoute.class, whenPlaying((name, cancel) -> world.cancelRoute(name)));

        server.onError((connection, message, exception) ->
        {
            if (message instanceof String line)
            {
                LOG.warn("Malformed message from {}: {}", connection.getId(), line);
                connection.trySend(new ServerMessage.Error(messages.format("error.malformed", exception.getMessage())));
                return;
            }
            LOG.error("Error handling message: connection={}, message={}", connection.getId(), message, exception);
            connection.trySend(new ServerMessage.Error(messages.format("error.internal")));
        });
    }

    private void registerLifecycleCallbacks()
    {
        server.onConnectionOpened(connection ->
        {
            LOG.info("New connection: {}", connection.getId());
            connection.setAttachment(new PlayerSession(connection.getId()));
        });

        server.onConnectionClosed(this::handleConnectionClosed);
    }

    private void handleConnectionClosed(Connection connection, CloseReason reason)
    {
        PlayerSession session = getPlayerSession(connection);
        if (session != null && session.hasIdentity())
        {
            LOG.info("Player disconnected: {} ({})", session.getIdentity(), reason);
            world.disconnect(session.getIdentity(), connection);
        }
        else
        {
            LOG.info("Connection closed: {} ({})", connection.getId(), reason);
        }
    }

    private void handleSelectIdentity(Connection connection, ClientMessage.SelectIdentity select)
    {
        PlayerSession session = getPlayerSession(connection);
        if (session == null)
        {
            LOG.warn("No player session for connection: {}", connection.getId());
            return;
        }
        if (session.hasIdentity())
        {
            connection.trySend(new ServerMessage.IdentityRejected(
                    messages.format("identity.already", session.getIdentity())));
            return;
        }
        world.selectIdentity(connection, select.playerName()).ifPresent(session::setIdentity);
    }

    /**
     * Wraps a handler so it only runs once the connection has selected a
     * player; otherwise the client is told to authenticate first.
     */
    private <T> MessageHandler<T> whenPlaying(BiConsumer<String, T> action)
    {
        return (connection, message) ->
        {
            PlayerSession session = getPlayerSession(connection);
            if (session == null || !session.hasIdentity())
            {
                connection.trySend(new ServerMessage.Error(messages.format("auth.required")));
                return;
            }
            action.accept(session.getIdentity(), message);
        };
    }

    private PlayerSession getPlayerSession(Connection connection)
    {
        return connection.getAttachment()
                .filter(PlayerSession.class::isInstance)
                .map(PlayerSession.class::cast)
                .orElse(null);
    }

    // ========== Lifecycle ==========

    public void start()
    {
        server.start();
        scheduler.start();
        LOG.info("World server started on port {}", server.getLocalAddress().getPort());
    }

    public int getPort()
    {
        return server.getLocalAddress().getPort();
    }

    public WorldService getWorld()
    {
        return world;
    }

    @Override
    public void close()
    {
        scheduler.close();
        stepScheduler.close();
        server.close();
        LOG.info("World server stopped");
    }

    // ========== Console ==========

    public void runCommandLoop()
    {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.out.println("Server commands: list, kick <name>, quit");

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                String[] parts = line.trim().split("\\s+", 2);
                String command = parts[0].toLowerCase(Locale.ROOT);

                switch (command)
                {
                    case "list" -> listPlayers();
                    case "kick" ->
                    {
                        if (parts.length > 1)
                        {
                            kickPlayer(parts[1]);
                        }
                        else
                        {
                            System.out.println("Usage: kick <player name>");
                        }
                    }
                    case "quit", "exit", "q" ->
                    {
                        System.out.println("Shutting down...");
                        return;
                    }
                    case "" ->
                    {
                        // Ignore empty input
                    }
                    default -> System.out.println("Unknown command: " + command);
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
    }

    private void listPlayers()
    {
        List<Presence> players = new ArrayList<>(presence.all());
        if (players.isEmpty())
        {
            System.out.println("No players connected");
            return;
        }
        players.sort(Comparator.comparing(Presence::identity, String.CASE_INSENSITIVE_ORDER));
        System.out.println("Connected players:");
        for (Presence player : players)
        {
            System.out.printf("  %s (%s) in room %d%n",
                    player.identity(), player.connection().getId(), player.roomId());
        }
    }

    private void kickPlayer(String name)
    {
        presence.find(name).ifPresentOrElse(player ->
        {
            LOG.info("Kicking player: {}", player.identity());
            player.connection().close("Kicked by server");
        }, () -> System.out.println("Player not found: " + name));
    }

    // ========== Startup ==========

    /**
     * Command line settings.
     *
     * @param port           TCP port, 0 for any free port
     * @param tickInterval   actor scheduler tick
     * @param worldFile      seed file, or null for the bundled world
     * @param routeStepDelay delay between steps towards a destination
     * @param savedStepDelay delay between steps of a saved route
     */
    public record Options(int port, Duration tickInterval, Path worldFile, Duration routeStepDelay,
                          Duration savedStepDelay)
    {
        public static final int DEFAULT_PORT = 4000;

        public Options
        {
            if (port < 0 || port > 65535)
            {
                throw new IllegalArgumentException("Port must be between 0 and 65535: " + port);
            }
            Objects.requireNonNull(tickInterval, "tickInterval");
            Objects.requireNonNull(routeStepDelay, "routeStepDelay");
            Objects.requireNonNull(savedStepDelay, "savedStepDelay");
            if (tickInterval.isZero() || tickInterval.isNegative())
            {
                throw new IllegalArgumentException("Tick interval must be positive: " + tickInterval.toMillis() + " ms");
            }
            if (routeStepDelay.isNegative() || savedStepDelay.isNegative())
            {
                throw new IllegalArgumentException("Step delays cannot be negative: "
                        + routeStepDelay.toMillis() + " ms, " + savedStepDelay.toMillis() + " ms");
            }
        }

        public static Options defaults()
        {
            return new Options(DEFAULT_PORT, CycleScheduler.DEFAULT_TICK_INTERVAL, null,
                    NavigationSettings.DEFAULT_ROUTE_STEP_DELAY, NavigationSettings.DEFAULT_SAVED_STEP_DELAY);
        }

        /**
         * Parses {@code --port}, {@code --tick-ms}, {@code --world},
         * {@code --nav-delay-ms} and {@code --loop-delay-ms}.
         *
         * @throws IllegalArgumentException on an unknown flag, a missing value or a bad number
         */
        public static Options parse(String[] args)
        {
            Options options = defaults();
            for (int i = 0; i < args.length; i++)
            {
                String flag = args[i];
                if (i + 1 >= args.length)
                {
                    throw new IllegalArgumentException("Missing value for " + flag);
                }
                String value = args[++i];
                options = switch (flag)
                {
                    case "--port" -> new Options(parseNumber(flag, value), options.tickInterval(),
                            options.worldFile(), options.routeStepDelay(), options.savedStepDelay());
                    case "--tick-ms" -> new Options(options.port(), Duration.ofMillis(parseNumber(flag, value)),
                            options.worldFile(), options.routeStepDelay(), options.savedStepDelay());
                    case "--world" -> new Options(options.port(), options.tickInterval(), Path.of(value),
                            options.routeStepDelay(), options.savedStepDelay());
                    case "--nav-delay-ms" -> new Options(options.port(), options.tickInterval(),
                            options.worldFile(), Duration.ofMillis(parseNumber(flag, value)),
                            options.savedStepDelay());
                    case "--loop-delay-ms" -> new Options(options.port(), options.tickInterval(),
                            options.worldFile(), options.routeStepDelay(), Duration.ofMillis(parseNumber(flag, value)));
                    default -> throw new IllegalArgumentException("Unknown option: " + flag);
                };
            }
            return options;
        }

        private static int parseNumber(String flag, String value)
        {
            try
            {
                return Integer.parseInt(value);
            }
            catch (NumberFormatException e)
            {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + value, e);
            }
        }
    }

    public static void main(String[] args)
    {
        Options options;
        WorldSeed seed;
        try
        {
            options = Options.parse(args);
            seed = options.worldFile() == null
                    ? WorldSeedLoader.readDefault()
                    : WorldSeedLoader.read(options.worldFile());
        }
        catch (IllegalArgumentException | IOException e)
        {
            System.err.println(e.getMessage());
            System.err.println("Usage: WorldServerApp [--port n] [--tick-ms n] [--world file]"
                    + " [--nav-delay-ms n] [--loop-delay-ms n]");
            System.exit(1);
            return;
        }

        WorldStores stores = new WorldSeedLoader().populate(seed);
        try (WorldServerApp app = new WorldServerApp(options, stores))
        {
            app.start();
            app.runCommandLoop();
        }
    }
}
