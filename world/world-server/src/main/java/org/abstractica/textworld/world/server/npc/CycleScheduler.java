package org.abstractica.textworld.world.server.npc;

import org.abstractica.textworld.world.protocol.ItemView;
import org.abstractica.textworld.world.protocol.ServerMessage;
import org.abstractica.textworld.world.server.GameMessages;
import org.abstractica.textworld.world.server.broadcast.RoomBroadcaster;
import org.abstractica.textworld.world.server.store.ActorStore;
import org.abstractica.textworld.world.server.store.InventoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Advances every active actor on a fixed tick.
 *
 * <p>Actor state is written only from {@link #tick(long)}. Player requests
 * that touch actor state (starting or interrupting a harvest) are queued and
 * applied at the start of the next tick. Each actor is processed in isolation:
 * one failing actor is logged and skipped without affecting the rest.</p>
 */
public class CycleScheduler implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(CycleScheduler.class);

    public static final Duration DEFAULT_TICK_INTERVAL = Duration.ofSeconds(1);

    private sealed interface ActorCommand
    {
        record BeginHarvest(String player, long roomId, long instanceId) implements ActorCommand {}

        record InterruptHarvest(String player) implements ActorCommand {}
    }

    private final ActorStore actors;
    private final InventoryStore inventory;
    private final RoomBroadcaster broadcaster;
    private final ActorBehaviors behaviors;
    private final GameMessages messages;
    private final Duration tickInterval;
    private final Queue<ActorCommand> commands = new ConcurrentLinkedQueue<>();

    private ScheduledExecutorService executor;

    public CycleScheduler(
            ActorStore actors,
            InventoryStore inventory,
            RoomBroadcaster broadcaster,
            ActorBehaviors behaviors,
            GameMessages messages,
            Duration tickInterval
    )
    {
        this.actors = Objects.requireNonNull(actors, "actors");
        this.inventory = Objects.requireNonNull(inventory, "inventory");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.behaviors = Objects.requireNonNull(behaviors, "behaviors");
        this.messages = Objects.requireNonNull(messages, "messages");
        Objects.requireNonNull(tickInterval, "tickInterval");
        if (tickInterval.isNegative() || tickInterval.isZero())
        {
            throw new IllegalArgumentException("Tick interval must be positive");
        }
        this.tickInterval = tickInterval;
    }

    // ========== Lifecycle ==========

    /**
     * Starts ticking on a background thread.
     */
    public synchronized void start()
    {
        if (executor != null)
        {
            throw new IllegalStateException("Scheduler already started");
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable ->
        {
            Thread thread = new Thread(runnable, "actor-cycles");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = tickInterval.toMillis();
        executor.scheduleAtFixedRate(this::tickNow, periodMs, periodMs, TimeUnit.MILLISECONDS);
        LOG.info("Actor cycle scheduler started, tick every {} ms", periodMs);
    }

    @Override
    public synchronized void close()
    {
        if (executor == null)
        {
            return;
        }
        executor.shutdownNow();
        executor = null;
        LOG.info("Actor cycle scheduler stopped");
    }

    public Duration getTickInterval()
    {
        return tickInterval;
    }

    // ========== Requests ==========

    /**
     * Asks to open a harvest session; applied on the next tick.
     *
     * @param player     harvesting player
     * @param roomId     room the player was in when asking
     * @param instanceId actor to harvest
     */
    public void requestHarvest(String player, long roomId, long instanceId)
    {
        Objects.requireNonNull(player, "player");
        commands.add(new ActorCommand.BeginHarvest(player, roomId, instanceId));
    }

    /**
     * Asks to end any session the player holds; applied on the next tick.
     */
    public void interruptHarvest(String player)
    {
        Objects.requireNonNull(player, "player");
        commands.add(new ActorCommand.InterruptHarvest(player));
    }

    // ========== Tick ==========

    private void tickNow()
    {
        try
        {
            tick(System.currentTimeMillis());
        }
        catch (Exception e)
        {
            // Keep the schedule alive; the next tick starts from a clean slate
            LOG.error("Actor cycle tick failed", e);
        }
    }

    /**
     * Runs one tick.
     *
     * @param nowMs current time, epoch milliseconds
     * @return number of actors that ran a cycle
     */
    public int tick(long nowMs)
    {
        applyCommands(nowMs);

        int cycled = 0;
        for (ActorInstance actor : actors.getAllActiveNPCs())
        {
            if (HarvestSessions.isStarting(actor, nowMs))
            {
                continue;
            }
            try
            {
                ActorInstance current = sweepHarvest(actor, nowMs);
                if (runCycle(current, nowMs))
                {
                    cycled++;
                }
            }
            catch (Exception e)
            {
                LOG.error("Actor {} ({}, type {}) failed its cycle", actor.instanceId(), actor.name(), actor.type(), e);
            }
        }
        return cycled;
    }

    private void applyCommands(long nowMs)
    {
        ActorCommand command;
        while ((command = commands.poll()) != null)
        {
            try
            {
                if (command instanceof ActorCommand.BeginHarvest begin)
                {
                    beginHarvest(begin, nowMs);
                }
                else if (command instanceof ActorCommand.InterruptHarvest interrupt)
                {
                    interruptSessions(interrupt.player(), nowMs);
                }
            }
            catch (Exception e)
            {
                LOG.error("Failed to apply {}", command, e);
            }
        }
    }

    private void beginHarvest(ActorCommand.BeginHarvest request, long nowMs)
    {
        Optional<ActorInstance> found = actors.getActorById(request.instanceId());
        if (found.isEmpty() || !found.get().active() || found.get().roomId() != request.roomId())
        {
            String name = found.map(ActorInstance::name).orElse("actor");
            broadcaster.sendTo(request.player(), new ServerMessage.Notice(messages.format("harvest.gone", name)));
            return;
        }

        ActorInstance actor = found.get();
        if (!behaviors.forType(actor.type()).isHarvestable())
        {
            broadcaster.sendTo(request.player(),
                    new ServerMessage.Notice(messages.format("harvest.notHarvestable", actor.name())));
            return;
        }
        if (isHarvesting(request.player()))
        {
            broadcaster.sendTo(request.player(),
                    new ServerMessage.Notice(messages.format("harvest.alreadyHarvesting")));
            return;
        }
        if (ActorState.isHarvestActive(actor.state()))
        {
            broadcaster.sendTo(request.player(),
                    new ServerMessage.Notice(messages.format("harvest.busy", actor.name())));
            return;
        }
        if (ActorState.isCoolingDown(actor.state(), nowMs))
        {
            broadcaster.sendTo(request.player(),
                    new ServerMessage.Notice(messages.format("harvest.recharging", actor.name())));
            return;
        }

        actors.updateNPCState(actor.instanceId(),
                HarvestSessions.begin(actor.state(), request.player(), nowMs), actor.lastCycleRun());
        LOG.info("{} started harvesting actor {} ({})", request.player(), actor.instanceId(), actor.name());
        broadcaster.sendTo(request.player(), new ServerMessage.Notice(messages.format("harvest.begin", actor.name())));
    }

    private boolean isHarvesting(String player)
    {
        for (ActorInstance actor : actors.getAllActiveNPCs())
        {
            if (ActorState.isHarvestActive(actor.state())
                    && player.equalsIgnoreCase(ActorState.harvestingPlayer(actor.state())))
            {
                return true;
            }
        }
        return false;
    }

    private void interruptSessions(String player, long nowMs)
    {
        for (ActorInstance actor : actors.getAllActiveNPCs())
        {
            if (ActorState.isHarvestActive(actor.state())
                    && player.equalsIgnoreCase(ActorState.harvestingPlayer(actor.state())))
            {
                actors.updateNPCState(actor.instanceId(),
                        HarvestSessions.end(actor.state(), actor.cooldownTime(), nowMs), actor.lastCycleRun());
                LOG.info("Harvest of actor {} by {} interrupted", actor.instanceId(), player);
                broadcaster.sendTo(player, new ServerMessage.Notice(messages.format("harvest.interrupted")));
            }
        }
    }

    private ActorInstance sweepHarvest(ActorInstance actor, long nowMs)
    {
        if (!HarvestSessions.isExpired(actor, nowMs))
        {
            return actor;
        }

        String player = ActorState.harvestingPlayer(actor.state());
        Map<String, Object> ended = HarvestSessions.end(actor.state(), actor.cooldownTime(), nowMs);
        actors.updateNPCState(actor.instanceId(), ended, actor.lastCycleRun());
        LOG.debug("Harvest of actor {} expired", actor.instanceId());
        if (player != null)
        {
            broadcaster.sendTo(player, new ServerMessage.Notice(messages.format("harvest.expired", actor.name())));
        }
        return actor.withState(ended, actor.lastCycleRun());
    }

    private boolean runCycle(ActorInstance actor, long nowMs)
    {
        if (!actor.isCycleDue(nowMs))
        {
            return false;
        }

        ActorBehavior behavior = behaviors.forType(actor.type());
        CycleResult result = behavior.advance(new LinkedHashMap<>(actor.state()), actor);
        actors.updateNPCState(actor.instanceId(), result.state(), nowMs);

        if (result.producedAnything())
        {
            dropProduce(actor, result.producedItems());
        }
        return true;
    }

    private void dropProduce(ActorInstance actor, Map<String, Integer> produced)
    {
        long roomId = actor.roomId();
        for (Map.Entry<String, Integer> item : produced.entrySet())
        {
            inventory.addItem(roomId, item.getKey(), item.getValue());
            broadcaster.broadcast(roomId, new ServerMessage.RoomMessage(roomId, null,
                    messages.format("harvest.pulse", actor.name(), item.getValue(), item.getKey())), null);
        }

        List<ItemView> ground = new ArrayList<>();
        for (Map.Entry<String, Integer> stack : inventory.getItems(roomId).entrySet())
        {
            ground.add(new ItemView(stack.getKey(), stack.getValue()));
        }
        broadcaster.broadcast(roomId, new ServerMessage.GroundUpdated(roomId, ground), null);
    }
}
