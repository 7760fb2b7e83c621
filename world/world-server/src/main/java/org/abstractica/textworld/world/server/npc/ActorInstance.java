package org.abstractica.textworld.world.server.npc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of one actor placed in a room.
 *
 * <p>Instances are immutable; the scheduler writes a new state bag through
 * the actor store and reads back a fresh snapshot.</p>
 *
 * @param instanceId      placement id
 * @param npcId           id of the actor definition
 * @param roomId          room the actor stands in
 * @param name            display name
 * @param description     text shown when looked at
 * @param type            behaviour type tag
 * @param baseCycleTime   minimum milliseconds between cycles
 * @param harvestableTime milliseconds a harvest session lasts
 * @param cooldownTime    milliseconds to recharge after a harvest
 * @param outputItems     item name to quantity produced per harvesting cycle
 * @param state           state bag; always holds {@code cycles}
 * @param lastCycleRun    time of the last cycle, epoch milliseconds
 * @param active          inactive actors are skipped by the scheduler
 * @param slot            ordering within the room
 */
public record ActorInstance(
        long instanceId,
        long npcId,
        long roomId,
        String name,
        String description,
        String type,
        long baseCycleTime,
        long harvestableTime,
        long cooldownTime,
        Map<String, Integer> outputItems,
        Map<String, Object> state,
        long lastCycleRun,
        boolean active,
        int slot
)
{
    public static final long DEFAULT_BASE_CYCLE_TIME = 12_000;
    public static final long DEFAULT_HARVESTABLE_TIME = 60_000;
    public static final long DEFAULT_COOLDOWN_TIME = 120_000;

    public ActorInstance
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        description = description == null ? "" : description;
        if (baseCycleTime <= 0)
        {
            throw new IllegalArgumentException("baseCycleTime must be positive: " + baseCycleTime);
        }
        outputItems = outputItems == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(outputItems));
        // State values may be null, so no Map.copyOf here
        Map<String, Object> copy = new LinkedHashMap<>();
        if (state != null)
        {
            copy.putAll(state);
        }
        copy.putIfAbsent(ActorState.CYCLES, 0L);
        state = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns a copy with a new state bag and cycle timestamp.
     */
    public ActorInstance withState(Map<String, Object> newState, long newLastCycleRun)
    {
        return new ActorInstance(instanceId, npcId, roomId, name, description, type, baseCycleTime,
                harvestableTime, cooldownTime, outputItems, newState, newLastCycleRun, active, slot);
    }

    /**
     * Whether a cycle is due at the given time.
     */
    public boolean isCycleDue(long nowMs)
    {
        return nowMs - lastCycleRun >= baseCycleTime;
    }
}
