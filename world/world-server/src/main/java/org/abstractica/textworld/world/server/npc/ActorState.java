package org.abstractica.textworld.world.server.npc;

import java.util.Map;

/**
 * Keys and typed readers for the actor state bag.
 */
public final class ActorState
{
    public static final String CYCLES = "cycles";
    public static final String HARVEST_ACTIVE = "harvest_active";
    public static final String HARVEST_START_TIME = "harvest_start_time";
    public static final String HARVESTING_PLAYER_ID = "harvesting_player_id";
    public static final String COOLDOWN_UNTIL = "cooldown_until";

    private ActorState()
    {
    }

    public static long cycles(Map<String, Object> state)
    {
        return asLong(state.get(CYCLES));
    }

    public static boolean isHarvestActive(Map<String, Object> state)
    {
        return Boolean.TRUE.equals(state.get(HARVEST_ACTIVE));
    }

    public static long harvestStartTime(Map<String, Object> state)
    {
        return asLong(state.get(HARVEST_START_TIME));
    }

    /**
     * Name of the player harvesting, or null.
     */
    public static String harvestingPlayer(Map<String, Object> state)
    {
        Object value = state.get(HARVESTING_PLAYER_ID);
        return value == null ? null : value.toString();
    }

    public static long cooldownUntil(Map<String, Object> state)
    {
        return asLong(state.get(COOLDOWN_UNTIL));
    }

    public static boolean isCoolingDown(Map<String, Object> state, long nowMs)
    {
        return nowMs < cooldownUntil(state);
    }

    /**
     * Status label shown next to the actor in room listings.
     *
     * @param state the state bag
     * @param nowMs current time
     * @return one of {@code (idle)}, {@code (harvesting)}, {@code (cooldown)}, {@code (ready)}
     */
    public static String statusLabel(Map<String, Object> state, long nowMs)
    {
        if (cycles(state) == 0)
        {
            return "(idle)";
        }
        if (isHarvestActive(state))
        {
            return "(harvesting)";
        }
        if (isCoolingDown(state, nowMs))
        {
            return "(cooldown)";
        }
        return "(ready)";
    }

    private static long asLong(Object value)
    {
        if (value instanceof Number number)
        {
            return number.longValue();
        }
        return 0;
    }
}
