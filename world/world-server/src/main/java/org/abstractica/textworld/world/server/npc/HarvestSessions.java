package org.abstractica.textworld.world.server.npc;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State transitions of harvest sessions.
 */
public final class HarvestSessions
{
    /**
     * A session never ends sooner than this after it started.
     */
    public static final long MIN_HARVEST_DURATION = 1_000;

    private HarvestSessions()
    {
    }

    /**
     * Opens a session for a player.
     */
    public static Map<String, Object> begin(Map<String, Object> state, String player, long nowMs)
    {
        Map<String, Object> next = new LinkedHashMap<>(state);
        next.put(ActorState.HARVEST_ACTIVE, true);
        next.put(ActorState.HARVEST_START_TIME, nowMs);
        next.put(ActorState.HARVESTING_PLAYER_ID, player);
        return next;
    }

    /**
     * Closes a session and starts the recharge.
     */
    public static Map<String, Object> end(Map<String, Object> state, long cooldownTime, long nowMs)
    {
        Map<String, Object> next = new LinkedHashMap<>(state);
        next.put(ActorState.HARVEST_ACTIVE, false);
        next.put(ActorState.HARVEST_START_TIME, null);
        next.put(ActorState.HARVESTING_PLAYER_ID, null);
        next.put(ActorState.COOLDOWN_UNTIL, nowMs + cooldownTime);
        return next;
    }

    /**
     * Whether the actor's session opened less than
     * {@link #MIN_HARVEST_DURATION} ago. Such an actor sits out the tick.
     */
    public static boolean isStarting(ActorInstance actor, long nowMs)
    {
        if (!ActorState.isHarvestActive(actor.state()))
        {
            return false;
        }
        return nowMs - ActorState.harvestStartTime(actor.state()) < MIN_HARVEST_DURATION;
    }

    /**
     * Whether the actor's open session has run its course.
     */
    public static boolean isExpired(ActorInstance actor, long nowMs)
    {
        if (!ActorState.isHarvestActive(actor.state()))
        {
            return false;
        }
        long elapsed = nowMs - ActorState.harvestStartTime(actor.state());
        return elapsed >= Math.max(MIN_HARVEST_DURATION, actor.harvestableTime());
    }
}
