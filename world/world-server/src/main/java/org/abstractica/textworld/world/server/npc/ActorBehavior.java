package org.abstractica.textworld.world.server.npc;

import java.util.Map;

/**
 * What an actor does when its cycle comes round.
 *
 * <p>Implementations are stateless and are only called from the cycle
 * scheduler's thread.</p>
 */
public interface ActorBehavior
{
    /**
     * Computes the actor's next state.
     *
     * @param state current state bag; a private copy the behaviour may modify
     * @param actor the actor
     * @return the new state and any items produced
     */
    CycleResult advance(Map<String, Object> state, ActorInstance actor);

    /**
     * Whether players can harvest actors with this behaviour.
     */
    default boolean isHarvestable()
    {
        return false;
    }
}
