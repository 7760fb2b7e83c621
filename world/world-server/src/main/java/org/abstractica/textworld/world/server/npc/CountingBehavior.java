package org.abstractica.textworld.world.server.npc;

import java.util.Map;

/**
 * Counts cycles and produces nothing.
 */
public class CountingBehavior implements ActorBehavior
{
    @Override
    public CycleResult advance(Map<String, Object> state, ActorInstance actor)
    {
        state.put(ActorState.CYCLES, ActorState.cycles(state) + 1);
        return new CycleResult(state, Map.of());
    }
}
