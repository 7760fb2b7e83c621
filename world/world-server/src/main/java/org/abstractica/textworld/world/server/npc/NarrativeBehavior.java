package org.abstractica.textworld.world.server.npc;

import java.util.Map;

/**
 * Actors that only talk. Their state never changes on a cycle.
 */
public class NarrativeBehavior implements ActorBehavior
{
    @Override
    public CycleResult advance(Map<String, Object> state, ActorInstance actor)
    {
        return new CycleResult(state, Map.of());
    }
}
