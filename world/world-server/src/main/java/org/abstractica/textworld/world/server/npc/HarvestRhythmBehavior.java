package org.abstractica.textworld.world.server.npc;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counts cycles while idle and pulses its output items into the room while a
 * player is harvesting it.
 *
 * <p>A harvesting cycle leaves the state exactly as it was, cycle count
 * included; sessions are opened and closed by the scheduler.</p>
 */
public class HarvestRhythmBehavior implements ActorBehavior
{
    @Override
    public CycleResult advance(Map<String, Object> state, ActorInstance actor)
    {
        if (!ActorState.isHarvestActive(state))
        {
            state.put(ActorState.CYCLES, ActorState.cycles(state) + 1);
            return new CycleResult(state, Map.of());
        }

        Map<String, Integer> produced = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> output : actor.outputItems().entrySet())
        {
            if (output.getValue() != null && output.getValue() > 0)
            {
                produced.put(output.getKey(), output.getValue());
            }
        }
        return new CycleResult(state, produced);
    }

    @Override
    public boolean isHarvestable()
    {
        return true;
    }
}
