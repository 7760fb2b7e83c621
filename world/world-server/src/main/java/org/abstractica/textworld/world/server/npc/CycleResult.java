package org.abstractica.textworld.world.server.npc;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one actor cycle.
 *
 * @param state         the actor's new state bag
 * @param producedItems items dropped in the actor's room, by name
 */
public record CycleResult(Map<String, Object> state, Map<String, Integer> producedItems)
{
    public CycleResult
    {
        Objects.requireNonNull(state, "state");
        state = Collections.unmodifiableMap(new LinkedHashMap<>(state));
        producedItems = producedItems == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(producedItems));
    }

    public boolean producedAnything()
    {
        return !producedItems.isEmpty();
    }
}
