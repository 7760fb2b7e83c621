package org.abstractica.textworld.world.server.store;

import org.abstractica.textworld.world.server.npc.ActorInstance;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Actor placements held in memory.
 */
public class InMemoryActorStore implements ActorStore
{
    private static final Comparator<ActorInstance> ROOM_AND_SLOT = Comparator
            .comparingLong(ActorInstance::roomId)
            .thenComparingInt(ActorInstance::slot)
            .thenComparingLong(ActorInstance::instanceId);

    private final Map<Long, ActorInstance> actors = new ConcurrentHashMap<>();

    /**
     * Adds an actor placement.
     *
     * @throws IllegalArgumentException if the instance id is taken
     */
    public void addActor(ActorInstance actor)
    {
        Objects.requireNonNull(actor, "actor");
        if (actors.putIfAbsent(actor.instanceId(), actor) != null)
        {
            throw new IllegalArgumentException("Duplicate actor instance: " + actor.instanceId());
        }
    }

    @Override
    public List<ActorInstance> getAllActiveNPCs()
    {
        List<ActorInstance> result = new ArrayList<>();
        for (ActorInstance actor : actors.values())
        {
            if (actor.active())
            {
                result.add(actor);
            }
        }
        result.sort(ROOM_AND_SLOT);
        return result;
    }

    @Override
    public List<ActorInstance> getActorsInRoom(long roomId)
    {
        List<ActorInstance> result = new ArrayList<>();
        for (ActorInstance actor : actors.values())
        {
            if (actor.roomId() == roomId)
            {
                result.add(actor);
            }
        }
        result.sort(ROOM_AND_SLOT);
        return result;
    }

    @Override
    public Optional<ActorInstance> getActorById(long instanceId)
    {
        return Optional.ofNullable(actors.get(instanceId));
    }

    @Override
    public void updateNPCState(long instanceId, Map<String, Object> state, long timestamp)
    {
        Objects.requireNonNull(state, "state");
        ActorInstance updated = actors.computeIfPresent(instanceId,
                (id, actor) -> actor.withState(state, timestamp));
        if (updated == null)
        {
            throw new IllegalArgumentException("Unknown actor instance: " + instanceId);
        }
    }
}
