package org.abstractica.textworld.world.server.store;

import org.abstractica.textworld.world.server.npc.ActorInstance;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage of actor placements and their state.
 */
public interface ActorStore
{
    /**
     * Returns every active actor, ordered by room then slot.
     */
    List<ActorInstance> getAllActiveNPCs();

    /**
     * Returns the actors in a room, ordered by slot.
     */
    List<ActorInstance> getActorsInRoom(long roomId);

    Optional<ActorInstance> getActorById(long instanceId);

    /**
     * Replaces an actor's state bag and cycle timestamp.
     *
     * @param instanceId the actor
     * @param state      new state bag
     * @param timestamp  new last-cycle time, epoch milliseconds
     * @throws IllegalArgumentException if the actor does not exist
     */
    void updateNPCState(long instanceId, Map<String, Object> state, long timestamp);
}
