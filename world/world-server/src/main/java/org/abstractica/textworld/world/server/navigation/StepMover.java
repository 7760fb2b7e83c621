package org.abstractica.textworld.world.server.navigation;

import org.abstractica.textworld.world.protocol.Direction;
import org.abstractica.textworld.world.server.topology.MovementResolver;

/**
 * Performs one guided step with the same effects as a typed move.
 */
@FunctionalInterface
public interface StepMover
{
    /**
     * Moves a player one step.
     *
     * @param identity  the player
     * @param direction direction to walk
     * @return where the step led
     */
    MovementResolver.Resolution step(String identity, Direction direction);
}
