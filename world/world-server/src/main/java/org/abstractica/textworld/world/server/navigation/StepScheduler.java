package org.abstractica.textworld.world.server.navigation;

import java.time.Duration;

/**
 * Runs route steps after a delay.
 */
@FunctionalInterface
public interface StepScheduler
{
    /**
     * Runs a step once the delay has passed.
     *
     * @param step  the step
     * @param delay how long to wait
     */
    void schedule(Runnable step, Duration delay);
}
