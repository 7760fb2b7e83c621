package org.abstractica.textworld.world.protocol;

/**
 * How a guided route ends.
 */
public enum RouteMode
{
    /**
     * Runs once and stops at the last step.
     */
    PATH,

    /**
     * Returns to its first step after the last one and runs until stopped.
     */
    LOOP
}
