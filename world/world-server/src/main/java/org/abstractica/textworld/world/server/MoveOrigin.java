package org.abstractica.textworld.world.server;

/**
 * Who asked for a move.
 */
public enum MoveOrigin
{
    /** Typed by the player; stops a running route. */
    MANUAL,
    /** A step of a guided route. */
    GUIDED
}
