package org.abstractica.textworld.world.server.navigation;

/**
 * Lifecycle of a guided route.
 */
public enum ExecutionStatus
{
    RUNNING,
    PAUSED,
    STOPPED
}
