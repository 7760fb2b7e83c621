package org.abstractica.textworld.world.protocol;

/**
 * An actor as shown in a room listing.
 *
 * @param instanceId the actor instance id
 * @param name       display name
 * @param status     status label such as {@code "(ready)"}
 */
public record ActorView(long instanceId, String name, String status)
{
}
