package org.abstractica.textworld.world.server.presence;

/**
 * Thrown when an identity that is already in the world tries to enter again.
 */
public class DuplicatePresenceException extends RuntimeException
{
    private final String identity;

    public DuplicatePresenceException(String identity)
    {
        super("Identity already present: " + identity);
        this.identity = identity;
    }

    public String getIdentity()
    {
        return identity;
    }
}
