package org.abstractica.textworld.world.server;

/**
 * Server-side state attached to a connection.
 */
class PlayerSession
{
    private final String connectionId;
    private volatile String identity;

    PlayerSession(String connectionId)
    {
        this.connectionId = connectionId;
        this.identity = null;
    }

    String getConnectionId()
    {
        return connectionId;
    }

    /**
     * The selected player, or null before one is selected.
     */
    String getIdentity()
    {
        return identity;
    }

    void setIdentity(String identity)
    {
        this.identity = identity;
    }

    boolean hasIdentity()
    {
        return identity != null;
    }
}
