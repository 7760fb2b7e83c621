package org.abstractica.textworld.world.server;

import org.abstractica.textworld.Connection;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Connection that keeps every message sent to it.
 */
public class RecordingConnection implements Connection
{
    private final String id;
    private final List<Object> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean refusing = false;
    private volatile Object attachment;

    public RecordingConnection(String id)
    {
        this.id = id;
    }

    @Override
    public void send(Object message)
    {
        if (!open)
        {
            throw new IllegalStateException("Connection is closed");
        }
        sent.add(message);
    }

    @Override
    public boolean trySend(Object message)
    {
        if (!open || refusing)
        {
            return false;
        }
        sent.add(message);
        return true;
    }

    @Override
    public void close()
    {
        open = false;
    }

    @Override
    public void close(String reason)
    {
        open = false;
    }

    @Override
    public String getId()
    {
        return id;
    }

    @Override
    public boolean isOpen()
    {
        return open;
    }

    @Override
    public Optional<Object> getAttachment()
    {
        return Optional.ofNullable(attachment);
    }

    @Override
    public void setAttachment(Object attachment)
    {
        this.attachment = attachment;
    }

    /**
     * Makes {@link #trySend(Object)} refuse everything, as if the queue were full.
     */
    public void setRefusing(boolean refusing)
    {
        this.refusing = refusing;
    }

    public List<Object> sent()
    {
        return List.copyOf(sent);
    }

    public <T> List<T> sent(Class<T> type)
    {
        List<T> matching = new ArrayList<>();
        for (Object message : sent)
        {
            if (type.isInstance(message))
            {
                matching.add(type.cast(message));
            }
        }
        return matching;
    }

    /**
     * Last message of a type, or null.
     */
    public <T> T last(Class<T> type)
    {
        List<T> matching = sent(type);
        return matching.isEmpty() ? null : matching.get(matching.size() - 1);
    }

    public void clear()
    {
        sent.clear();
    }
}
