package org.abstractica.textworld.world.server.store;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Item stacks held in memory.
 */
public class InMemoryInventoryStore implements InventoryStore
{
    private final Map<Long, Map<String, Integer>> containers = new ConcurrentHashMap<>();

    @Override
    public void addItem(long containerId, String itemName, int quantity)
    {
        Objects.requireNonNull(itemName, "itemName");
        if (quantity <= 0)
        {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
        containers.computeIfAbsent(containerId, id -> new ConcurrentHashMap<>())
                .merge(itemName, quantity, Integer::sum);
    }

    @Override
    public Map<String, Integer> getItems(long containerId)
    {
        Map<String, Integer> items = containers.get(containerId);
        if (items == null)
        {
            return Map.of();
        }
        return Collections.unmodifiableMap(new TreeMap<>(items));
    }
}
