package org.abstractica.textworld.world.server.store;

import java.util.Map;

/**
 * Item stacks held by containers. Rooms use their room id as container id.
 */
public interface InventoryStore
{
    /**
     * Adds items to a container, merging with an existing stack.
     *
     * @param containerId the container
     * @param itemName    item name
     * @param quantity    positive quantity
     * @throws IllegalArgumentException if quantity is not positive
     */
    void addItem(long containerId, String itemName, int quantity);

    /**
     * Returns the container's stacks sorted by item name.
     */
    Map<String, Integer> getItems(long containerId);
}
