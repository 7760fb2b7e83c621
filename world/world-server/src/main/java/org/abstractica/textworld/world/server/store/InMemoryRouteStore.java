package org.abstractica.textworld.world.server.store;

import org.abstractica.textworld.world.server.navigation.SavedRoute;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Saved routes held in memory.
 */
public class InMemoryRouteStore implements RouteStore
{
    private final Map<Long, SavedRoute> routes = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    @Override
    public SavedRoute saveRoute(SavedRoute route)
    {
        Objects.requireNonNull(route, "route");
        SavedRoute stored = route.withId(nextId.getAndIncrement());
        routes.put(stored.id(), stored);
        return stored;
    }

    @Override
    public Optional<SavedRoute> getRouteById(long routeId)
    {
        return Optional.ofNullable(routes.get(routeId));
    }

    @Override
    public List<SavedRoute> getRoutesByOwner(String owner)
    {
        List<SavedRoute> result = new ArrayList<>();
        for (SavedRoute route : routes.values())
        {
            if (route.owner().equalsIgnoreCase(owner))
            {
                result.add(route);
            }
        }
        result.sort(Comparator.comparingLong(SavedRoute::id));
        return result;
    }
}
