package org.abstractica.textworld.world.server.store;

import org.abstractica.textworld.world.server.navigation.SavedRoute;

import java.util.List;
import java.util.Optional;

/**
 * Storage of saved routes.
 */
public interface RouteStore
{
    /**
     * Stores a route and assigns it an id.
     *
     * @param route the route; its id is ignored
     * @return the stored route with its id
     */
    SavedRoute saveRoute(SavedRoute route);

    Optional<SavedRoute> getRouteById(long routeId);

    /**
     * Returns a player's routes in the order they were saved.
     */
    List<SavedRoute> getRoutesByOwner(String owner);
}
