package org.abstractica.textworld.world.server.navigation;

import java.time.Duration;
import java.util.Objects;

/**
 * Step pacing of guided routes.
 *
 * @param routeStepDelay delay between steps towards a destination
 * @param savedStepDelay delay between steps of a saved path or loop
 */
public record NavigationSettings(Duration routeStepDelay, Duration savedStepDelay)
{
    public static final Duration DEFAULT_ROUTE_STEP_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_SAVED_STEP_DELAY = Duration.ofSeconds(2);

    public NavigationSettings
    {
        Objects.requireNonNull(routeStepDelay, "routeStepDelay");
        Objects.requireNonNull(savedStepDelay, "savedStepDelay");
        if (routeStepDelay.isNegative() || savedStepDelay.isNegative())
        {
            throw new IllegalArgumentException("Step delays must not be negative");
        }
    }

    public static NavigationSettings defaults()
    {
        return new NavigationSettings(DEFAULT_ROUTE_STEP_DELAY, DEFAULT_SAVED_STEP_DELAY);
    }
}
