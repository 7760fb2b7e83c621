package org.abstractica.textworld.world.server.navigation;

import org.abstractica.textworld.world.protocol.RouteMode;
import org.abstractica.textworld.world.protocol.ServerMessage;
import org.abstractica.textworld.world.server.GameMessages;
import org.abstractica.textworld.world.server.broadcast.RoomBroadcaster;
import org.abstractica.textworld.world.server.topology.MovementResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Walks players along routes one step at a time.
 *
 * <p>Each player has at most one route. Every step goes through the
 * {@link StepMover}, which applies the same rules as a typed move; no lock is
 * held while a step runs. A route's {@link ExecutionStatus} and run token are
 * checked before each step, so stopping or pausing takes effect at the next
 * step boundary.</p>
 */
public class GuidedNavigator
{
    private static final Logger LOG = LoggerFactory.getLogger(GuidedNavigator.class);

    private final RoomBroadcaster broadcaster;
    private final PathFinder pathFinder;
    private final StepScheduler stepScheduler;
    private final StepMover stepMover;
    private final NavigationSettings settings;
    private final GameMessages messages;

    private final Map<String, ExecutionState> executions = new ConcurrentHashMap<>();

    public GuidedNavigator(
            RoomBroadcaster broadcaster,
            PathFinder pathFinder,
            StepScheduler stepScheduler,
            StepMover stepMover,
            NavigationSettings settings,
            GameMessages messages)
    {
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.pathFinder = Objects.requireNonNull(pathFinder, "pathFinder");
        this.stepScheduler = Objects.requireNonNull(stepScheduler, "stepScheduler");
        this.stepMover = Objects.requireNonNull(stepMover, "stepMover");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.messages = Objects.requireNonNull(messages, "messages");
    }

    // ========== Starting ==========

    /**
     * Starts walking the shortest route to a room, replacing any current route.
     *
     * @param identity          the player
     * @param currentRoomId     where the player is
     * @param destinationRoomId where to go
     * @param name              name reported to the player
     * @return the new route state
     * @throws RouteRejectedException if the room cannot be reached
     */
    public ExecutionState startDestination(String identity, long currentRoomId, long destinationRoomId, String name)
    {
        Route route = pathFinder.shortestPath(currentRoomId, destinationRoomId)
                .orElseThrow(() -> new RouteRejectedException(messages.format("route.noPath")));
        return start(identity, name, RouteMode.PATH, route.steps(), settings.routeStepDelay(), null);
    }

    /**
     * Starts a saved route. If the player is elsewhere, a route to its origin
     * runs first and the saved route follows on arrival.
     *
     * @throws RouteRejectedException if the origin cannot be reached
     */
    public ExecutionState startSaved(String identity, long currentRoomId, SavedRoute saved)
    {
        Objects.requireNonNull(saved, "saved");
        if (currentRoomId == saved.originRoomId())
        {
            return start(identity, saved.name(), saved.mode(), saved.steps(), settings.savedStepDelay(), null);
        }
        Route toOrigin = pathFinder.shortestPath(currentRoomId, saved.originRoomId())
                .orElseThrow(() -> new RouteRejectedException(messages.format("route.noOriginPath")));
        broadcaster.sendTo(identity, new ServerMessage.Notice(messages.format("route.travelToOrigin", saved.name())));
        return start(identity, saved.name(), RouteMode.PATH, toOrigin.steps(), settings.routeStepDelay(), saved);
    }

    private ExecutionState start(String identity, String name, RouteMode mode, List<RouteStep> steps,
                                 Duration delay, SavedRoute followUp)
    {
        Objects.requireNonNull(identity, "identity");
        ExecutionState state = new ExecutionState(identity, name, mode, steps, delay, followUp);
        ExecutionState previous = executions.put(key(identity), state);
        if (previous != null)
        {
            previous.setStatus(ExecutionStatus.STOPPED);
        }
        LOG.debug("{} starts {} route {} with {} steps", identity, mode, name, steps.size());
        broadcaster.sendTo(identity, new ServerMessage.RouteStarted(name, mode, steps.size()));
        if (steps.isEmpty())
        {
            // already there; a route to an origin is only built when the origin differs
            complete(state, -1);
        }
        else
        {
            scheduleNext(state);
        }
        return state;
    }

    // ========== Control ==========

    /**
     * Pauses the running route in the given room.
     *
     * @throws RouteRejectedException if no route is running
     */
    public ExecutionState pause(String identity, long currentRoomId)
    {
        ExecutionState state = executions.get(key(identity));
        if (state == null || state.getStatus() != ExecutionStatus.RUNNING)
        {
            throw new RouteRejectedException(messages.format("route.nothingRunning"));
        }
        state.pauseAt(currentRoomId);
        broadcaster.sendTo(identity, new ServerMessage.RoutePaused(state.remaining(), state.getPausedRoomId()));
        return state;
    }

    /**
     * Continues a paused route from the room it was paused in.
     *
     * @throws RouteRejectedException if there is no paused route
     * @throws StaleRouteException    if the player has moved since pausing; the route is dropped
     */
    public ExecutionState resume(String identity, long currentRoomId)
    {
        ExecutionState state = executions.get(key(identity));
        if (state == null || state.getStatus() != ExecutionStatus.PAUSED)
        {
            throw new RouteRejectedException(messages.format("route.nothingPaused"));
        }
        long pausedRoomId = state.getPausedRoomId();
        if (pausedRoomId != currentRoomId)
        {
            stop(state);
            throw new StaleRouteException(messages.format("route.stale"), pausedRoomId, currentRoomId);
        }
        state.setStatus(ExecutionStatus.RUNNING);
        broadcaster.sendTo(identity, new ServerMessage.RouteResumed(state.remaining()));
        scheduleNext(state);
        return state;
    }

    /**
     * Abandons the current route, running or paused.
     *
     * @throws RouteRejectedException if there is none
     */
    public void cancel(String identity)
    {
        ExecutionState state = executions.get(key(identity));
        if (state == null)
        {
            throw new RouteRejectedException(messages.format("route.nothingRunning"));
        }
        stop(state);
        broadcaster.sendTo(identity, new ServerMessage.Notice(messages.format("route.cancelled")));
    }

    /**
     * Stops a running route because the player moved by hand. A paused
     * route is kept; continuing it checks the room.
     *
     * @return true if a running route was stopped
     */
    public boolean onManualMove(String identity)
    {
        ExecutionState state = executions.get(key(identity));
        if (state == null || state.getStatus() != ExecutionStatus.RUNNING)
        {
            return false;
        }
        stop(state);
        broadcaster.sendTo(identity, new ServerMessage.RouteFailed(messages.format("route.interrupted")));
        return true;
    }

    /**
     * Drops any route without telling the player.
     */
    public void discard(String identity)
    {
        ExecutionState state = executions.remove(key(identity));
        if (state != null)
        {
            state.setStatus(ExecutionStatus.STOPPED);
        }
    }

    public Optional<ExecutionState> status(String identity)
    {
        return Optional.ofNullable(executions.get(key(identity)));
    }

    // ========== Stepping ==========

    private void scheduleNext(ExecutionState state)
    {
        long token = state.nextRunToken();
        stepScheduler.schedule(() -> runStep(state, token), state.getStepDelay());
    }

    private void runStep(ExecutionState state, long token)
    {
        RouteStep step;
        synchronized (state)
        {
            if (state.getStatus() != ExecutionStatus.RUNNING || state.currentRunToken() != token)
            {
                return;
            }
            step = state.nextStep();
        }

        String identity = state.getOwner();
        MovementResolver.Resolution resolution;
        try
        {
            resolution = stepMover.step(identity, step.direction());
        }
        catch (Exception e)
        {
            LOG.warn("Route step for {} failed, stopping route {}", identity, state.getName(), e);
            stop(state);
            return;
        }

        if (!(resolution instanceof MovementResolver.Resolution.Moved moved))
        {
            stop(state);
            broadcaster.sendTo(identity, new ServerMessage.RouteFailed(
                    messages.format("route.blocked", capitalize(step.direction().displayName()))));
            return;
        }
        long arrivedRoomId = moved.to().id();
        if (arrivedRoomId != step.roomId())
        {
            LOG.debug("{} reached room {} instead of {}, stopping route", identity, arrivedRoomId, step.roomId());
            stop(state);
            broadcaster.sendTo(identity, new ServerMessage.RouteFailed(messages.format("route.diverged")));
            return;
        }

        boolean lapDone;
        boolean continueWalking;
        int completed;
        int remaining;
        int lap;
        synchronized (state)
        {
            lapDone = state.advance();
            completed = state.getNextIndex();
            remaining = state.remaining();
            lap = state.getLap();
            if (state.getStatus() == ExecutionStatus.PAUSED)
            {
                // the step finished after the pause request; pause where the player stands now
                state.pauseAt(arrivedRoomId);
            }
            if (lapDone && state.getMode() == RouteMode.LOOP)
            {
                state.startNextLap();
            }
            continueWalking = state.getStatus() == ExecutionStatus.RUNNING && state.currentRunToken() == token;
        }
        broadcaster.sendTo(identity, new ServerMessage.RouteProgress(
                step.direction().code(), arrivedRoomId, completed, remaining, lap));

        if (lapDone && state.getMode() == RouteMode.PATH)
        {
            if (state.getStatus() != ExecutionStatus.STOPPED)
            {
                complete(state, arrivedRoomId);
            }
            return;
        }
        if (continueWalking)
        {
            scheduleNext(state);
        }
    }

    private void complete(ExecutionState state, long arrivedRoomId)
    {
        String identity = state.getOwner();
        if (!executions.remove(key(identity), state))
        {
            return;
        }
        state.setStatus(ExecutionStatus.STOPPED);
        broadcaster.sendTo(identity, new ServerMessage.RouteComplete(state.getName(), state.getSteps().size()));
        SavedRoute followUp = state.getFollowUp();
        if (followUp != null)
        {
            try
            {
                startSaved(identity, arrivedRoomId, followUp);
            }
            catch (RouteRejectedException e)
            {
                broadcaster.sendTo(identity, new ServerMessage.RouteFailed(e.getMessage()));
            }
        }
    }

    private void stop(ExecutionState state)
    {
        state.setStatus(ExecutionStatus.STOPPED);
        executions.remove(key(state.getOwner()), state);
    }

    private static String capitalize(String text)
    {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static String key(String identity)
    {
        return identity.trim().toLowerCase(Locale.ROOT);
    }
}
