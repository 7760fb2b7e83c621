package org.abstractica.textworld.world.server.navigation;

import org.abstractica.textworld.world.protocol.RouteMode;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Progress of one player along one guided route.
 *
 * <p>Guarded by its own monitor. The navigator checks {@link #getStatus()}
 * and the run token at every step boundary, so a route stopped or paused
 * between steps never takes another step.</p>
 */
public class ExecutionState
{
    private final String owner;
    private final String name;
    private final RouteMode mode;
    private final List<RouteStep> steps;
    private final Duration stepDelay;
    private final SavedRoute followUp;

    private ExecutionStatus status;
    private int nextIndex;
    private int lap;
    private long pausedRoomId;
    private long runToken;

    ExecutionState(String owner, String name, RouteMode mode, List<RouteStep> steps, Duration stepDelay,
                   SavedRoute followUp)
    {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.name = Objects.requireNonNull(name, "name");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.steps = List.copyOf(steps);
        this.stepDelay = Objects.requireNonNull(stepDelay, "stepDelay");
        this.followUp = followUp;
        this.status = ExecutionStatus.RUNNING;
        if (mode == RouteMode.LOOP && this.steps.isEmpty())
        {
            throw new IllegalArgumentException("A loop needs at least one step");
        }
    }

    public String getOwner()
    {
        return owner;
    }

    public String getName()
    {
        return name;
    }

    public RouteMode getMode()
    {
        return mode;
    }

    public List<RouteStep> getSteps()
    {
        return steps;
    }

    public Duration getStepDelay()
    {
        return stepDelay;
    }

    /**
     * Saved route to start once this one completes, or null.
     */
    public SavedRoute getFollowUp()
    {
        return followUp;
    }

    public synchronized ExecutionStatus getStatus()
    {
        return status;
    }

    synchronized void setStatus(ExecutionStatus status)
    {
        this.status = status;
    }

    public synchronized int getNextIndex()
    {
        return nextIndex;
    }

    /**
     * Steps left in the current lap.
     */
    public synchronized int remaining()
    {
        return steps.size() - nextIndex;
    }

    public synchronized int getLap()
    {
        return lap;
    }

    public synchronized long getPausedRoomId()
    {
        return pausedRoomId;
    }

    synchronized RouteStep nextStep()
    {
        return steps.get(nextIndex);
    }

    /**
     * Records a walked step.
     *
     * @return true if that was the last step of the lap
     */
    synchronized boolean advance()
    {
        nextIndex++;
        return nextIndex >= steps.size();
    }

    synchronized void startNextLap()
    {
        nextIndex = 0;
        lap++;
    }

    synchronized void pauseAt(long roomId)
    {
        status = ExecutionStatus.PAUSED;
        pausedRoomId = roomId;
    }

    synchronized long nextRunToken()
    {
        return ++runToken;
    }

    synchronized long currentRunToken()
    {
        return runToken;
    }
}
