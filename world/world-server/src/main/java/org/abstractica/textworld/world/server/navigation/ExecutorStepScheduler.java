package org.abstractica.textworld.world.server.navigation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Step scheduler backed by a small thread pool.
 */
public class ExecutorStepScheduler implements StepScheduler, AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(ExecutorStepScheduler.class);

    private final ScheduledExecutorService executor;

    public ExecutorStepScheduler(int threads)
    {
        if (threads <= 0)
        {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.executor = Executors.newScheduledThreadPool(threads, runnable ->
        {
            Thread thread = new Thread(runnable, "route-steps");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void schedule(Runnable step, Duration delay)
    {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(delay, "delay");
        try
        {
            executor.schedule(() ->
            {
                try
                {
                    step.run();
                }
                catch (Exception e)
                {
                    LOG.error("Route step failed", e);
                }
            }, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Step scheduler is shut down, dropping step");
        }
    }

    @Override
    public void close()
    {
        executor.shutdownNow();
    }
}
