package com.questrail.unitbus.jobs;

import com.questrail.unitbus.protocol.bus.BusException;
import com.questrail.unitbus.protocol.bus.internal.time.MonotonicClock;
import com.questrail.unitbus.protocol.bus.internal.time.Sleeper;
import com.questrail.unitbus.protocol.bus.internal.time.SystemMonotonicClock;
import com.questrail.unitbus.servicemanager.JobMode;
import com.questrail.unitbus.servicemanager.ServiceManager;
import com.questrail.unitbus.servicemanager.UnitProperty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * BuildImageJob
 * =============================================================================
 * Runs an image build in a transient unit and waits for it to finish.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>Subscribe to service manager signals</li>
 *   <li>Start {@code build-<id>.service} in mode {@code fail}, running the
 *       builder container with the docker socket mounted</li>
 *   <li>Poll the unit's {@code SubState} until it leaves {@code running} or
 *       the wait timeout elapses</li>
 * </ol>
 *
 * Progress lines go to the caller's writer; failures are reported there too
 * and in the returned {@link Outcome}.
 */
public final class BuildImageJob
{
    private static final Logger log = LoggerFactory.getLogger(BuildImageJob.class);

    public static final String BUILDER_IMAGE = "pmorie/sti-builder";
    public static final String SLICE = "gear.slice";
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofSeconds(25);

    public enum Outcome
    {
        /** The unit left the {@code running} state. */
        COMPLETED,
        /** The unit could not be watched or started. */
        START_FAILED,
        /** The unit was still running when the wait timed out. */
        TIMED_OUT
    }

    private final ServiceManager serviceManager;
    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final Duration pollInterval;
    private final Duration waitTimeout;

    /**
     * Uses the system clock and the default poll interval and wait timeout.
     */
    public BuildImageJob(ServiceManager serviceManager)
    {
        this(serviceManager, SystemMonotonicClock.INSTANCE, Sleeper.SYSTEM, DEFAULT_POLL_INTERVAL, DEFAULT_WAIT_TIMEOUT);
    }

    public BuildImageJob(ServiceManager serviceManager, MonotonicClock clock, Sleeper sleeper,
                         Duration pollInterval, Duration waitTimeout)
    {
        this.serviceManager = Objects.requireNonNull(serviceManager, "serviceManager");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.waitTimeout = Objects.requireNonNull(waitTimeout, "waitTimeout");
    }

    /**
     * The command the build unit executes.
     */
    public static List<String> buildCommand(BuildImageRequest request)
    {
        List<String> cmd = new ArrayList<>(List.of(
                "/usr/bin/docker", "run",
                "-rm",
                "-v", "/run/docker.sock:/run/docker.sock",
                "-t", BUILDER_IMAGE,
                "sti", "build", request.source(), request.baseImage(), request.tag(),
                "--url", "unix:///run/docker.sock"));

        if (request.runtimeImage() != null && !request.runtimeImage().isEmpty()) {
            cmd.add("--runtime-image");
            cmd.add(request.runtimeImage());
        }
        if (request.clean()) {
            cmd.add("--clean");
        }
        if (request.verbose()) {
            cmd.add("-l");
            cmd.add("DEBUG");
        }
        return cmd;
    }

    public Outcome execute(BuildImageRequest request, PrintWriter out) throws InterruptedException
    {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(out, "out");

        final String unitName = request.unitName();
        out.println("Processing build-image request:");

        try {
            serviceManager.subscribe();
        } catch (IOException | BusException e) {
            log.warn("Unable to subscribe before starting {}", unitName, e);
            out.println("Unable to watch start status: " + e.getMessage());
            out.flush();
            return Outcome.START_FAILED;
        }

        try {
            out.println("Running sti build unit: " + unitName);
            final String status;
            try {
                status = serviceManager.startTransientUnit(unitName, JobMode.FAIL, List.of(
                        UnitProperty.execStart(buildCommand(request), true),
                        UnitProperty.description("Builder for " + request.tag()),
                        UnitProperty.remainAfterExit(true),
                        UnitProperty.slice(SLICE)));
            } catch (IOException | BusException e) {
                out.println("Unable to start build container for this image due to ("
                        + e.getClass().getSimpleName() + "): " + e.getMessage());
                return Outcome.START_FAILED;
            }

            if (!"done".equals(status)) {
                out.println("Build did not complete successfully: " + status);
            } else {
                out.println("Sti build is running");
            }
            out.flush();

            return awaitBuild(unitName, out);
        } finally {
            try {
                serviceManager.unsubscribe();
            } catch (IOException | BusException e) {
                log.warn("Unable to unsubscribe after {}", unitName, e);
            }
            out.flush();
        }
    }

    private Outcome awaitBuild(String unitName, PrintWriter out) throws InterruptedException
    {
        final long deadline = clock.nowNanos() + waitTimeout.toNanos();
        while (true) {
            try {
                Object subState = serviceManager.getUnitProperty(unitName, "SubState");
                if (!"running".equals(subState)) {
                    out.println("Build completed: " + subState);
                    return Outcome.COMPLETED;
                }
            } catch (IOException | BusException e) {
                out.println("Error " + e.getMessage());
            }

            if (clock.nowNanos() - deadline >= 0) {
                log.warn("Timed out waiting for {} after {}", unitName, waitTimeout);
                out.println("Timed out waiting for " + unitName);
                return Outcome.TIMED_OUT;
            }
            sleeper.sleep(pollInterval);
        }
    }
}
