package com.questrail.unitbus.servicemanager;

import com.questrail.unitbus.protocol.bus.BusException;
import com.questrail.unitbus.protocol.bus.body.BodyReader;
import com.questrail.unitbus.protocol.bus.connection.BusConnection;
import com.questrail.unitbus.protocol.bus.connection.MethodCall;
import com.questrail.unitbus.protocol.bus.model.BusMessage;
import com.questrail.unitbus.protocol.bus.validate.InvalidMessageException;
import com.questrail.unitbus.protocol.bus.validate.Violation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * BusServiceManager
 * =============================================================================
 * {@link ServiceManager} implemented with method calls on a {@link BusConnection}.
 *
 * <h2>Job results</h2>
 * Unit job methods return the object path of the queued job at once; the job's
 * result arrives later in a {@code JobRemoved} signal. Signals that arrive
 * before anyone waits for their job are kept (the most recent
 * {@value #RECENT_JOBS}) so a fast job is never missed.
 */
public final class BusServiceManager implements ServiceManager
{
    private static final Logger log = LoggerFactory.getLogger(BusServiceManager.class);

    public static final String DESTINATION = "org.freedesktop.systemd1";
    public static final String MANAGER_PATH = "/org/freedesktop/systemd1";
    public static final String MANAGER_INTERFACE = "org.freedesktop.systemd1.Manager";
    public static final String UNIT_INTERFACE = "org.freedesktop.systemd1.Unit";
    public static final String PROPERTIES_INTERFACE = "org.freedesktop.DBus.Properties";

    static final String JOB_REMOVED_RULE =
            "type='signal',interface='" + MANAGER_INTERFACE + "',member='JobRemoved'";

    private static final int RECENT_JOBS = 64;

    private final BusConnection connection;
    private final Duration jobTimeout;

    private final Object jobLock = new Object();
    private final Map<String, CompletableFuture<String>> jobWaiters = new HashMap<>();
    private final Map<String, String> finishedJobs = new LinkedHashMap<>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, String> eldest)
        {
            return size() > RECENT_JOBS;
        }
    };

    /**
     * Listens for {@code JobRemoved} on {@code connection}. The caller must
     * make sure the bus routes those signals here, see {@link #attach}.
     */
    public BusServiceManager(BusConnection connection, Duration jobTimeout)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.jobTimeout = Objects.requireNonNull(jobTimeout, "jobTimeout");
        connection.addSignalHandler(MANAGER_INTERFACE, "JobRemoved", this::onJobRemoved);
    }

    /**
     * Creates a service manager and adds the match rule for job signals.
     */
    public static BusServiceManager attach(BusConnection connection, Duration jobTimeout)
            throws IOException, BusException
    {
        BusServiceManager manager = new BusServiceManager(connection, jobTimeout);
        connection.addMatch(JOB_REMOVED_RULE);
        return manager;
    }

    @Override
    public String loadUnit(String name) throws IOException, BusException
    {
        BusMessage reply = connection.call(manager("LoadUnit").arguments("s", w -> w.writeString(name)));
        return (String) single(reply);
    }

    @Override
    public String startUnit(String name, JobMode mode) throws IOException, BusException
    {
        return runJob("StartUnit", name, mode);
    }

    @Override
    public String stopUnit(String name, JobMode mode) throws IOException, BusException
    {
        return runJob("StopUnit", name, mode);
    }

    @Override
    public String reloadUnit(String name, JobMode mode) throws IOException, BusException
    {
        return runJob("ReloadUnit", name, mode);
    }

    @Override
    public String restartUnit(String name, JobMode mode) throws IOException, BusException
    {
        return runJob("RestartUnit", name, mode);
    }

    @Override
    public String tryRestartUnit(String name, JobMode mode) throws IOException, BusException
    {
        return runJob("TryRestartUnit", name, mode);
    }

    @Override
    public String reloadOrRestartUnit(String name, JobMode mode) throws IOException, BusException
    {
        return runJob("ReloadOrRestartUnit", name, mode);
    }

    @Override
    public String reloadOrTryRestartUnit(String name, JobMode mode) throws IOException, BusException
    {
        return runJob("ReloadOrTryRestartUnit", name, mode);
    }

    @Override
    public String startTransientUnit(String name, JobMode mode, List<UnitProperty> properties)
            throws IOException, BusException
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(properties, "properties");

        BusMessage reply = connection.call(manager("StartTransientUnit").arguments("ssa(sv)a(sa(sv))", w -> w
                .writeString(name)
                .writeString(mode.wireName())
                .writeArray("(sv)", properties, (aw, p) -> p.writeTo(aw))
                // no auxiliary units
                .writeArray("(sa(sv))", List.of(), (aw, aux) -> { })));
        return awaitJob((String) single(reply));
    }

    @Override
    public void killUnit(String name, int signal) throws IOException, BusException
    {
        connection.call(manager("KillUnit").arguments("ssi", w -> w
                .writeString(name)
                .writeString("all")
                .writeInt32(signal)));
    }

    @Override
    public Map<String, Object> getUnitProperties(String name) throws IOException, BusException
    {
        BusMessage reply = connection.call(MethodCall.to(DESTINATION, UnitPaths.pathFor(name), PROPERTIES_INTERFACE, "GetAll")
                .arguments("s", w -> w.writeString(UNIT_INTERFACE)));
        Map<String, Object> properties = new LinkedHashMap<>();
        ((Map<?, ?>) single(reply)).forEach((k, v) -> properties.put((String) k, v));
        return properties;
    }

    @Override
    public Object getUnitProperty(String name, String property) throws IOException, BusException
    {
        BusMessage reply = connection.call(MethodCall.to(DESTINATION, UnitPaths.pathFor(name), PROPERTIES_INTERFACE, "Get")
                .arguments("ss", w -> w.writeString(UNIT_INTERFACE).writeString(property)));
        return single(reply);
    }

    @Override
    public List<UnitStatus> listUnits() throws IOException, BusException
    {
        BusMessage reply = connection.call(manager("ListUnits"));
        List<UnitStatus> units = new ArrayList<>();
        for (Object s : (List<?>) single(reply)) {
            units.add(UnitStatus.fromStruct((List<?>) s));
        }
        return units;
    }

    @Override
    public EnableResult enableUnitFiles(List<String> files, boolean runtime, boolean force)
            throws IOException, BusException
    {
        BusMessage reply = connection.call(manager("EnableUnitFiles").arguments("asbb", w -> w
                .writeStringArray(files)
                .writeBoolean(runtime)
                .writeBoolean(force)));
        List<Object> args = BodyReader.of(reply).readAll();
        return new EnableResult((Boolean) args.get(0), changes(args.get(1)));
    }

    @Override
    public List<UnitFileChange> disableUnitFiles(List<String> files, boolean runtime) throws IOException, BusException
    {
        BusMessage reply = connection.call(manager("DisableUnitFiles").arguments("asb", w -> w
                .writeStringArray(files)
                .writeBoolean(runtime)));
        return changes(single(reply));
    }

    @Override
    public void subscribe() throws IOException, BusException
    {
        connection.call(manager("Subscribe"));
    }

    @Override
    public void unsubscribe() throws IOException, BusException
    {
        connection.call(manager("Unsubscribe"));
    }

    @Override
    public void reload() throws IOException, BusException
    {
        connection.call(manager("Reload"));
    }

    // ---------------------------------------------------------------------
    // Jobs
    // ---------------------------------------------------------------------

    private String runJob(String member, String name, JobMode mode) throws IOException, BusException
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(mode, "mode");
        BusMessage reply = connection.call(manager(member).arguments("ss", w -> w
                .writeString(name)
                .writeString(mode.wireName())));
        String job = (String) single(reply);
        log.debug("{} {} queued job {}", member, name, job);
        return awaitJob(job);
    }

    private String awaitJob(String job) throws IOException
    {
        final CompletableFuture<String> result;
        synchronized (jobLock) {
            String finished = finishedJobs.remove(job);
            if (finished != null) {
                return finished;
            }
            result = jobWaiters.computeIfAbsent(job, j -> new CompletableFuture<>());
        }

        try {
            return result.get(jobTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new IOException("job " + job + " did not finish within " + jobTimeout);
        } catch (ExecutionException e) {
            throw new IOException("job " + job + " could not be awaited", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for job " + job);
        } finally {
            synchronized (jobLock) {
                jobWaiters.remove(job, result);
            }
        }
    }

    private void onJobRemoved(BusMessage signal)
    {
        final String job;
        final String result;
        try {
            // JobRemoved(u id, o job, s unit, s result)
            List<Object> args = BodyReader.of(signal).readAll();
            job = (String) args.get(1);
            result = (String) args.get(3);
        } catch (InvalidMessageException | IndexOutOfBoundsException | ClassCastException e) {
            log.warn("Ignoring malformed JobRemoved signal {}", signal, e);
            return;
        }

        synchronized (jobLock) {
            CompletableFuture<String> waiter = jobWaiters.remove(job);
            if (waiter != null) {
                waiter.complete(result);
            } else {
                finishedJobs.put(job, result);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static MethodCall manager(String member)
    {
        return MethodCall.to(DESTINATION, MANAGER_PATH, MANAGER_INTERFACE, member);
    }

    private static Object single(BusMessage reply) throws InvalidMessageException
    {
        List<Object> args = BodyReader.of(reply).readAll();
        if (args.isEmpty()) {
            throw new InvalidMessageException(Violation.MALFORMED_BODY,
                    "reply to serial " + reply.replySerial().orElse(0) + " has an empty body");
        }
        return args.get(0);
    }

    private static List<UnitFileChange> changes(Object array)
    {
        List<UnitFileChange> changes = new ArrayList<>();
        for (Object s : (List<?>) array) {
            changes.add(UnitFileChange.fromStruct((List<?>) s));
        }
        return changes;
    }
}
