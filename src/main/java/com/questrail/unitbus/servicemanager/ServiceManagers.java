package com.questrail.unitbus.servicemanager;

import com.questrail.unitbus.protocol.bus.BusException;
import com.questrail.unitbus.protocol.bus.connection.BusErrorException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Compound operations and error checks on top of {@link ServiceManager}.
 */
public final class ServiceManagers
{
    private static final Logger log = LoggerFactory.getLogger(ServiceManagers.class);

    public static final String NO_SUCH_UNIT = "org.freedesktop.systemd1.NoSuchUnit";
    public static final String LOAD_FAILED = "org.freedesktop.systemd1.LoadFailed";

    private ServiceManagers() {}

    /**
     * Starts {@code name}; if the service manager does not know the unit yet,
     * enables the unit file at {@code unitFile}, reloads the daemon when the
     * unit's definition changed on disk and starts it again.
     *
     * @return the result of the last start job
     * @throws BusErrorException {@link #NO_SUCH_UNIT} if the unit is unknown
     *                           and {@code unitFile} does not exist
     */
    public static String startAndEnableUnit(ServiceManager sm, String name, Path unitFile, JobMode mode)
            throws IOException, BusException
    {
        try {
            return sm.startUnit(name, mode);
        } catch (BusErrorException e) {
            if (!isNoSuchUnit(e) && !isLoadFailed(e)) {
                throw e;
            }
            log.debug("Unit {} not loaded ({}), enabling {}", name, e.errorName(), unitFile);
        }

        if (!Files.exists(unitFile)) {
            throw new BusErrorException(NO_SUCH_UNIT, "unit file " + unitFile + " does not exist");
        }
        sm.enableUnitFiles(List.of(unitFile.toString()), false, true);

        boolean needsReload;
        try {
            needsReload = isUnitProperty(sm, name, p -> {
                log.info("Unit {}: NeedDaemonReload {}", name, p.get("NeedDaemonReload"));
                return "not-found".equals(p.get("LoadState")) || Boolean.TRUE.equals(p.get("NeedDaemonReload"));
            });
        } catch (IOException | BusException e) {
            log.debug("Could not read the state of unit {}", name, e);
            needsReload = false;
        }
        if (needsReload) {
            log.info("Reloading service manager configuration");
            try {
                sm.reload();
            } catch (IOException | BusException e) {
                log.warn("Unit {} changed on disk and reload failed, the next start will likely fail", name, e);
            }
        }
        return sm.startUnit(name, mode);
    }

    /**
     * Evaluates {@code test} against the unit's properties.
     */
    public static boolean isUnitProperty(ServiceManager sm, String unit, Predicate<Map<String, Object>> test)
            throws IOException, BusException
    {
        return test.test(sm.getUnitProperties(unit));
    }

    public static boolean isUnitLoadState(ServiceManager sm, String unit, String state)
            throws IOException, BusException
    {
        return isUnitProperty(sm, unit, p -> state.equals(p.get("LoadState")));
    }

    public static boolean isNoSuchUnit(Throwable t)
    {
        return t instanceof BusErrorException e && e.is(NO_SUCH_UNIT);
    }

    public static boolean isLoadFailed(Throwable t)
    {
        return t instanceof BusErrorException e && e.is(LOAD_FAILED);
    }
}
