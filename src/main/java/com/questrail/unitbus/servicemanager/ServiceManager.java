package com.questrail.unitbus.servicemanager;

import com.questrail.unitbus.protocol.bus.BusException;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * ServiceManager
 * -----------------------------------------------------------------------------
 * Operations of the host's service manager.
 *
 * <p>Unit jobs ({@code startUnit}, {@code stopUnit}, ...) block until the
 * queued job has finished and return its result: {@code done},
 * {@code canceled}, {@code timeout}, {@code failed}, {@code dependency} or
 * {@code skipped}.</p>
 *
 * <p>Errors reported by the service manager surface as
 * {@link com.questrail.unitbus.protocol.bus.connection.BusErrorException};
 * see {@link ServiceManagers} for the well-known names.</p>
 */
public interface ServiceManager
{
    /**
     * Loads a unit and returns its object path.
     */
    String loadUnit(String name) throws IOException, BusException;

    String startUnit(String name, JobMode mode) throws IOException, BusException;

    String stopUnit(String name, JobMode mode) throws IOException, BusException;

    String reloadUnit(String name, JobMode mode) throws IOException, BusException;

    String restartUnit(String name, JobMode mode) throws IOException, BusException;

    String tryRestartUnit(String name, JobMode mode) throws IOException, BusException;

    String reloadOrRestartUnit(String name, JobMode mode) throws IOException, BusException;

    String reloadOrTryRestartUnit(String name, JobMode mode) throws IOException, BusException;

    /**
     * Creates and starts a unit that exists only until it stops.
     */
    String startTransientUnit(String name, JobMode mode, List<UnitProperty> properties)
            throws IOException, BusException;

    /**
     * Sends {@code signal} to all processes of the unit.
     */
    void killUnit(String name, int signal) throws IOException, BusException;

    /**
     * All properties of the unit interface, keyed by property name.
     */
    Map<String, Object> getUnitProperties(String name) throws IOException, BusException;

    Object getUnitProperty(String name, String property) throws IOException, BusException;

    List<UnitStatus> listUnits() throws IOException, BusException;

    EnableResult enableUnitFiles(List<String> files, boolean runtime, boolean force)
            throws IOException, BusException;

    List<UnitFileChange> disableUnitFiles(List<String> files, boolean runtime) throws IOException, BusException;

    /**
     * Asks the service manager to emit unit and job signals to this client.
     */
    void subscribe() throws IOException, BusException;

    void unsubscribe() throws IOException, BusException;

    /**
     * Reloads the service manager's configuration from disk.
     */
    void reload() throws IOException, BusException;
}
