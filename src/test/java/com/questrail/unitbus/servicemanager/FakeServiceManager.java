package com.questrail.unitbus.servicemanager;

import com.questrail.unitbus.protocol.bus.BusException;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FakeServiceManager
 * -----------------------------------------------------------------------------
 * Test-only {@link ServiceManager} with scripted answers.
 *
 * <p>Every operation is recorded in {@link #calls()} as {@code member:arg}.
 * Scripted answers are either values or exceptions; an exception is thrown
 * when its turn comes.</p>
 */
public final class FakeServiceManager implements ServiceManager
{
    private final List<String> calls = new ArrayList<>();

    private final Deque<Object> startAnswers = new ArrayDeque<>();
    private final Deque<Object> subStates = new ArrayDeque<>();
    private Object transientAnswer = "done";
    private Object propertiesAnswer = new HashMap<String, Object>();
    private Exception subscribeFailure;
    private Exception unsubscribeFailure;
    private Exception reloadFailure;

    private List<UnitProperty> lastTransientProperties = List.of();
    private JobMode lastMode;
    private List<String> lastEnabledFiles = List.of();

    // ---------------------------------------------------------------------
    // Scripting
    // ---------------------------------------------------------------------

    public FakeServiceManager startUnitAnswers(Object... answers)
    {
        startAnswers.addAll(List.of(answers));
        return this;
    }

    /**
     * SubState values returned by successive {@code getUnitProperty} calls;
     * the last one repeats.
     */
    public FakeServiceManager subStates(Object... states)
    {
        subStates.addAll(List.of(states));
        return this;
    }

    public FakeServiceManager transientUnitAnswers(Object answer)
    {
        this.transientAnswer = answer;
        return this;
    }

    public FakeServiceManager unitProperties(Object answer)
    {
        this.propertiesAnswer = answer;
        return this;
    }

    public FakeServiceManager failSubscribe(Exception failure)
    {
        this.subscribeFailure = failure;
        return this;
    }

    public FakeServiceManager failUnsubscribe(Exception failure)
    {
        this.unsubscribeFailure = failure;
        return this;
    }

    public FakeServiceManager failReload(Exception failure)
    {
        this.reloadFailure = failure;
        return this;
    }

    // ---------------------------------------------------------------------
    // Inspection
    // ---------------------------------------------------------------------

    public List<String> calls()
    {
        return new ArrayList<>(calls);
    }

    public List<UnitProperty> lastTransientProperties()
    {
        return lastTransientProperties;
    }

    public JobMode lastMode()
    {
        return lastMode;
    }

    public List<String> lastEnabledFiles()
    {
        return lastEnabledFiles;
    }

    // ---------------------------------------------------------------------
    // ServiceManager
    // ---------------------------------------------------------------------

    @Override
    public String loadUnit(String name)
    {
        calls.add("LoadUnit:" + name);
        return UnitPaths.pathFor(name);
    }

    @Override
    public String startUnit(String name, JobMode mode) throws IOException, BusException
    {
        calls.add("StartUnit:" + name);
        lastMode = mode;
        Object answer = startAnswers.isEmpty() ? "done" : startAnswers.poll();
        return (String) answerOrThrow(answer);
    }

    @Override
    public String stopUnit(String name, JobMode mode)
    {
        return job("StopUnit", name, mode);
    }

    @Override
    public String reloadUnit(String name, JobMode mode)
    {
        return job("ReloadUnit", name, mode);
    }

    @Override
    public String restartUnit(String name, JobMode mode)
    {
        return job("RestartUnit", name, mode);
    }

    @Override
    public String tryRestartUnit(String name, JobMode mode)
    {
        return job("TryRestartUnit", name, mode);
    }

    @Override
    public String reloadOrRestartUnit(String name, JobMode mode)
    {
        return job("ReloadOrRestartUnit", name, mode);
    }

    @Override
    public String reloadOrTryRestartUnit(String name, JobMode mode)
    {
        return job("ReloadOrTryRestartUnit", name, mode);
    }

    @Override
    public String startTransientUnit(String name, JobMode mode, List<UnitProperty> properties)
            throws IOException, BusException
    {
        calls.add("StartTransientUnit:" + name);
        lastMode = mode;
        lastTransientProperties = List.copyOf(properties);
        return (String) answerOrThrow(transientAnswer);
    }

    @Override
    public void killUnit(String name, int signal)
    {
        calls.add("KillUnit:" + name);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Map<String, Object> getUnitProperties(String name) throws IOException, BusException
    {
        calls.add("GetAll:" + name);
        return (Map<String, Object>) answerOrThrow(propertiesAnswer);
    }

    @Override
    public Object getUnitProperty(String name, String property) throws IOException, BusException
    {
        calls.add("Get:" + name);
        Object answer = subStates.size() > 1 ? subStates.poll() : subStates.peek();
        return answerOrThrow(answer);
    }

    @Override
    public List<UnitStatus> listUnits()
    {
        calls.add("ListUnits:");
        return List.of();
    }

    @Override
    public EnableResult enableUnitFiles(List<String> files, boolean runtime, boolean force)
    {
        calls.add("EnableUnitFiles:" + String.join(",", files));
        lastEnabledFiles = List.copyOf(files);
        return new EnableResult(true, List.of());
    }

    @Override
    public List<UnitFileChange> disableUnitFiles(List<String> files, boolean runtime)
    {
        calls.add("DisableUnitFiles:" + String.join(",", files));
        return List.of();
    }

    @Override
    public void subscribe() throws IOException, BusException
    {
        calls.add("Subscribe:");
        answerOrThrow(subscribeFailure);
    }

    @Override
    public void unsubscribe() throws IOException, BusException
    {
        calls.add("Unsubscribe:");
        answerOrThrow(unsubscribeFailure);
    }

    @Override
    public void reload() throws IOException, BusException
    {
        calls.add("Reload:");
        answerOrThrow(reloadFailure);
    }

    private String job(String member, String name, JobMode mode)
    {
        calls.add(member + ":" + name);
        lastMode = mode;
        return "done";
    }

    private static Object answerOrThrow(Object answer) throws IOException, BusException
    {
        if (answer instanceof IOException e) {
            throw e;
        }
        if (answer instanceof BusException e) {
            throw e;
        }
        if (answer instanceof RuntimeException e) {
            throw e;
        }
        return answer;
    }
}
