package com.questrail.unitbus.servicemanager;

/**
 * How the service manager queues a unit job relative to jobs already queued.
 */
public enum JobMode
{
    REPLACE("replace"),
    FAIL("fail"),
    ISOLATE("isolate"),
    IGNORE_DEPENDENCIES("ignore-dependencies"),
    IGNORE_REQUIREMENTS("ignore-requirements");

    private final String wireName;

    JobMode(String wireName)
    {
        this.wireName = wireName;
    }

    /**
     * The mode string sent to the service manager.
     */
    public String wireName()
    {
        return wireName;
    }
}
