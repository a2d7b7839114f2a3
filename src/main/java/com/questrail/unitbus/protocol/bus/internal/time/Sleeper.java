package com.questrail.unitbus.protocol.bus.internal.time;

import java.time.Duration;

/**
 * Blocks the calling thread between polls. Tests substitute an implementation
 * that advances a manual clock instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper
{
    Sleeper SYSTEM = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
