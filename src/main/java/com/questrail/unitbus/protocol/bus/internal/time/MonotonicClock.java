package com.questrail.unitbus.protocol.bus.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for deadlines and polling intervals.
 *
 * <h2>Binding invariant</h2>
 * Every timeout computed by this library (job waits, polling deadlines) uses a
 * monotonic time source. Wall-clock time ({@code Instant.now()}) is used only
 * to timestamp observability events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();
}
