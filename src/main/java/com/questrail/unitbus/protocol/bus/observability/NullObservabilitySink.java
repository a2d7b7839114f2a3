package com.questrail.unitbus.protocol.bus.observability;

/**
 * No-op implementation of BusObservabilitySink.
 */
public final class NullObservabilitySink implements BusObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onMessageSent(BusMessageEvent event) {}

    @Override
    public void onMessageReceived(BusMessageEvent event) {}

    @Override
    public void onTransportEvent(BusTransportEvent event) {}

    @Override
    public void onError(BusErrorEvent event) {}
}
