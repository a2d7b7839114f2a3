package com.questrail.unitbus.protocol.bus.observability;

import com.questrail.unitbus.protocol.bus.model.BusMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BusObservabilitySink that emits logs via SLF4J.
 *
 * <p>Message traffic is logged at DEBUG, transport changes at INFO (WARN when
 * the transport failed) and errors at ERROR.</p>
 */
public final class Slf4jBusObservabilitySink implements BusObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBusObservabilitySink.class);

    @Override
    public void onMessageSent(BusMessageEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Bus >> {}", describe(event.message()));
        }
    }

    @Override
    public void onMessageReceived(BusMessageEvent event) {
        if (log.isDebugEnabled()) {
            log.debug("Bus << {}", describe(event.message()));
        }
    }

    @Override
    public void onTransportEvent(BusTransportEvent event) {
        if (event.cause() != null) {
            log.warn("Bus transport {}", event.state(), event.cause());
        } else {
            log.info("Bus transport {}", event.state());
        }
    }

    @Override
    public void onError(BusErrorEvent event) {
        log.error("Bus error: {}", event.message(), event.cause());
    }

    private static String describe(BusMessage m) {
        StringBuilder sb = new StringBuilder();
        sb.append(m.type().map(Enum::name).orElse("type " + m.typeCode()))
          .append(" serial=").append(m.serial());
        m.replySerial().ifPresent(r -> sb.append(" reply_serial=").append(r));
        m.path().ifPresent(p -> sb.append(" path=").append(p));
        m.interfaceName().ifPresent(i -> sb.append(" interface=").append(i));
        m.member().ifPresent(n -> sb.append(" member=").append(n));
        m.errorName().ifPresent(e -> sb.append(" error=").append(e));
        return sb.toString();
    }
}
