package com.questrail.unitbus.protocol.bus.observability;

import com.questrail.unitbus.protocol.bus.model.BusMessage;
import com.questrail.unitbus.protocol.bus.model.MessageType;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

final class Slf4jBusObservabilitySinkTest {

    @Test
    void logsEveryKindOfEvent() {
        BusObservabilitySink sink = new Slf4jBusObservabilitySink();
        BusMessage reply = BusMessage.builder()
            .type(MessageType.ERROR)
            .serial(3)
            .replySerial(1)
            .errorName("org.freedesktop.DBus.Error.Failed")
            .build();
        BusMessage unknownType = BusMessage.builder().typeCode(9).serial(4).build();

        assertDoesNotThrow(() -> {
            sink.onMessageSent(new BusMessageEvent(Instant.now(), reply));
            sink.onMessageReceived(new BusMessageEvent(Instant.now(), unknownType));
            sink.onTransportEvent(new BusTransportEvent(Instant.now(), BusTransportEvent.State.UP, null));
            sink.onTransportEvent(new BusTransportEvent(Instant.now(), BusTransportEvent.State.DOWN,
                new IOException("connection reset")));
            sink.onError(new BusErrorEvent(Instant.now(), "dropped frame", new IOException("eof")));
        });
    }
}
