package com.questrail.unitbus.protocol.bus.validate;

import com.questrail.unitbus.protocol.bus.model.BusMessage;
import com.questrail.unitbus.protocol.bus.model.ByteValue;
import com.questrail.unitbus.protocol.bus.model.HeaderField;
import com.questrail.unitbus.protocol.bus.model.HeaderValue;
import com.questrail.unitbus.protocol.bus.model.MessageFlag;
import com.questrail.unitbus.protocol.bus.model.MessageType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MessageValidatorTest
 * -----------------------------------------------------------------------------
 * Each invariant is checked in isolation, then the first-failure order.
 */
final class MessageValidatorTest
{
    private static BusMessage.Builder methodCall()
    {
        return BusMessage.builder()
                .type(MessageType.METHOD_CALL)
                .serial(1)
                .path("/org/x")
                .member("Foo");
    }

    private static InvalidMessageException rejected(BusMessage message)
    {
        return assertThrows(InvalidMessageException.class, () -> MessageValidator.validate(message));
    }

    @Test
    void methodCallWithEmptyBodyNeedsNoSignature()
    {
        assertDoesNotThrow(() -> MessageValidator.validate(methodCall().build()));
        assertTrue(MessageValidator.isValid(methodCall().build()));
    }

    @Test
    void missingMemberIsReportedWithTheField()
    {
        InvalidMessageException e = rejected(methodCall().removeHeader(HeaderField.MEMBER).build());

        assertEquals(Violation.MISSING_REQUIRED_HEADER, e.violation());
        assertEquals(HeaderField.MEMBER, e.field().orElseThrow());
        assertFalse(MessageValidator.isValid(methodCall().removeHeader(HeaderField.MEMBER).build()));
    }

    @Test
    void requiredFieldsPerType()
    {
        BusMessage ret = BusMessage.builder().type(MessageType.METHOD_RETURN).serial(2).build();
        assertEquals(HeaderField.REPLY_SERIAL, rejected(ret).field().orElseThrow());
        assertTrue(MessageValidator.isValid(ret.toBuilder().replySerial(1).build()));

        BusMessage error = BusMessage.builder().type(MessageType.ERROR).serial(2).replySerial(1).build();
        assertEquals(HeaderField.ERROR_NAME, rejected(error).field().orElseThrow());
        assertTrue(MessageValidator.isValid(error.toBuilder().errorName("org.x.Error.Failed").build()));

        BusMessage signal = BusMessage.builder().type(MessageType.SIGNAL).serial(3)
                .path("/org/x").member("Changed").build();
        assertEquals(HeaderField.INTERFACE, rejected(signal).field().orElseThrow());
        assertTrue(MessageValidator.isValid(signal.toBuilder().interfaceName("org.x.Iface").build()));
    }

    @Test
    void nonEmptyBodyRequiresSignature()
    {
        BusMessage m = methodCall().body(new byte[] { 1, 0, 0, 0 }).build();
        assertEquals(Violation.MISSING_SIGNATURE, rejected(m).violation());

        assertTrue(MessageValidator.isValid(methodCall().body("u", new byte[] { 1, 0, 0, 0 }).build()));
    }

    @Test
    void unknownFlagBitsAreRejected()
    {
        assertEquals(Violation.INVALID_FLAGS, rejected(methodCall().flags(0x04).build()).violation());
        assertEquals(Violation.INVALID_FLAGS, rejected(methodCall().flags(0x80).build()).violation());

        BusMessage known = methodCall()
                .flag(MessageFlag.NO_REPLY_EXPECTED)
                .flag(MessageFlag.NO_AUTO_START)
                .build();
        assertTrue(MessageValidator.isValid(known));
    }

    @Test
    void zeroAndUnknownTypesAreRejected()
    {
        assertEquals(Violation.INVALID_MESSAGE_TYPE, rejected(methodCall().typeCode(0).build()).violation());
        assertEquals(Violation.INVALID_MESSAGE_TYPE, rejected(methodCall().typeCode(5).build()).violation());
    }

    @Test
    void unknownHeaderCodeIsRejected()
    {
        BusMessage m = methodCall().header(10, HeaderValue.string("x")).build();
        assertEquals(Violation.INVALID_HEADER_FIELD, rejected(m).violation());

        BusMessage zero = methodCall().header(0, HeaderValue.string("x")).build();
        assertEquals(Violation.INVALID_HEADER_FIELD, rejected(zero).violation());
    }

    @Test
    void headerOfTheWrongKindIsRejected()
    {
        BusMessage stringPath = methodCall().header(HeaderField.PATH, HeaderValue.string("/org/x")).build();
        InvalidMessageException e = rejected(stringPath);
        assertEquals(Violation.HEADER_TYPE_MISMATCH, e.violation());
        assertEquals(HeaderField.PATH, e.field().orElseThrow());

        BusMessage byteSerial = methodCall().header(HeaderField.REPLY_SERIAL, new ByteValue(1)).build();
        assertEquals(Violation.HEADER_TYPE_MISMATCH, rejected(byteSerial).violation());
    }

    @Test
    void malformedObjectPathIsRejected()
    {
        for (String path : new String[] { "relative/path", "/trailing/", "//double", "/has-dash", "" }) {
            InvalidMessageException e = rejected(methodCall().path(path).build());
            assertEquals(Violation.MALFORMED_HEADER, e.violation(), path);
            assertEquals(HeaderField.PATH, e.field().orElseThrow());
        }
        assertTrue(MessageValidator.isValid(methodCall().path("/").build()));
    }

    @Test
    void signatureMustBeAsciiAndWellFormed()
    {
        byte[] body = { 1, 0, 0, 0 };

        InvalidMessageException e = rejected(methodCall()
                .header(HeaderField.SIGNATURE, HeaderValue.signature("\u00e9")).body(body).build());
        assertEquals(Violation.MALFORMED_HEADER, e.violation());
        assertEquals(HeaderField.SIGNATURE, e.field().orElseThrow());

        BusMessage unterminated = methodCall()
                .header(HeaderField.SIGNATURE, HeaderValue.signature("a{sv")).body(body).build();
        assertEquals(Violation.MALFORMED_HEADER, rejected(unterminated).violation());
    }

    @Test
    void stringWithUnpairedSurrogateIsRejected()
    {
        InvalidMessageException e = rejected(methodCall().member("a\ud800").build());
        assertEquals(Violation.MALFORMED_HEADER, e.violation());
        assertEquals(HeaderField.MEMBER, e.field().orElseThrow());
    }

    @Test
    void missingByteOrderIsRejectedFirst()
    {
        BusMessage m = methodCall().byteOrder(null).typeCode(0).flags(0xFF).build();
        assertEquals(Violation.INVALID_BYTE_ORDER, rejected(m).violation());
    }

    @Test
    void firstFailureWins()
    {
        // flags before type
        assertEquals(Violation.INVALID_FLAGS, rejected(methodCall().flags(0x10).typeCode(9).build()).violation());

        // type before headers
        BusMessage badTypeAndHeader = methodCall().typeCode(9).header(10, HeaderValue.string("x")).build();
        assertEquals(Violation.INVALID_MESSAGE_TYPE, rejected(badTypeAndHeader).violation());

        // headers before required fields
        BusMessage mismatchAndMissing = methodCall()
                .removeHeader(HeaderField.MEMBER)
                .header(HeaderField.DESTINATION, HeaderValue.uint32(1))
                .build();
        assertEquals(Violation.HEADER_TYPE_MISMATCH, rejected(mismatchAndMissing).violation());

        // required fields before signature
        BusMessage missingAndUnsigned = methodCall()
                .removeHeader(HeaderField.MEMBER)
                .body(new byte[] { 1 })
                .build();
        assertEquals(Violation.MISSING_REQUIRED_HEADER, rejected(missingAndUnsigned).violation());
    }

    @Test
    void lowestHeaderCodeIsReportedFirst()
    {
        BusMessage m = methodCall()
                .header(HeaderField.SENDER, HeaderValue.uint32(7))
                .header(HeaderField.INTERFACE, HeaderValue.uint32(2))
                .build();
        assertEquals(HeaderField.INTERFACE, rejected(m).field().orElseThrow());
    }

    @Test
    void violationsCarryTheirCategory()
    {
        assertEquals(Violation.Category.FRAMING, Violation.INVALID_BYTE_ORDER.category());
        assertEquals(Violation.Category.FRAMING, Violation.MESSAGE_TOO_LARGE.category());
        assertEquals(Violation.Category.VALIDITY, Violation.MISSING_SIGNATURE.category());
    }
}
