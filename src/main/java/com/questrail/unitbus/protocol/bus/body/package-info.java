/**
 * Message body serialization.
 *
 * <p>{@link com.questrail.unitbus.protocol.bus.body.BodyWriter} builds the
 * bytes of an outgoing body and
 * {@link com.questrail.unitbus.protocol.bus.body.BodyReader} turns an incoming
 * body back into Java values according to the message's SIGNATURE header.
 * The framing codec treats bodies as opaque bytes and never calls into this
 * package.</p>
 */
package com.questrail.unitbus.protocol.bus.body;
