/**
 * Bus message codec, wire-level implementation
 * =============================================================================
 *
 * <p>Concrete decoder and encoder for the message layout documented in
 * {@link com.questrail.unitbus.protocol.bus.codec}. Primitive reads and
 * writes are delegated to {@code internal.wire}; this package owns the
 * message structure only.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   InputStream
 *        → WireReader (preamble, header array, padding)
 *        → BusMessage.Builder
 *        → MessageValidator
 *        → BusMessage
 * </pre>
 *
 * <p>A message that fails here is discarded whole; nothing partial is
 * returned or written.</p>
 */
package com.questrail.unitbus.protocol.bus.codec.impl;
