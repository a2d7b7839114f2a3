/**
 * Message codec: wire-level boundary of the bus protocol
 * =============================================================================
 *
 * <p>This package defines the contracts between raw bytes and
 * {@link com.questrail.unitbus.protocol.bus.model.BusMessage}:</p>
 *
 * <pre>
 *   InputStream
 *        → BusMessageDecoder   (marker, preamble, header array, padding, body)
 *            → MessageValidator
 *                → BusMessage
 *
 *   BusMessage
 *        → MessageValidator
 *            → BusMessageEncoder (preamble, header array, padding, body)
 *                → one write to the OutputStream
 * </pre>
 *
 * <h2>Wire layout</h2>
 * <pre>
 *   byte 0      'l' (little-endian) or 'B' (big-endian)
 *   byte 1      message type
 *   byte 2      flags
 *   byte 3      protocol version (1)
 *   bytes 4-7   body length (uint32)
 *   bytes 8-11  serial (uint32)
 *   bytes 12-   header array: uint32 length, then 8-aligned (code: byte, value: variant)
 *   padding     zero bytes up to the next multiple of 8
 *   body        exactly body-length bytes
 * </pre>
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>Framing and validity failures raise
 *       {@link com.questrail.unitbus.protocol.bus.validate.InvalidMessageException}
 *       with a discriminating
 *       {@link com.questrail.unitbus.protocol.bus.validate.Violation}.</li>
 *   <li>Stream failures are the stream's own {@link java.io.IOException}, never wrapped.</li>
 * </ul>
 */
package com.questrail.unitbus.protocol.bus.codec;
