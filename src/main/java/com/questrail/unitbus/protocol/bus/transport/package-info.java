/**
 * Transport port for the bus client.
 *
 * <p>{@link com.questrail.unitbus.protocol.bus.transport.BusEndpoint} is the
 * only thing the connection layer knows about the network. The Netty-backed
 * implementation lives in {@code transport.netty}; Netty types never leave
 * that package.</p>
 */
package com.questrail.unitbus.protocol.bus.transport;
