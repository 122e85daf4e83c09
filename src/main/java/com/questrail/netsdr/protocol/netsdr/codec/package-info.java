/**
 * NetSDR Codec
 * =============================================================================
 *
 * <p>Wire-level rules for NetSDR frames. Every frame starts with a 16-bit
 * little-endian header holding a 3-bit message kind and a 13-bit total length:</p>
 *
 * <pre>
 *   offset 0..1 : (kind &lt;&lt; 13) | totalLength
 *   offset 2..3 : control-item code         (Set / Get / Ack kinds)
 *   offset 2..3 : sequence number, unsigned (inbound data-item kinds)
 *   remaining   : body
 * </pre>
 *
 * <p>The codec is pure: no state, no I/O, and no dependency on the transport
 * packages. Decoding reports failure as {@link java.util.Optional#empty()};
 * only caller contract violations (an out-of-range sample width, a frame too
 * large for the header) raise exceptions.</p>
 */
package com.questrail.netsdr.protocol.netsdr.codec;
