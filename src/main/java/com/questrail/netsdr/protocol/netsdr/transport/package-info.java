/**
 * NetSDR Transport Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between concrete networking (Netty TCP and
 * UDP, or an in-memory double) and the NetSDR client.</p>
 *
 * <p>Everything above these ports sees only whole frames as {@code byte[]}
 * and lifecycle notifications. Netty types stay inside the {@code netty}
 * sub-packages.</p>
 *
 * <h2>Constraints</h2>
 * Implementations:
 * <ul>
 *   <li>perform transport I/O only, except that a stream transport cuts the
 *       stream into frames using the header's length field</li>
 *   <li>do not interpret message kinds or control items</li>
 *   <li>do not retry sends</li>
 * </ul>
 */
package com.questrail.netsdr.protocol.netsdr.transport;
