package com.questrail.netsdr.protocol.netsdr;

/**
 * Indicates that a request lost its command channel while waiting for the
 * device's reply, either through a local disconnect or through the peer
 * closing the connection.
 *
 * <p>"Not connected" is not reported with this exception, and neither is a
 * malformed reply; both complete the request with an empty result.</p>
 */
public final class NetSdrProtocolException extends RuntimeException {
    public NetSdrProtocolException(String message) {
        super(message);
    }

    public NetSdrProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
