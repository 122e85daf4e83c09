package com.questrail.netsdr.protocol.netsdr.model;

import java.util.Optional;

/**
 * 16-bit identifiers of the device settings addressed by control-item frames.
 *
 * <p>{@link #NONE} is not a wire value for control frames; it marks decoded
 * data-item frames, which carry no item code.</p>
 */
public enum ControlItemCode
{
    NONE(0x0000),
    TARGET_NAME(0x0001),
    TARGET_SERIAL_NUMBER(0x0002),
    INTERFACE_VERSION(0x0003),
    HARDWARE_FIRMWARE_VERSIONS(0x0004),
    STATUS_ERROR_CODE(0x0005),
    PRODUCT_ID(0x0009),
    RECEIVER_STATE(0x0018),
    RECEIVER_FREQUENCY(0x0020),
    RF_GAIN(0x0038),
    RF_FILTER(0x0044),
    AD_MODES(0x008A),
    IQ_OUTPUT_SAMPLE_RATE(0x00B8),
    DATA_OUTPUT_PACKET_SIZE(0x00C4),
    UDP_OUTPUT_ADDRESS(0x00C5);

    private final int code;

    ControlItemCode(int code)
    {
        this.code = code;
    }

    public int code()
    {
        return code;
    }

    /**
     * Looks up a code as read from the wire (unsigned 16-bit).
     */
    public static Optional<ControlItemCode> fromCode(int code)
    {
        for (ControlItemCode c : values()) {
            if (c.code == code) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
