package com.questrail.netsdr.protocol.netsdr.model;

/**
 * MessageType
 * -----------------------------------------------------------------------------
 * The 3-bit message-kind tag carried in the top bits of every NetSDR header.
 *
 * <p>The same tag value means slightly different things depending on the
 * direction of travel. A host sends {@link #SET_CONTROL_ITEM} to change a
 * setting and {@link #CURRENT_CONTROL_ITEM} to query one; the device answers a
 * set or a query with a {@link #SET_CONTROL_ITEM}-tagged response, and pushes
 * unsolicited setting changes as {@link #CURRENT_CONTROL_ITEM}.</p>
 *
 * <p>The four data-item kinds carry streamed payloads. Frames of those kinds
 * have no control-item code; inbound ones carry a 16-bit sequence number
 * instead.</p>
 */
public enum MessageType
{
    SET_CONTROL_ITEM(0),
    CURRENT_CONTROL_ITEM(1),
    CONTROL_ITEM_RANGE(2),
    ACK(3),
    DATA_ITEM_0(4),
    DATA_ITEM_1(5),
    DATA_ITEM_2(6),
    DATA_ITEM_3(7);

    private static final MessageType[] BY_TAG = values();

    private final int tag;

    MessageType(int tag)
    {
        this.tag = tag;
    }

    /**
     * Returns the 3-bit wire tag.
     */
    public int tag()
    {
        return tag;
    }

    /**
     * Returns true for the streamed data-item kinds.
     */
    public boolean isDataItem()
    {
        return tag >= DATA_ITEM_0.tag;
    }

    /**
     * Resolves a wire tag.
     *
     * @throws IllegalArgumentException if {@code tag} is outside 0..7
     */
    public static MessageType fromTag(int tag)
    {
        if (tag < 0 || tag >= BY_TAG.length) {
            throw new IllegalArgumentException("Message type tag out of range: " + tag);
        }
        return BY_TAG[tag];
    }
}
