package com.questrail.bridge.protocol.line.codec;

import com.questrail.bridge.protocol.line.model.DeviceMessage;

import java.util.Optional;

/**
 * LineCodec
 * -----------------------------------------------------------------------------
 * Translation between one decoded text line of the device protocol and a
 * {@link DeviceMessage}.
 *
 * <p>The codec is stateless. Byte-level concerns (newline framing, UTF-8
 * decoding) live in {@link com.questrail.bridge.protocol.line.codec.impl.LineFramer};
 * this boundary only ever sees complete lines.</p>
 */
public interface LineCodec
{
    /**
     * Parse a single line (without its terminator) into a message.
     *
     * @param line decoded line text
     * @return the message, or {@link Optional#empty()} if the line is blank,
     *         has no {@code ':'} separator, or has a blank topic
     */
    Optional<DeviceMessage> parse(String line);

    /**
     * Format a message as a newline-terminated line.
     *
     * <p>No escaping is applied: a {@code ':'} or newline inside the topic, or
     * a newline inside the payload, corrupts framing for the receiver.</p>
     */
    String format(String topic, String payload);
}
