package com.questrail.bridge.protocol.line.model;

import java.util.Objects;

/**
 * DeviceMessage
 * -----------------------------------------------------------------------------
 * One {@code TOPIC:PAYLOAD} message exchanged with the serial device.
 *
 * <p>Instances exist only for the duration of one routing step: produced by
 * parsing a line read from the device, or built from a client publish request
 * just before it is formatted onto the wire.</p>
 *
 * @param topic   non-blank message topic
 * @param payload message payload; may be empty, never null
 */
public record DeviceMessage(String topic, String payload)
{
    public DeviceMessage {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        if (topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be blank");
        }
    }
}
