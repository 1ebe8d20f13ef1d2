package com.questrail.bridge.protocol.line.codec.impl;

import com.questrail.bridge.protocol.line.codec.LineCodec;
import com.questrail.bridge.protocol.line.model.DeviceMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * DefaultLineCodec
 * -----------------------------------------------------------------------------
 * Concrete {@link LineCodec} for the {@code TOPIC:PAYLOAD} protocol.
 *
 * <p>Rejected lines are logged at WARN and dropped; they never surface as
 * exceptions.</p>
 */
public final class DefaultLineCodec implements LineCodec
{
    private static final Logger log = LoggerFactory.getLogger(DefaultLineCodec.class);

    static final char SEPARATOR = ':';
    static final char TERMINATOR = '\n';

    @Override
    public Optional<DeviceMessage> parse(String line)
    {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }

        final String text = line.strip();
        final int colon = text.indexOf(SEPARATOR);
        if (colon < 0) {
            log.warn("Invalid message format (no colon): {}", text);
            return Optional.empty();
        }

        final String topic = text.substring(0, colon).strip();
        final String payload = text.substring(colon + 1).strip();

        if (topic.isEmpty()) {
            log.warn("Invalid message format (empty topic): {}", text);
            return Optional.empty();
        }

        return Optional.of(new DeviceMessage(topic, payload));
    }

    @Override
    public String format(String topic, String payload)
    {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        return topic + SEPARATOR + payload + TERMINATOR;
    }
}
