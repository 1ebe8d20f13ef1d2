package com.questrail.bridge.protocol.envelope.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Map;
import java.util.Objects;

/**
 * Envelope
 * -----------------------------------------------------------------------------
 * JSON object sent from the bridge to WebSocket clients, discriminated by its
 * {@code type} field.
 *
 * <pre>
 *   message {topic, payload, source}   device line fanned out to all clients
 *   status  {status, details}          link availability change
 *   ack     {success, topic}           outcome of the sender's publish
 *   error   {message}                  the sender's request was rejected
 *   pong    {}                         reply to the sender's ping
 * </pre>
 *
 * <p>Envelopes are built per routing step and never stored.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Envelope.Message.class, name = "message"),
    @JsonSubTypes.Type(value = Envelope.Status.class, name = "status"),
    @JsonSubTypes.Type(value = Envelope.Ack.class, name = "ack"),
    @JsonSubTypes.Type(value = Envelope.Failure.class, name = "error"),
    @JsonSubTypes.Type(value = Envelope.Pong.class, name = "pong")
})
public sealed interface Envelope
        permits Envelope.Message, Envelope.Status, Envelope.Ack, Envelope.Failure, Envelope.Pong
{
    /** A message read from the device. */
    record Message(String topic, String payload, String source) implements Envelope {
        public Message {
            Objects.requireNonNull(topic, "topic");
            Objects.requireNonNull(payload, "payload");
            Objects.requireNonNull(source, "source");
        }
    }

    /**
     * Link status. {@code status} is {@code "connected"} or {@code "disconnected"}.
     */
    record Status(String status, Map<String, Object> details) implements Envelope {
        public Status {
            Objects.requireNonNull(status, "status");
            details = details == null ? Map.of() : details;
        }
    }

    /** Outcome of a publish request; a failed write is an ack with {@code success=false}, not an error. */
    record Ack(boolean success, String topic) implements Envelope {
    }

    /** Rejection of a client request. Serialized with {@code type: "error"}. */
    record Failure(String message) implements Envelope {
        public Failure {
            Objects.requireNonNull(message, "message");
        }
    }

    /** Reply to a ping. */
    record Pong() implements Envelope {
    }
}
