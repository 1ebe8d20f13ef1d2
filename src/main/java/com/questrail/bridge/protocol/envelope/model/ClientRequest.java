package com.questrail.bridge.protocol.envelope.model;

import java.util.Objects;

/**
 * ClientRequest
 * -----------------------------------------------------------------------------
 * A decoded request received from a WebSocket client.
 *
 * <p>Requests without a {@code type} field are publishes. A publish whose
 * {@code topic} is missing carries an empty topic; rejecting it is the
 * router's decision, not the decoder's.</p>
 */
public sealed interface ClientRequest
        permits ClientRequest.Publish, ClientRequest.Ping, ClientRequest.Unknown
{
    record Publish(String topic, String payload) implements ClientRequest {
        public Publish {
            Objects.requireNonNull(topic, "topic");
            Objects.requireNonNull(payload, "payload");
        }
    }

    record Ping() implements ClientRequest {
    }

    /** A well-formed request with a {@code type} the bridge does not handle. */
    record Unknown(String type) implements ClientRequest {
    }
}
