package com.questrail.bridge.protocol.envelope.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.questrail.bridge.protocol.envelope.model.ClientRequest;
import com.questrail.bridge.protocol.envelope.model.Envelope;

import java.util.Objects;

/**
 * EnvelopeCodec
 * -----------------------------------------------------------------------------
 * JSON encoding of outbound {@link Envelope}s and decoding of inbound
 * {@link ClientRequest}s, backed by Jackson.
 *
 * <p>Thread-safe: the underlying {@link ObjectMapper} is configured once and
 * only read afterwards.</p>
 */
public final class EnvelopeCodec
{
    public static final String DEFAULT_REQUEST_TYPE = "publish";

    private final ObjectMapper mapper;
    private final ObjectWriter envelopeWriter;

    public EnvelopeCodec()
    {
        this(newMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.envelopeWriter = mapper.writerFor(Envelope.class);
    }

    /**
     * Mapper configuration shared by the envelope codec and the HTTP API.
     */
    public static ObjectMapper newMapper()
    {
        return new ObjectMapper()
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public ObjectMapper mapper()
    {
        return mapper;
    }

    /**
     * Serialize an envelope to its JSON text.
     *
     * @throws EnvelopeEncodingException if Jackson cannot serialize it
     */
    public String encode(Envelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");
        try {
            return envelopeWriter.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new EnvelopeEncodingException("Cannot serialize " + envelope.getClass().getSimpleName(), e);
        }
    }

    /**
     * Decode a client request.
     *
     * @throws EnvelopeDecodeException if {@code text} is not a JSON object
     */
    public ClientRequest decodeRequest(String text)
    {
        Objects.requireNonNull(text, "text");

        final JsonNode node;
        try {
            node = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new EnvelopeDecodeException("Invalid JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new EnvelopeDecodeException("Request is not a JSON object");
        }

        final String type = node.hasNonNull("type") ? node.get("type").asText() : DEFAULT_REQUEST_TYPE;
        switch (type) {
            case "publish":
                return new ClientRequest.Publish(textField(node, "topic"), textField(node, "payload"));
            case "ping":
                return new ClientRequest.Ping();
            default:
                return new ClientRequest.Unknown(type);
        }
    }

    private static String textField(JsonNode node, String field)
    {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return "";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
