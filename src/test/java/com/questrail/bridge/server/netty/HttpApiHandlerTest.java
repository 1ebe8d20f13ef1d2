package com.questrail.bridge.server.netty;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.bridge.clients.ClientRegistry;
import com.questrail.bridge.link.SerialLinkManager;
import com.questrail.bridge.protocol.envelope.codec.EnvelopeCodec;
import com.questrail.bridge.protocol.line.codec.impl.DefaultLineCodec;
import com.questrail.bridge.router.BridgeRouter;
import com.questrail.bridge.time.DeterministicScheduler;
import com.questrail.bridge.time.ManualMonotonicClock;
import com.questrail.bridge.transport.FakeSerialPortConnector;
import com.questrail.bridge.transport.SerialPortSettings;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HttpApiHandlerTest {

    private FakeSerialPortConnector connector;
    private SerialLinkManager link;
    private EnvelopeCodec codec;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        connector = new FakeSerialPortConnector(true);
        codec = new EnvelopeCodec();
        link = new SerialLinkManager(new SerialPortSettings("COM3", 9600, Duration.ofSeconds(1)),
            connector, new DefaultLineCodec(), new DeterministicScheduler(clock), clock, Duration.ofSeconds(5));
        ClientRegistry registry = new ClientRegistry(100, codec);
        BridgeRouter router = new BridgeRouter(link, registry, codec);
        channel = new EmbeddedChannel(new HttpApiHandler(router, codec.mapper()));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private record Reply(HttpResponseStatus status, String allowOrigin, JsonNode body) {}

    private Reply exchange(HttpMethod method, String uri, String body) throws Exception {
        FullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, method, uri,
            body == null ? Unpooled.EMPTY_BUFFER : Unpooled.copiedBuffer(body, StandardCharsets.UTF_8));
        request.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
        channel.writeInbound(request);

        FullHttpResponse response = channel.readOutbound();
        assertNotNull(response, "no response written");
        try {
            String text = response.content().toString(StandardCharsets.UTF_8);
            JsonNode json = text.isEmpty() ? null : codec.mapper().readTree(text);
            return new Reply(response.status(),
                response.headers().get(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN), json);
        } finally {
            response.release();
        }
    }

    @Test
    void rootReturnsBanner() throws Exception {
        Reply r = exchange(HttpMethod.GET, "/", null);

        assertEquals(HttpResponseStatus.OK, r.status());
        assertEquals("*", r.allowOrigin());
        assertEquals("Arduino Bridge Server", r.body().get("message").asText());
        assertEquals("1.0.0", r.body().get("version").asText());
        assertEquals("running", r.body().get("status").asText());
    }

    @Test
    void statusReportsLinkAndClients() throws Exception {
        Reply r = exchange(HttpMethod.GET, "/api/status", null);

        assertEquals(HttpResponseStatus.OK, r.status());
        JsonNode serial = r.body().get("serial");
        assertFalse(serial.get("connected").asBoolean());
        assertEquals("disconnected", serial.get("state").asText());
        assertEquals("COM3", serial.get("port").asText());
        assertEquals(9600, serial.get("baudrate").asInt());
        assertEquals(0, r.body().get("websocket").get("active_connections").asInt());
        assertEquals(100, r.body().get("websocket").get("max_connections").asInt());
        assertEquals("running", r.body().get("server").get("status").asText());

        link.connect();
        Reply after = exchange(HttpMethod.GET, "/api/status?verbose=1", null);
        assertTrue(after.body().get("serial").get("connected").asBoolean());
    }

    @Test
    void publishWritesToDevice() throws Exception {
        link.connect();

        Reply r = exchange(HttpMethod.POST, "/api/publish", "{\"topic\":\"led\",\"payload\":\"on\"}");

        assertEquals(HttpResponseStatus.OK, r.status());
        assertTrue(r.body().get("success").asBoolean());
        assertEquals("led", r.body().get("topic").asText());
        assertEquals("on", r.body().get("payload").asText());
        assertEquals("Message published successfully", r.body().get("message").asText());
        assertEquals("led:on\n", connector.lastChannel().writtenText());
    }

    @Test
    void publishWhileDisconnectedIs503() throws Exception {
        Reply r = exchange(HttpMethod.POST, "/api/publish", "{\"topic\":\"\",\"payload\":\"on\"}");

        assertEquals(HttpResponseStatus.SERVICE_UNAVAILABLE, r.status());
        assertEquals("Serial port not connected", r.body().get("detail").asText());
    }

    @Test
    void publishWithEmptyTopicIs400() throws Exception {
        link.connect();

        Reply r = exchange(HttpMethod.POST, "/api/publish", "{\"topic\":\"\",\"payload\":\"on\"}");

        assertEquals(HttpResponseStatus.BAD_REQUEST, r.status());
        assertEquals("Topic cannot be empty", r.body().get("detail").asText());
        assertEquals("", connector.lastChannel().writtenText());
    }

    @Test
    void publishWithMalformedBodyIs400() throws Exception {
        link.connect();

        assertEquals(HttpResponseStatus.BAD_REQUEST, exchange(HttpMethod.POST, "/api/publish", "{nope").status());
        assertEquals(HttpResponseStatus.BAD_REQUEST, exchange(HttpMethod.POST, "/api/publish", "[1]").status());
    }

    @Test
    void publishWriteFailureIs500() throws Exception {
        link.connect();
        connector.lastChannel().failWrites(true);

        Reply r = exchange(HttpMethod.POST, "/api/publish", "{\"topic\":\"led\",\"payload\":\"on\"}");

        assertEquals(HttpResponseStatus.INTERNAL_SERVER_ERROR, r.status());
        assertEquals("Failed to write to serial port", r.body().get("detail").asText());
    }

    @Test
    void unknownPathIs404() throws Exception {
        Reply r = exchange(HttpMethod.GET, "/nowhere", null);
        assertEquals(HttpResponseStatus.NOT_FOUND, r.status());
        assertEquals("*", r.allowOrigin());
    }

    @Test
    void wrongMethodIs405() throws Exception {
        assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED, exchange(HttpMethod.GET, "/api/publish", null).status());
        assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED, exchange(HttpMethod.DELETE, "/", null).status());
    }

    @Test
    void preflightIsAnswered() throws Exception {
        Reply r = exchange(HttpMethod.OPTIONS, "/api/publish", null);
        assertEquals(HttpResponseStatus.NO_CONTENT, r.status());
        assertEquals("*", r.allowOrigin());
    }
}
