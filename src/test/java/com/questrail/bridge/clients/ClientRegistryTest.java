package com.questrail.bridge.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.bridge.internal.time.SystemClock;
import com.questrail.bridge.observability.ClientRegistryEvent;
import com.questrail.bridge.observability.RecordingObservabilitySink;
import com.questrail.bridge.protocol.envelope.codec.EnvelopeCodec;
import com.questrail.bridge.protocol.envelope.model.Envelope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ClientRegistryTest {

    private EnvelopeCodec codec;
    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() {
        codec = new EnvelopeCodec();
        sink = new RecordingObservabilitySink();
    }

    private ClientRegistry registry(int max) {
        return new ClientRegistry(max, codec, sink, SystemClock.INSTANCE);
    }

    private JsonNode json(String text) throws Exception {
        return codec.mapper().readTree(text);
    }

    @Test
    void acceptsUpToCapacityAndRejectsBeyond() {
        ClientRegistry registry = registry(2);
        RecordingClientConnection a = new RecordingClientConnection("a");
        RecordingClientConnection b = new RecordingClientConnection("b");
        RecordingClientConnection c = new RecordingClientConnection("c");

        assertTrue(registry.accept(a));
        assertTrue(registry.accept(b));
        assertFalse(registry.accept(c));

        assertEquals(2, registry.count());
        assertFalse(registry.contains(c));

        List<ClientRegistryEvent.Kind> kinds = sink.getClientEvents().stream()
            .map(ClientRegistryEvent::kind)
            .collect(Collectors.toList());
        assertEquals(List.of(ClientRegistryEvent.Kind.ACCEPTED, ClientRegistryEvent.Kind.ACCEPTED,
            ClientRegistryEvent.Kind.REJECTED), kinds);
    }

    @Test
    void removalFreesCapacity() {
        ClientRegistry registry = registry(1);
        RecordingClientConnection a = new RecordingClientConnection("a");
        RecordingClientConnection b = new RecordingClientConnection("b");

        assertTrue(registry.accept(a));
        assertFalse(registry.accept(b));
        registry.remove(a);
        assertTrue(registry.accept(b));
        assertEquals(1, registry.count());
    }

    @Test
    void acceptingSameConnectionTwiceDoesNotDoubleCount() {
        ClientRegistry registry = registry(5);
        RecordingClientConnection a = new RecordingClientConnection("a");

        assertTrue(registry.accept(a));
        assertTrue(registry.accept(a));
        assertEquals(1, registry.count());
    }

    @Test
    void differentConnectionWithTakenIdIsRefused() {
        ClientRegistry registry = registry(5);
        assertTrue(registry.accept(new RecordingClientConnection("a")));
        assertFalse(registry.accept(new RecordingClientConnection("a")));
    }

    @Test
    void removeOfUnknownConnectionIsANoOp() {
        ClientRegistry registry = registry(5);
        registry.remove(new RecordingClientConnection("ghost"));
        assertEquals(0, registry.count());
        assertTrue(sink.getClientEvents().isEmpty());
    }

    @Test
    void broadcastReachesEveryClient() throws Exception {
        ClientRegistry registry = registry(5);
        RecordingClientConnection a = new RecordingClientConnection("a");
        RecordingClientConnection b = new RecordingClientConnection("b");
        registry.accept(a);
        registry.accept(b);

        registry.broadcast(new Envelope.Message("temp", "23.5", "arduino"));

        String expected = "{\"type\":\"message\",\"topic\":\"temp\",\"payload\":\"23.5\",\"source\":\"arduino\"}";
        assertEquals(1, a.received().size());
        assertEquals(json(expected), json(a.last()));
        assertEquals(a.received(), b.received(), "serialized once, same text for everyone");
    }

    @Test
    void broadcastWithNoClientsIsHarmless() {
        assertDoesNotThrow(() -> registry(5).broadcast(new Envelope.Pong()));
    }

    @Test
    void failedSendPrunesOnlyTheBrokenClient() {
        ClientRegistry registry = registry(5);
        RecordingClientConnection good = new RecordingClientConnection("good");
        RecordingClientConnection bad = new RecordingClientConnection("bad");
        registry.accept(good);
        registry.accept(bad);
        bad.breakConnection();

        registry.broadcast(new Envelope.Pong());

        assertTrue(registry.contains(good));
        assertFalse(registry.contains(bad));
        assertEquals(1, good.received().size());
        assertTrue(sink.getClientEvents().stream()
            .anyMatch(e -> e.kind() == ClientRegistryEvent.Kind.PRUNED && e.clientId().equals("bad")));

        // Not retried on the next broadcast.
        registry.broadcast(new Envelope.Pong());
        assertEquals(2, good.received().size());
    }

    @Test
    void sendToDeliversToOneClientOnly() throws Exception {
        ClientRegistry registry = registry(5);
        RecordingClientConnection a = new RecordingClientConnection("a");
        RecordingClientConnection b = new RecordingClientConnection("b");
        registry.accept(a);
        registry.accept(b);

        assertTrue(registry.sendTo(new Envelope.Ack(true, "led"), a));

        assertEquals(1, a.received().size());
        assertEquals(json("{\"type\":\"ack\",\"success\":true,\"topic\":\"led\"}"), json(a.last()));
        assertTrue(b.received().isEmpty());
    }

    @Test
    void failedPersonalSendPrunesAndReportsFalse() {
        ClientRegistry registry = registry(5);
        RecordingClientConnection a = new RecordingClientConnection("a");
        registry.accept(a);
        a.breakConnection();

        assertFalse(registry.sendTo(new Envelope.Pong(), a));
        assertEquals(0, registry.count());
    }

    @Test
    void concurrentAdmissionNeverExceedsCapacity() throws InterruptedException {
        int capacity = 10;
        int contenders = 64;
        ClientRegistry registry = registry(capacity);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        List<RecordingClientConnection> all = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            all.add(new RecordingClientConnection("c" + i));
        }

        try {
            for (RecordingClientConnection c : all) {
                pool.submit(() -> {
                    go.await();
                    if (registry.accept(c)) {
                        admitted.incrementAndGet();
                    }
                    return null;
                });
            }
            go.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(capacity, admitted.get());
        assertEquals(capacity, registry.count());
    }

    @Test
    void broadcastConcurrentWithChurnDeliversToStableClients() throws InterruptedException {
        ClientRegistry registry = registry(100);
        RecordingClientConnection stable = new RecordingClientConnection("stable");
        registry.accept(stable);

        Thread churn = new Thread(() -> {
            for (int i = 0; i < 500; i++) {
                RecordingClientConnection c = new RecordingClientConnection("churn" + i);
                registry.accept(c);
                registry.remove(c);
            }
        });
        churn.start();
        for (int i = 0; i < 500; i++) {
            registry.broadcast(new Envelope.Pong());
        }
        churn.join();

        assertEquals(500, stable.received().size());
        assertEquals(1, registry.count());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ClientRegistry(0, codec));
    }
}
