package com.questrail.bridge.transport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * FakeSerialPortConnector
 * -----------------------------------------------------------------------------
 * Test-only {@link SerialPortConnector}. While the device is "absent" every
 * open fails like a missing port; otherwise each open hands out a fresh
 * {@link FakeSerialPortChannel}.
 */
public final class FakeSerialPortConnector implements SerialPortConnector {

    private final List<FakeSerialPortChannel> opened = new ArrayList<>();
    private final List<SerialPortSettings> requests = new ArrayList<>();
    private boolean present;
    private Runnable onOpen = () -> {};

    public FakeSerialPortConnector(boolean present) {
        this.present = present;
    }

    @Override
    public SerialPortChannel open(SerialPortSettings settings) {
        Runnable hook;
        synchronized (this) {
            requests.add(settings);
            hook = onOpen;
        }
        hook.run();
        synchronized (this) {
            if (!present) {
                throw new SerialPortException("Port " + settings.portName() + " not found");
            }
            FakeSerialPortChannel channel = new FakeSerialPortChannel();
            opened.add(channel);
            return channel;
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public synchronized void setPresent(boolean present) {
        this.present = present;
    }

    /**
     * Run {@code hook} inside every open call, before the outcome is decided.
     */
    public synchronized void onOpen(Runnable hook) {
        this.onOpen = hook;
    }

    public synchronized int openAttempts() {
        return requests.size();
    }

    public synchronized List<SerialPortSettings> requests() {
        return Collections.unmodifiableList(new ArrayList<>(requests));
    }

    public synchronized List<FakeSerialPortChannel> opened() {
        return Collections.unmodifiableList(new ArrayList<>(opened));
    }

    public synchronized FakeSerialPortChannel lastChannel() {
        if (opened.isEmpty()) {
            throw new IllegalStateException("No channel opened yet");
        }
        return opened.get(opened.size() - 1);
    }
}
