package com.questrail.network.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Test-only {@link TransportAcceptor}. Tests call {@link #accept()} to simulate
 * an inbound session.
 */
public final class FakeTransportAcceptor implements TransportAcceptor {

    private static final SocketAddress LOCAL = InetSocketAddress.createUnresolved("fake", 7777);

    private TransportAcceptorListener listener;
    private final List<FakeTransportBinding> accepted = new ArrayList<>();
    private boolean started;
    private boolean closed;
    private RuntimeException startFailure;

    @Override
    public synchronized void setListener(TransportAcceptorListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized void start() {
        if (listener == null) {
            throw new IllegalStateException("TransportAcceptorListener must be set before start()");
        }
        if (startFailure != null) {
            throw startFailure;
        }
        started = true;
    }

    @Override
    public synchronized void stop() {
        started = false;
    }

    @Override
    public synchronized void close() {
        started = false;
        closed = true;
    }

    @Override
    public synchronized SocketAddress localAddress() {
        return started ? LOCAL : null;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    /**
     * Hand a fresh binding to the listener, as the real acceptor does for a
     * new socket. The binding is not reported up until the test says so.
     */
    public FakeTransportBinding accept() {
        FakeTransportBinding binding = new FakeTransportBinding();
        TransportAcceptorListener l;
        synchronized (this) {
            accepted.add(binding);
            l = listener;
        }
        l.onAccepted(binding);
        return binding;
    }

    /**
     * Make {@link #start()} throw {@code failure}; {@code null} lets it succeed again.
     */
    public synchronized void failStartWith(RuntimeException failure) {
        this.startFailure = failure;
    }

    public synchronized List<FakeTransportBinding> accepted() {
        return new ArrayList<>(accepted);
    }

    public synchronized boolean isStarted() {
        return started;
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
