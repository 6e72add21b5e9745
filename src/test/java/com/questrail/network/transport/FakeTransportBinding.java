package com.questrail.network.transport;

import com.questrail.network.api.Reliability;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * FakeTransportBinding
 * -----------------------------------------------------------------------------
 * Test-only {@link TransportBinding}.
 *
 * <p>Holds no connection semantics. It records what was handed to
 * {@link #send}, answers with scripted outcomes and lets tests drive the
 * listener (up, down, inbound messages) by hand.</p>
 */
public final class FakeTransportBinding implements TransportBinding {

    public record Sent(String payload, Reliability reliability) {}

    private final boolean upOnStart;

    private TransportBindingListener listener;
    private final List<Sent> sent = new ArrayList<>();
    private final Deque<SendOutcome> scriptedOutcomes = new ArrayDeque<>();
    private SendOutcome defaultOutcome = SendOutcome.SENT;
    private RuntimeException sendFailure;
    private RuntimeException metricsFailure;
    private TransportMetrics metrics = TransportMetrics.NONE;

    private int sendAttempts;
    private boolean started;
    private boolean stopped;
    private boolean downReported;

    public FakeTransportBinding() {
        this(false);
    }

    /**
     * @param upOnStart report the transport up as soon as {@link #start()} is called
     */
    public FakeTransportBinding(boolean upOnStart) {
        this.upOnStart = upOnStart;
    }

    @Override
    public synchronized void setListener(TransportBindingListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        TransportBindingListener l;
        synchronized (this) {
            if (listener == null) {
                throw new IllegalStateException("TransportBindingListener must be set before start()");
            }
            started = true;
            l = listener;
        }
        if (upOnStart) {
            l.onTransportUp();
        }
    }

    @Override
    public void stop() {
        synchronized (this) {
            stopped = true;
        }
        down(null);
    }

    @Override
    public synchronized SendOutcome send(String payload, Reliability reliability) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(reliability, "reliability");
        sendAttempts++;

        if (sendFailure != null) {
            throw sendFailure;
        }
        SendOutcome outcome = scriptedOutcomes.isEmpty() ? defaultOutcome : scriptedOutcomes.pollFirst();
        if (outcome == SendOutcome.SENT) {
            sent.add(new Sent(payload, reliability));
        }
        return outcome;
    }

    @Override
    public synchronized TransportMetrics metrics() {
        if (metricsFailure != null) {
            throw metricsFailure;
        }
        return metrics;
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void up() {
        requireListener().onTransportUp();
    }

    /**
     * Report the session down. Only the first call reaches the listener.
     */
    public void down(Throwable cause) {
        TransportBindingListener l;
        synchronized (this) {
            if (downReported || listener == null) {
                return;
            }
            downReported = true;
            l = listener;
        }
        l.onTransportDown(cause);
    }

    public void inject(String payload) {
        requireListener().onMessage(payload);
    }

    /**
     * Outcomes returned by the next sends, in order; afterwards the default applies.
     */
    public synchronized void scriptOutcomes(SendOutcome... outcomes) {
        Collections.addAll(scriptedOutcomes, outcomes);
    }

    public synchronized void setDefaultOutcome(SendOutcome outcome) {
        this.defaultOutcome = Objects.requireNonNull(outcome, "outcome");
    }

    public synchronized void failSendsWith(RuntimeException failure) {
        this.sendFailure = failure;
    }

    public synchronized void failMetricsWith(RuntimeException failure) {
        this.metricsFailure = failure;
    }

    public synchronized void setMetrics(TransportMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public synchronized List<Sent> sent() {
        return new ArrayList<>(sent);
    }

    public synchronized List<String> sentPayloads() {
        return sent.stream().map(Sent::payload).collect(Collectors.toList());
    }

    public synchronized int sendAttempts() {
        return sendAttempts;
    }

    public synchronized boolean isStarted() {
        return started;
    }

    public synchronized boolean isStopped() {
        return stopped;
    }

    private synchronized TransportBindingListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
