package com.questrail.netsdr.protocol.netsdr.internal.exec;

import com.questrail.netsdr.protocol.netsdr.internal.events.InboundEvent;
import com.questrail.netsdr.protocol.netsdr.observability.NetSdrErrorEvent;
import com.questrail.netsdr.protocol.netsdr.observability.NetSdrObservabilitySink;
import com.questrail.netsdr.protocol.netsdr.observability.NullObservabilitySink;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * InboundDispatcher
 * =============================================================================
 * Serialized event loop for transport notifications.
 *
 * <h2>Purpose</h2>
 * Transport callbacks run on I/O threads that must not be blocked and must
 * not re-enter client logic. Instead they {@link #submit(InboundEvent)} to
 * this dispatcher, which hands events to a single handler on its own thread,
 * one at a time and in submission order.
 *
 * <h2>Threading Model</h2>
 * <ul>
 *   <li>Any thread may submit</li>
 *   <li>Exactly one thread runs the handler</li>
 *   <li>A handler failure is reported to the observability sink and the loop keeps going</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   dispatcher.start()        → starts the dispatcher thread
 *   dispatcher.submit(...)    → enqueues an event
 *   dispatcher.stop()         → stops the thread; queued events are discarded
 * </pre>
 */
public final class InboundDispatcher {

    private final Consumer<InboundEvent> handler;
    private final NetSdrObservabilitySink observabilitySink;
    private final String threadName;

    private final BlockingQueue<InboundEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread eventLoopThread;

    public InboundDispatcher(Consumer<InboundEvent> handler,
                             NetSdrObservabilitySink observabilitySink,
                             String threadName)
    {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.threadName = Objects.requireNonNull(threadName, "threadName");
    }

    /**
     * Starts the dispatcher thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, threadName);
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
        }
    }

    /**
     * Stops the dispatcher thread and waits for it to terminate.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = eventLoopThread;
            if (t != null && t != Thread.currentThread()) {
                t.interrupt();
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            eventQueue.clear();
        }
    }

    /**
     * Enqueues an event. Events submitted while the dispatcher is stopped are dropped.
     */
    public void submit(InboundEvent event) {
        Objects.requireNonNull(event, "event");
        if (running.get()) {
            eventQueue.offer(event);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runEventLoop() {
        while (running.get()) {
            try {
                InboundEvent event = eventQueue.take();
                if (running.get()) {
                    handler.accept(event);
                }
            } catch (InterruptedException e) {
                // Expected during shutdown; the loop condition decides whether to exit.
            } catch (Exception e) {
                observabilitySink.onError(new NetSdrErrorEvent(
                    Instant.now(),
                    "Inbound event processing error",
                    e
                ));
            }
        }
    }
}
