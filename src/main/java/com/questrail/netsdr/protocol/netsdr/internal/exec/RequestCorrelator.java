package com.questrail.netsdr.protocol.netsdr.internal.exec;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * RequestCorrelator
 * =============================================================================
 * The single pending-request slot of the command channel.
 *
 * <h2>Purpose</h2>
 * NetSDR replies carry no request identifier, so a reply can only be matched
 * by position: the first acceptable frame that arrives while a request is
 * pending is its reply. What "acceptable" means is up to the requester; by
 * default any frame is. This class owns that one slot.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>At most one request is on the wire. Requests issued while one is
 *       pending queue behind it and are sent in issue order.</li>
 *   <li>The slot is filled <em>before</em> the frame is handed to the
 *       transport, so a reply that beats the send's own completion is not lost.</li>
 *   <li>{@link #complete(byte[])} with an empty slot, or with a frame the
 *       pending request does not accept as its reply, returns {@code false};
 *       the caller treats the frame as unsolicited.</li>
 *   <li>A failed send, a timeout, or {@link #failPending(Throwable)} fails the
 *       request and frees the slot.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * Requests may be issued from any thread; {@link #complete(byte[])} is called
 * from the dispatcher thread. The slot is an atomic hand-off.
 */
public final class RequestCorrelator {

    private final Duration timeout;
    private final AtomicReference<Pending> pending = new AtomicReference<>();
    private final Object queueLock = new Object();

    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    /**
     * @param timeout bound on waiting for a reply after the request was sent
     */
    public RequestCorrelator(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Queues a request that takes whatever frame arrives next as its reply.
     *
     * @param send writes the request frame; invoked once the slot is free
     * @return completes with the reply frame, or exceptionally on send failure,
     *         timeout, or {@link #failPending(Throwable)}
     */
    public CompletableFuture<byte[]> request(Supplier<CompletableFuture<Void>> send) {
        return request(send, frame -> true);
    }

    /**
     * Queues a request whose reply must satisfy {@code accepts}. Frames it
     * rejects while pending are left to the caller as unsolicited.
     *
     * @param send    writes the request frame; invoked once the slot is free
     * @param accepts decides whether a received frame is this request's reply;
     *                called on the thread that calls {@link #complete(byte[])}
     */
    public CompletableFuture<byte[]> request(Supplier<CompletableFuture<Void>> send, Predicate<byte[]> accepts) {
        Objects.requireNonNull(send, "send");
        Objects.requireNonNull(accepts, "accepts");

        CompletableFuture<byte[]> result = new CompletableFuture<>();
        CompletableFuture<Void> previous;
        synchronized (queueLock) {
            previous = tail;
            tail = result.handle((reply, error) -> null);
        }
        previous.whenComplete((ignored, error) -> begin(send, accepts, result));
        return result;
    }

    /**
     * Hands a received frame to the pending request, if there is one.
     *
     * @return {@code true} if the frame completed a pending request
     */
    public boolean complete(byte[] frame) {
        Pending slot = pending.get();
        if (slot == null || !slot.accepts().test(frame)) {
            return false;
        }
        return pending.compareAndSet(slot, null) && slot.reply().complete(frame);
    }

    /**
     * Fails the pending request, if there is one.
     */
    public void failPending(Throwable cause) {
        Pending slot = pending.getAndSet(null);
        if (slot != null) {
            slot.reply().completeExceptionally(cause);
        }
    }

    public boolean hasPending() {
        return pending.get() != null;
    }

    private void begin(Supplier<CompletableFuture<Void>> send,
                       Predicate<byte[]> accepts,
                       CompletableFuture<byte[]> result) {
        CompletableFuture<byte[]> reply = new CompletableFuture<>();
        Pending slot = new Pending(reply, accepts);
        pending.set(slot);

        reply.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
             .whenComplete((frame, error) -> {
                 pending.compareAndSet(slot, null);
                 if (error != null) {
                     result.completeExceptionally(unwrap(error));
                 } else {
                     result.complete(frame);
                 }
             });

        final CompletableFuture<Void> sent;
        try {
            sent = send.get();
        } catch (RuntimeException e) {
            reply.completeExceptionally(e);
            return;
        }
        sent.whenComplete((ignored, error) -> {
            if (error != null) {
                reply.completeExceptionally(unwrap(error));
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private record Pending(CompletableFuture<byte[]> reply, Predicate<byte[]> accepts) {}
}
