package com.ryuqq.connector.testkit.contract;

import com.ryuqq.connector.core.contract.VendorCall;
import com.ryuqq.connector.core.outcome.VendorOutcome;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fake vendor endpoint that answers from a script.
 *
 * <p>Scripted steps are consumed in order; once the script is empty every call is
 * answered by the fallback. A vendor can also be held so that callers block inside
 * the "network call" until the test releases them, which is how contract tests
 * observe single-flight and half-open behavior.</p>
 *
 * <pre>
 * ScriptedVendor&lt;String&gt; issues = ScriptedVendor.answering(token -&gt; Ok.of("[]"));
 * issues.then(Fail.of(FailureKind.SERVER_ERROR, 503, "unavailable"));
 * </pre>
 *
 * @param <T> the decoded response type
 * @author Connector Team
 * @since 1.0.0
 */
public final class ScriptedVendor<T> implements VendorCall<T> {

    private final Queue<VendorCall<T>> script = new ConcurrentLinkedQueue<>();
    private final List<String> tokens = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final CountDownLatch entered = new CountDownLatch(1);
    private volatile VendorCall<T> fallback;
    private volatile CountDownLatch gate;

    private ScriptedVendor(VendorCall<T> fallback) {
        this.fallback = fallback;
    }

    /**
     * Vendor that answers every unscripted call with the given function.
     *
     * @param fallback answer for calls beyond the script
     * @param <T> response type
     * @return new vendor
     */
    public static <T> ScriptedVendor<T> answering(VendorCall<T> fallback) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        return new ScriptedVendor<>(fallback);
    }

    public static <T> ScriptedVendor<T> always(VendorOutcome<T> outcome) {
        return answering(token -> outcome);
    }

    public ScriptedVendor<T> then(VendorOutcome<T> outcome) {
        script.add(token -> outcome);
        return this;
    }

    public ScriptedVendor<T> thenThrow(IOException error) {
        script.add(token -> {
            throw error;
        });
        return this;
    }

    public ScriptedVendor<T> otherwise(VendorCall<T> fallback) {
        if (fallback == null) {
            throw new IllegalArgumentException("fallback cannot be null");
        }
        this.fallback = fallback;
        return this;
    }

    /**
     * Makes subsequent calls block until {@link #release()}.
     */
    public ScriptedVendor<T> hold() {
        gate = new CountDownLatch(1);
        return this;
    }

    public void release() {
        CountDownLatch current = gate;
        if (current != null) {
            current.countDown();
        }
    }

    /**
     * Waits until at least one call has reached the vendor.
     *
     * @param timeout maximum wait
     * @return true if a call arrived in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitFirstCall(Duration timeout) throws InterruptedException {
        return entered.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public VendorOutcome<T> call(String accessToken) throws IOException {
        calls.incrementAndGet();
        if (accessToken != null) {
            tokens.add(accessToken);
        }
        entered.countDown();

        CountDownLatch current = gate;
        if (current != null) {
            try {
                if (!current.await(10, TimeUnit.SECONDS)) {
                    throw new IOException("scripted vendor was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted while held", e);
            }
        }

        VendorCall<T> step = script.poll();
        return (step != null ? step : fallback).call(accessToken);
    }

    public int calls() {
        return calls.get();
    }

    /**
     * Access tokens presented to this vendor, in arrival order.
     */
    public List<String> tokens() {
        return List.copyOf(tokens);
    }
}
