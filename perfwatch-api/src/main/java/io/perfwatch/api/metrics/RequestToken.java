package io.perfwatch.api.metrics;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of a single in-flight request, created by {@link RequestMetricsCollector#onRequestStart()}.
 * <p>
 * A request may reach its end through more than one signal (normal completion, connection close,
 * async error or timeout). The token moves from {@link State#PENDING} to {@link State#FINALIZED}
 * exactly once; only the caller that wins that transition runs the terminal bookkeeping.
 */
public final class RequestToken {

    public enum State { PENDING, FINALIZED }

    private final long startNanos;
    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);

    public RequestToken(long startNanos) {
        this.startNanos = startNanos;
    }

    public static RequestToken start() {
        return new RequestToken(System.nanoTime());
    }

    /**
     * @return {@code true} if this call moved the token to FINALIZED, {@code false} if another
     * terminal signal already did
     */
    public boolean tryFinalize() {
        return state.compareAndSet(State.PENDING, State.FINALIZED);
    }

    public State state() {
        return state.get();
    }

    public boolean isFinalized() {
        return state.get() == State.FINALIZED;
    }

    public long startNanos() {
        return startNanos;
    }

    public long elapsedMillis() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
