package com.phillippitts.meetingscribe.service.stt.util;

import com.phillippitts.meetingscribe.exception.TranscriptionException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caps how many windows a backend transcribes at once.
 *
 * <pre>{@code
 * try (ConcurrencyGuard.Permit permit = guard.acquire()) {
 *     return runBackend(samples);
 * }
 * }</pre>
 *
 * A caller that cannot get a permit within the wait fails with {@link TranscriptionException}, which the
 * dispatcher treats like any other backend failure for that window.
 */
public final class ConcurrencyGuard {

    private final Semaphore permits;
    private final long waitMs;
    private final String backendName;

    public ConcurrencyGuard(int maxConcurrent, long waitMs, String backendName) {
        this.permits = new Semaphore(Math.max(1, maxConcurrent));
        this.waitMs = Math.max(0, waitMs);
        this.backendName = backendName;
    }

    public Permit acquire() {
        boolean granted;
        try {
            granted = permits.tryAcquire(waitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException("Interrupted while waiting for a " + backendName + " slot",
                    backendName, e);
        }
        if (!granted) {
            throw new TranscriptionException(
                    backendName + " concurrency limit reached after " + waitMs + "ms wait", backendName);
        }
        return new Permit();
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    /**
     * One held slot. Closing it more than once releases only once.
     */
    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean();

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                permits.release();
            }
        }
    }
}
