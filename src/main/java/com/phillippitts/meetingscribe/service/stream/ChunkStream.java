package com.phillippitts.meetingscribe.service.stream;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded, thread-safe asynchronous sequence of items with completion and cancellation.
 *
 * <p>Producers call {@link #emit(Object)} and finally {@link #complete()}. Consumers call
 * {@link #next()} until it returns {@code null}, which marks the end of the stream.
 * {@link #cancel()} is terminal for both sides: pending items are dropped, blocked consumers wake up
 * and further emits are rejected. Items are delivered in emit order.
 *
 * @param <T> item type
 */
public final class ChunkStream<T> {

    private final Optional<T> end = Optional.empty();
    // Items travel wrapped; the single empty entry is the end-of-stream marker
    private final LinkedBlockingQueue<Optional<T>> queue = new LinkedBlockingQueue<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final String name;
    private boolean completed;
    private volatile boolean cancelled;

    public ChunkStream(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Appends an item.
     *
     * @return false if the stream was already completed or cancelled and the item was dropped
     */
    public boolean emit(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item must not be null");
        }
        lock.lock();
        try {
            if (completed || cancelled) {
                return false;
            }
            queue.add(Optional.of(item));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the end of the stream. Items emitted before remain readable. Idempotent.
     */
    public void complete() {
        lock.lock();
        try {
            if (completed || cancelled) {
                return;
            }
            completed = true;
            queue.add(end);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Terminates the stream from either side, discarding unread items. Idempotent.
     */
    public void cancel() {
        lock.lock();
        try {
            if (cancelled) {
                return;
            }
            cancelled = true;
            completed = true;
            queue.clear();
            queue.add(end);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the next item is available.
     *
     * @return the next item, or {@code null} once the stream has ended or was cancelled
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public T next() throws InterruptedException {
        return unwrap(queue.take());
    }

    /**
     * Like {@link #next()} but gives up after the timeout.
     *
     * @return the next item, or {@code null} on end of stream or timeout; use {@link #isFinished()}
     *         to tell them apart
     */
    public T next(long timeout, TimeUnit unit) throws InterruptedException {
        Optional<T> item = queue.poll(timeout, unit);
        if (item == null) {
            return null;
        }
        return unwrap(item);
    }

    /**
     * Moves every currently buffered item into {@code target} without blocking.
     *
     * @return number of items moved
     */
    public int drainTo(Collection<? super T> target) {
        int moved = 0;
        Optional<T> item;
        while ((item = queue.peek()) != null && item.isPresent()) {
            Optional<T> polled = queue.poll();
            if (polled == null) {
                break;
            }
            if (polled.isEmpty()) {
                queue.add(end);
                break;
            }
            target.add(polled.get());
            moved++;
        }
        return moved;
    }

    /**
     * True once completed or cancelled; items may still be readable after completion.
     */
    public boolean isTerminal() {
        lock.lock();
        try {
            return completed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * True once the stream is terminal and every item has been consumed.
     */
    public boolean isFinished() {
        Optional<T> head = queue.peek();
        return isTerminal() && head != null && head.isEmpty();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private T unwrap(Optional<T> item) {
        if (item.isEmpty()) {
            // Leave the marker in place so every later (or concurrent) consumer also sees the end
            queue.add(end);
            return null;
        }
        return item.get();
    }

    @Override
    public String toString() {
        return "ChunkStream{" + name + ", terminal=" + isTerminal() + ", cancelled=" + cancelled + '}';
    }
}
