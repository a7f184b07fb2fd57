package com.phillippitts.meetingscribe.service.stream;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkStreamTest {

    @Test
    void deliversItemsInOrderThenEnd() throws Exception {
        ChunkStream<String> stream = new ChunkStream<>("test");
        stream.emit("a");
        stream.emit("b");
        stream.complete();

        assertThat(stream.next()).isEqualTo("a");
        assertThat(stream.next()).isEqualTo("b");
        assertThat(stream.next()).isNull();
        assertThat(stream.next()).isNull();
        assertThat(stream.isFinished()).isTrue();
    }

    @Test
    void emitAfterCompleteIsRejected() {
        ChunkStream<String> stream = new ChunkStream<>("test");
        stream.complete();

        assertThat(stream.emit("late")).isFalse();
        assertThat(stream.isTerminal()).isTrue();
    }

    @Test
    void cancelDropsPendingItemsAndWakesConsumer() throws Exception {
        ChunkStream<String> stream = new ChunkStream<>("test");
        stream.emit("pending");
        stream.cancel();

        assertThat(stream.next()).isNull();
        assertThat(stream.isCancelled()).isTrue();
        assertThat(stream.emit("x")).isFalse();
    }

    @Test
    void blockedConsumerSeesCancellation() throws Exception {
        ChunkStream<String> stream = new ChunkStream<>("test");
        CompletableFuture<String> reader = CompletableFuture.supplyAsync(() -> {
            try {
                return stream.next();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        stream.cancel();

        assertThat(reader.get(2, TimeUnit.SECONDS)).isNull();
    }

    @Test
    void timedNextDistinguishesTimeoutFromEnd() throws Exception {
        ChunkStream<String> stream = new ChunkStream<>("test");

        assertThat(stream.next(10, TimeUnit.MILLISECONDS)).isNull();
        assertThat(stream.isFinished()).isFalse();

        stream.complete();
        assertThat(stream.next(10, TimeUnit.MILLISECONDS)).isNull();
        assertThat(stream.isFinished()).isTrue();
    }

    @Test
    void drainToStopsAtEndMarker() {
        ChunkStream<String> stream = new ChunkStream<>("test");
        stream.emit("a");
        stream.emit("b");
        stream.complete();
        List<String> target = new ArrayList<>();

        assertThat(stream.drainTo(target)).isEqualTo(2);
        assertThat(target).containsExactly("a", "b");
        assertThat(stream.isFinished()).isTrue();
    }

    @Test
    void finishedOnlyOncePendingItemsAreRead() throws Exception {
        ChunkStream<String> stream = new ChunkStream<>("test");
        stream.emit("a");
        stream.complete();

        assertThat(stream.isTerminal()).isTrue();
        assertThat(stream.isFinished()).isFalse();
        assertThat(stream.next()).isEqualTo("a");
        assertThat(stream.isFinished()).isTrue();

        List<String> target = new ArrayList<>();
        assertThat(stream.drainTo(target)).isZero();
        assertThat(stream.next(10, TimeUnit.MILLISECONDS)).isNull();
        assertThat(stream.isFinished()).isTrue();
    }

    @Test
    void rejectsNullItems() {
        ChunkStream<String> stream = new ChunkStream<>("test");

        assertThatThrownBy(() -> stream.emit(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
