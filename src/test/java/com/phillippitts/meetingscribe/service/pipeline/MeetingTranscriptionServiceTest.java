package com.phillippitts.meetingscribe.service.pipeline;

import com.phillippitts.meetingscribe.domain.AudioChunk;
import com.phillippitts.meetingscribe.domain.LabeledAudioChunk;
import com.phillippitts.meetingscribe.domain.TranscriptSegment;
import com.phillippitts.meetingscribe.service.stream.ChunkStream;
import com.phillippitts.meetingscribe.service.stream.StreamMerger;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MeetingTranscriptionServiceTest {

    private StreamMerger merger;
    private SpeakerWindowDispatcher dispatcher;
    private MeetingTranscriptionService service;

    private final ChunkStream<AudioChunk> mic = new ChunkStream<>("mic");
    private final ChunkStream<AudioChunk> system = new ChunkStream<>("system");
    private final ChunkStream<LabeledAudioChunk> merged = new ChunkStream<>("merged");
    private final ChunkStream<TranscriptSegment> transcript = new ChunkStream<>("transcript");

    @BeforeEach
    void setUp() {
        merger = mock(StreamMerger.class);
        dispatcher = mock(SpeakerWindowDispatcher.class);
        service = new MeetingTranscriptionService(merger, dispatcher);
    }

    @Test
    void startMergesSourcesAndFeedsDispatcher() {
        when(merger.merge(mic, system)).thenReturn(merged);
        when(dispatcher.start(merged)).thenReturn(transcript);

        ChunkStream<TranscriptSegment> result = service.start(mic, system);

        assertThat(result).isSameAs(transcript);
        assertThat(service.currentSessionId()).hasValueSatisfying(id -> assertThat(id).hasSize(8));
    }

    @Test
    void sessionIdIsInThreadContextWhileWorkersAreSubmitted() {
        AtomicReference<String> seen = new AtomicReference<>();
        when(merger.merge(mic, system)).thenAnswer(invocation -> {
            seen.set(ThreadContext.get(MeetingTranscriptionService.MDC_SESSION_ID));
            return merged;
        });
        when(dispatcher.start(any())).thenReturn(transcript);

        service.start(mic, system);

        assertThat(seen.get()).isEqualTo(service.currentSessionId().orElseThrow());
        assertThat(ThreadContext.get(MeetingTranscriptionService.MDC_SESSION_ID)).isNull();
    }

    @Test
    void restartOpensNewSession() {
        when(merger.merge(any(), any())).thenReturn(merged);
        when(dispatcher.start(any())).thenReturn(transcript);

        service.start(mic, system);
        String first = service.currentSessionId().orElseThrow();
        service.start(new ChunkStream<>("mic2"), new ChunkStream<>("system2"));

        assertThat(service.currentSessionId()).isPresent().isNotEqualTo(java.util.Optional.of(first));
    }

    @Test
    void stopDelegatesAndClearsSession() {
        when(merger.merge(mic, system)).thenReturn(merged);
        when(dispatcher.start(merged)).thenReturn(transcript);
        service.start(mic, system);

        service.stop();

        verify(dispatcher).stop();
        assertThat(service.currentSessionId()).isEmpty();
    }

    @Test
    void stopWithoutSessionIsNoOp() {
        service.stop();

        verify(dispatcher, never()).stop();
    }

    @Test
    void languageHintIsForwarded() {
        service.setLanguageHint("ru");

        verify(dispatcher).setLanguageHint("ru");
    }

    @Test
    void rejectsNullStreams() {
        assertThatThrownBy(() -> service.start(null, system)).isInstanceOf(NullPointerException.class);
    }
}
