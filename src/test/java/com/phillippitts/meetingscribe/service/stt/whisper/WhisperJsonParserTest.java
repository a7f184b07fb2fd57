package com.phillippitts.meetingscribe.service.stt.whisper;

import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.exception.TranscriptionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhisperJsonParserTest {

    @Test
    void parsesWhisperCppOffsetsInMilliseconds() {
        String json = """
            {
              "transcription": [
                {"offsets": {"from": 0, "to": 1200}, "text": " Hello there."},
                {"offsets": {"from": 1200, "to": 2000}, "text": " How are you?"}
              ]
            }
            """;

        List<TranscriptionSegment> segments = WhisperJsonParser.parseSegments(json, 2.0);

        assertThat(segments).containsExactly(
                new TranscriptionSegment("Hello there.", 0.0, 1.2),
                new TranscriptionSegment("How are you?", 1.2, 2.0));
    }

    @Test
    void parsesSegmentsInSeconds() {
        String json = "{\"segments\": [{\"start\": 0.5, \"end\": 1.75, \"text\": \"hola\"}]}";

        List<TranscriptionSegment> segments = WhisperJsonParser.parseSegments(json, 2.0);

        assertThat(segments).containsExactly(new TranscriptionSegment("hola", 0.5, 1.75));
    }

    @Test
    void topLevelTextSpansWholeClip() {
        List<TranscriptionSegment> segments = WhisperJsonParser.parseSegments("{\"text\": \"hello world\"}", 2.5);

        assertThat(segments).containsExactly(new TranscriptionSegment("hello world", 0.0, 2.5));
    }

    @Test
    void skipsBlankSegments() {
        String json = """
            {
              "transcription": [
                {"offsets": {"from": 0, "to": 500}, "text": "First segment"},
                {"offsets": {"from": 500, "to": 900}, "text": ""},
                {"offsets": {"from": 900, "to": 1000}, "text": "   "},
                {"offsets": {"from": 1000, "to": 1800}, "text": "Last segment"}
              ]
            }
            """;

        List<TranscriptionSegment> segments = WhisperJsonParser.parseSegments(json, 2.0);

        assertThat(segments).extracting(TranscriptionSegment::text).containsExactly("First segment", "Last segment");
    }

    @Test
    void emptyOutputMeansNoSpeech() {
        assertThat(WhisperJsonParser.parseSegments(null, 2.0)).isEmpty();
        assertThat(WhisperJsonParser.parseSegments("  ", 2.0)).isEmpty();
    }

    @Test
    void malformedJsonThrows() {
        assertThatThrownBy(() -> WhisperJsonParser.parseSegments("{ not-json", 2.0))
                .isInstanceOf(TranscriptionException.class)
                .hasMessageContaining("Unparseable whisper.cpp output");
    }
}
