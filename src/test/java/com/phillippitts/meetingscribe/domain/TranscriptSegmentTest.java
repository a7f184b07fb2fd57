package com.phillippitts.meetingscribe.domain;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptSegmentTest {

    @Test
    void offsetsRelativeTimesByWindowStart() {
        TranscriptSegment segment = TranscriptSegment.of(
                new TranscriptionSegment("hello", 0.25, 1.5), 42.0, "Others", Optional.of(AppLanguage.ENGLISH));

        assertThat(segment.startTime()).isEqualTo(42.25);
        assertThat(segment.endTime()).isEqualTo(43.5);
        assertThat(segment.speaker()).isEqualTo("Others");
        assertThat(segment.id()).isNotNull();
    }

    @Test
    void eachSegmentGetsItsOwnId() {
        TranscriptionSegment relative = new TranscriptionSegment("x", 0, 1);

        assertThat(TranscriptSegment.of(relative, 0, "You", Optional.empty()).id())
                .isNotEqualTo(TranscriptSegment.of(relative, 0, "You", Optional.empty()).id());
    }

    @Test
    void rejectsInvertedTimes() {
        assertThatThrownBy(() -> new TranscriptionSegment("x", 2.0, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void audioSourcesMapToFixedLabels() {
        assertThat(AudioSource.MICROPHONE.speakerLabel()).isEqualTo("You");
        assertThat(AudioSource.SYSTEM_AUDIO.speakerLabel()).isEqualTo("Others");
        assertThat(LabeledAudioChunk.from(new AudioChunk(new float[8_000], 1.0, AudioSource.SYSTEM_AUDIO)))
                .satisfies(chunk -> {
                    assertThat(chunk.speaker()).isEqualTo("Others");
                    assertThat(chunk.durationSeconds()).isEqualTo(0.5);
                });
    }

    @Test
    void languageLookupIgnoresCaseAndAuto() {
        assertThat(AppLanguage.fromIsoCode("ES")).contains(AppLanguage.SPANISH);
        assertThat(AppLanguage.fromIsoCode("auto")).isEmpty();
        assertThat(AppLanguage.fromIsoCode(" ")).isEmpty();
        assertThat(AppLanguage.fromIsoCode("fr")).isEmpty();
    }
}
