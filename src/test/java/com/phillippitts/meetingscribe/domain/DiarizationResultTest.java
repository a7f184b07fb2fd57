package com.phillippitts.meetingscribe.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiarizationResultTest {

    @Test
    void speakerCountIsDistinctLabels() {
        DiarizationResult result = DiarizationResult.fromSegments(List.of(
                new SpeakerSegment("A", 0.0, 1.0),
                new SpeakerSegment("B", 1.0, 2.0),
                new SpeakerSegment("A", 2.0, 3.0)));

        assertThat(result.speakerCount()).isEqualTo(2);
        assertThat(result.segments()).hasSize(3);
    }

    @Test
    void lookupUsesHalfOpenRanges() {
        DiarizationResult result = DiarizationResult.fromSegments(List.of(
                new SpeakerSegment("A", 0.0, 1.0),
                new SpeakerSegment("B", 1.0, 2.0)));

        assertThat(result.speakerLabelAt(0.0)).contains("A");
        assertThat(result.speakerLabelAt(1.0)).contains("B");
        assertThat(result.speakerLabelAt(2.0)).isEmpty();
    }

    @Test
    void renameKeepsSpeakerCount() {
        DiarizationResult result = DiarizationResult.fromSegments(List.of(
                new SpeakerSegment("A", 0.0, 1.0),
                new SpeakerSegment("B", 1.0, 2.0)));

        DiarizationResult renamed = result.withRenamedSpeaker("A", "Host");

        assertThat(renamed.speakerLabelAt(0.5)).contains("Host");
        assertThat(renamed.speakerCount()).isEqualTo(2);
        assertThat(renamed.segmentCount("Host")).isEqualTo(1);
        assertThat(result.withRenamedSpeaker("nobody", "X")).isSameAs(result);
    }

    @Test
    void renameLeavesOriginalUntouched() {
        DiarizationResult result = DiarizationResult.fromSegments(List.of(
                new SpeakerSegment("A", 0.0, 1.0),
                new SpeakerSegment("A", 2.0, 3.0)));

        result.withRenamedSpeaker("A", "Host");

        assertThat(result.speakerLabelAt(0.5)).contains("A");
        assertThat(result.segmentCount("A")).isEqualTo(2);
        assertThat(result.segmentCount("Host")).isZero();
    }

    @Test
    void constructorCopiesSegmentList() {
        List<SpeakerSegment> source = new ArrayList<>(List.of(new SpeakerSegment("A", 0.0, 1.0)));
        DiarizationResult result = DiarizationResult.fromSegments(source);

        source.set(0, new SpeakerSegment("B", 0.0, 1.0));

        assertThat(result.speakerLabelAt(0.5)).contains("A");
    }

    @Test
    void segmentsViewIsReadOnly() {
        DiarizationResult result = DiarizationResult.empty();

        assertThatThrownBy(() -> result.segments().add(new SpeakerSegment("A", 0, 1)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void segmentRejectsInvertedRange() {
        assertThatThrownBy(() -> new SpeakerSegment("A", 2.0, 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(new SpeakerSegment("A", 1.0, 2.5).duration()).isEqualTo(1.5);
    }
}
