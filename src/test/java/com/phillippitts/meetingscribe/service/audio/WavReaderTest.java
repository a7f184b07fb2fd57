package com.phillippitts.meetingscribe.service.audio;

import com.phillippitts.meetingscribe.exception.InvalidAudioException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WavReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void readsBackEncodedSamples() {
        float[] samples = new float[1600];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = (float) Math.sin(i / 10.0) * 0.5f;
        }
        Path wav = tempDir.resolve("meeting.wav");
        WavEncoder.write(samples, wav);

        WavReader.MonoAudio audio = WavReader.readMono(wav);

        assertThat(audio.sampleRate()).isEqualTo(16_000);
        assertThat(audio.samples()).hasSize(1600);
        for (int i = 0; i < samples.length; i += 97) {
            assertThat(audio.samples()[i]).isCloseTo(samples[i], within(1e-3f));
        }
    }

    @Test
    void downmixAveragesChannels() {
        float[] stereo = {0.2f, 0.4f, -1.0f, 1.0f};

        assertThat(WavReader.downmix(stereo, 2)).containsExactly(0.3f, 0.0f);
        assertThat(WavReader.downmix(stereo, 1)).isSameAs(stereo);
    }

    @Test
    void rejectsNonAudioFile() throws Exception {
        Path notWav = Files.writeString(tempDir.resolve("notes.wav"), "definitely not riff data");

        assertThatThrownBy(() -> WavReader.readMono(notWav))
                .isInstanceOf(InvalidAudioException.class)
                .hasMessageContaining("Not a readable audio file");
    }
}
