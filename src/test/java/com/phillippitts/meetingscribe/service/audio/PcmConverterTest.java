package com.phillippitts.meetingscribe.service.audio;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PcmConverterTest {

    @Test
    void clampsScalesAndTruncatesTowardZero() {
        assertThat(PcmConverter.toPcm16(2.0f)).isEqualTo((short) 32767);
        assertThat(PcmConverter.toPcm16(-3.0f)).isEqualTo((short) -32767);
        assertThat(PcmConverter.toPcm16(0.5f)).isEqualTo((short) 16383);
        assertThat(PcmConverter.toPcm16(-0.5f)).isEqualTo((short) -16383);
        assertThat(PcmConverter.toPcm16(0f)).isZero();
    }

    @Test
    void encodesTwoBytesPerSampleLittleEndian() {
        byte[] pcm = PcmConverter.toPcm16Le(new float[] {1.0f});

        assertThat(pcm).containsExactly((byte) 0xFF, (byte) 0x7F);
    }

    @Test
    void decodesWithinRange() {
        byte[] pcm = PcmConverter.toPcm16Le(new float[] {0.25f, -0.75f, 9f});

        float[] decoded = PcmConverter.fromPcm16Le(pcm, 0, pcm.length);

        assertThat(decoded[0]).isCloseTo(0.25f, within(1e-4f));
        assertThat(decoded[1]).isCloseTo(-0.75f, within(1e-4f));
        assertThat(decoded[2]).isEqualTo(1.0f);
    }

    @Test
    void rejectsOutOfBoundsRange() {
        assertThatThrownBy(() -> PcmConverter.fromPcm16Le(new byte[4], 2, 4))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rmsOfConstantSignalIsItsMagnitude() {
        assertThat(PcmConverter.rms(new float[] {0.5f, -0.5f, 0.5f, -0.5f})).isCloseTo(0.5, within(1e-9));
        assertThat(PcmConverter.rms(new float[0])).isZero();
        assertThat(PcmConverter.rms(null)).isZero();
    }

    @Test
    void resampleHalvesLengthWhenDownsampling() {
        float[] in = {0f, 1f, 2f, 3f, 4f, 5f, 6f, 7f};

        float[] out = PcmConverter.resample(in, 32_000, 16_000);

        assertThat(out).containsExactly(0f, 2f, 4f, 6f);
    }

    @Test
    void resampleInterpolatesWhenUpsampling() {
        float[] out = PcmConverter.resample(new float[] {0f, 1f}, 8_000, 16_000);

        assertThat(out).containsExactly(0f, 0.5f, 1f, 1f);
    }

    @Test
    void resampleReturnsInputWhenRatesMatch() {
        float[] in = {0.1f, 0.2f};

        assertThat(PcmConverter.resample(in, 16_000, 16_000)).isSameAs(in);
        assertThatThrownBy(() -> PcmConverter.resample(in, 0, 16_000)).isInstanceOf(IllegalArgumentException.class);
    }
}
