package com.phillippitts.meetingscribe.service.diarization;

import com.phillippitts.meetingscribe.domain.SpeakerSegment;
import com.phillippitts.meetingscribe.exception.DiarizationException;

import java.util.List;

/**
 * Offline speaker diarization engine.
 */
public interface DiarizationBackend {

    /**
     * Splits a complete recording into speaker turns.
     *
     * @param samples    mono float32 samples
     * @param sampleRate sample rate in Hz
     * @return segments in any order; labels are backend-assigned
     * @throws DiarizationException if the backend fails
     */
    List<SpeakerSegment> process(float[] samples, int sampleRate);

    /**
     * Capability flag: false when the model or binary is not installed.
     */
    boolean isModelAvailable();

    String getBackendName();
}
