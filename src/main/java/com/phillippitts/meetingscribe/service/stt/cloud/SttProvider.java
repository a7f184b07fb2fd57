package com.phillippitts.meetingscribe.service.stt.cloud;

import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.exception.TranscriptionException;

import java.util.List;

/**
 * Remote speech-to-text service that takes an encoded audio file.
 */
public interface SttProvider {

    /**
     * @param audioPayload complete audio file bytes
     * @param format       container format of {@code audioPayload}
     * @return segments timed relative to the start of the payload
     * @throws TranscriptionException on transport errors, non-2xx responses or unparseable bodies
     */
    List<TranscriptionSegment> transcribe(byte[] audioPayload, AudioContainerFormat format);

    String getProviderName();

    /**
     * @return true if the provider is configured well enough to attempt a call
     */
    boolean isConfigured();
}
