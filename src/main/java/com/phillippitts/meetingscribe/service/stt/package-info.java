/**
 * Transcription backends.
 *
 * <p>The dispatcher talks to {@link com.phillippitts.meetingscribe.service.stt.TranscriptionBackend} only.
 * Two adapters exist, selected by {@code transcription.backend}:
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.service.stt.LocalEngineTranscriptionBackend} - raw samples into
 *       a local {@link com.phillippitts.meetingscribe.service.stt.SttEngine} (whisper.cpp)</li>
 *   <li>{@link com.phillippitts.meetingscribe.service.stt.CloudTranscriptionBackend} - WAV payload to a remote
 *       {@link com.phillippitts.meetingscribe.service.stt.cloud.SttProvider}</li>
 * </ul>
 *
 * <p>Every backend returns segments timed relative to the submitted window and reports failures as
 * {@link com.phillippitts.meetingscribe.exception.TranscriptionException}.
 *
 * @since 1.0
 */
package com.phillippitts.meetingscribe.service.stt;
