/**
 * whisper.cpp speech-to-text engine.
 *
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.service.stt.whisper.WhisperSttEngine} - writes a temp WAV,
 *       runs whisper.cpp, parses timed segments</li>
 *   <li>{@link com.phillippitts.meetingscribe.service.stt.whisper.WhisperProcessManager} - command line,
 *       timeout and error context for one run</li>
 * </ul>
 *
 * <p>Configuration (application.properties):
 * <pre>
 * stt.whisper.binary-path=tools/whisper.cpp/main
 * stt.whisper.model-path=models/ggml-base.bin
 * stt.whisper.timeout-seconds=10
 * stt.whisper.language=auto
 * stt.whisper.threads=4
 * </pre>
 *
 * <p>One process per speaker window; the per-call language hint overrides {@code stt.whisper.language}.
 *
 * @see com.phillippitts.meetingscribe.service.stt.SttEngine
 * @see com.phillippitts.meetingscribe.config.stt.WhisperConfig
 * @since 1.0
 */
package com.phillippitts.meetingscribe.service.stt.whisper;
