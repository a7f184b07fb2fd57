/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration classes:
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.config.AudioFormatConfig} - startup check of the audio format
 *       and window sizes</li>
 *   <li>{@link com.phillippitts.meetingscribe.config.ThreadPoolConfig} - stream and transcription executors</li>
 *   <li>{@link com.phillippitts.meetingscribe.config.TranscriptionBackendConfig} - picks the local or cloud
 *       transcription backend</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - pipeline, VAD, thread pool and diarization properties</li>
 *   <li>{@code config.stt} - backend-specific properties (whisper.cpp, cloud API)</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.meetingscribe.config;
