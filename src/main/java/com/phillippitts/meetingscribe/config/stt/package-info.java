/**
 * Backend-specific configuration properties.
 *
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.config.stt.WhisperConfig} - {@code stt.whisper.*}, immutable record</li>
 *   <li>{@link com.phillippitts.meetingscribe.config.stt.CloudSttProperties} - {@code stt.cloud.*}</li>
 *   <li>{@link com.phillippitts.meetingscribe.config.stt.SttConcurrencyProperties} - {@code stt.concurrency.*}</li>
 * </ul>
 *
 * <p>All carry Jakarta Bean Validation constraints and are checked at startup.
 *
 * @since 1.0
 */
package com.phillippitts.meetingscribe.config.stt;
