/**
 * Audio format constants and conversions.
 *
 * <p>The pipeline works on mono float32 samples at 16 kHz. Backends that need bytes get a
 * 44-byte RIFF/WAVE header followed by 16-bit signed little-endian PCM:
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.service.audio.AudioFormat} - format constants and header offsets</li>
 *   <li>{@link com.phillippitts.meetingscribe.service.audio.PcmConverter} - float/PCM16 conversion and RMS</li>
 *   <li>{@link com.phillippitts.meetingscribe.service.audio.WavEncoder} - WAV payloads in memory or on disk</li>
 *   <li>{@link com.phillippitts.meetingscribe.service.audio.WavReader} - mono samples from a PCM WAV file</li>
 * </ul>
 *
 * <pre>
 * byte[] payload = WavEncoder.encode(samples);
 * // payload.length == 44 + 2 * samples.length
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.meetingscribe.service.audio;
