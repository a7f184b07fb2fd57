/**
 * Immutable data model shared by the streaming pipeline and diarization.
 *
 * <p>Audio is mono float32 PCM at 16 kHz throughout. Key types:
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.domain.AudioChunk} and
 *       {@link com.phillippitts.meetingscribe.domain.LabeledAudioChunk} - captured audio before and after labeling</li>
 *   <li>{@link com.phillippitts.meetingscribe.domain.TranscriptionSegment} - backend output, buffer-relative times</li>
 *   <li>{@link com.phillippitts.meetingscribe.domain.TranscriptSegment} - pipeline output, absolute times</li>
 *   <li>{@link com.phillippitts.meetingscribe.domain.DiarizationResult} - offline speaker segmentation</li>
 * </ul>
 *
 * <p>Records validate their invariants in compact constructors.
 *
 * @since 1.0
 */
package com.phillippitts.meetingscribe.domain;
