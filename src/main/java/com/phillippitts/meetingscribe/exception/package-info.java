/**
 * Application-specific exception hierarchy.
 *
 * <p>Every exception extends {@link com.phillippitts.meetingscribe.exception.MeetingScribeException},
 * which is unchecked:
 * <ul>
 *   <li>{@link com.phillippitts.meetingscribe.exception.TranscriptionException} - a transcription backend
 *       failed; the pipeline drops the affected window and keeps running</li>
 *   <li>{@link com.phillippitts.meetingscribe.exception.DiarizationException} - an available diarization
 *       backend failed mid-run</li>
 *   <li>{@link com.phillippitts.meetingscribe.exception.ModelNotFoundException} - a model file is missing</li>
 *   <li>{@link com.phillippitts.meetingscribe.exception.InvalidAudioException} - audio in an unusable format</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.meetingscribe.exception;
