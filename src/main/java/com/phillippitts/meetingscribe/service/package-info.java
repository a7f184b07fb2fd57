/**
 * Service layer of the transcription pipeline.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.stream} - chunk streams and the two-source merger</li>
 *   <li>{@code service.vad} - energy-based voice activity gate</li>
 *   <li>{@code service.pipeline} - per-speaker windowing, dispatch and meeting sessions</li>
 *   <li>{@code service.stt} - transcription backends (local whisper.cpp, cloud HTTP)</li>
 *   <li>{@code service.diarization} - offline speaker diarization</li>
 *   <li>{@code service.audio} - PCM and WAV codecs, format constants</li>
 *   <li>{@code service.process} - external process execution</li>
 *   <li>{@code service.language}, {@code service.metrics}, {@code service.events}, {@code service.health}</li>
 * </ul>
 *
 * <p>Services use constructor injection and throw domain exceptions from
 * {@code com.phillippitts.meetingscribe.exception}.
 */
package com.phillippitts.meetingscribe.service;
