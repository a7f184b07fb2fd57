/**
 * Per-speaker sliding-window transcription: buffering, dispatch to a backend, backpressure trimming
 * and generation-based cancellation.
 */
package com.phillippitts.meetingscribe.service.pipeline;
