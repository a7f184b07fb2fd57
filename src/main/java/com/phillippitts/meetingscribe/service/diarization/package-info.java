/**
 * Offline speaker diarization of complete recordings.
 */
package com.phillippitts.meetingscribe.service.diarization;
