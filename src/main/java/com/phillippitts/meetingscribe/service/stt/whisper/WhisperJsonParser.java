package com.phillippitts.meetingscribe.service.stt.whisper;

import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.exception.TranscriptionException;
import com.phillippitts.meetingscribe.service.stt.BackendNames;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses whisper.cpp JSON output into buffer-relative segments.
 *
 * <p>Understands the whisper.cpp {@code -oj} layout
 * ({@code transcription[].offsets.from/to} in milliseconds) and the OpenAI-style layout
 * ({@code segments[].start/end} in seconds). A bare top-level {@code text} becomes one segment
 * spanning the whole clip. Blank segments are skipped.
 */
final class WhisperJsonParser {

    private WhisperJsonParser() {}

    /**
     * @param json            stdout of whisper.cpp
     * @param clipDurationSec duration of the submitted audio, used when the output carries no timing
     * @throws TranscriptionException if the output is not valid JSON
     */
    static List<TranscriptionSegment> parseSegments(String json, double clipDurationSec) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new TranscriptionException("Unparseable whisper.cpp output: " + e.getMessage(),
                    BackendNames.WHISPER, e);
        }

        List<TranscriptionSegment> segments = new ArrayList<>();
        JSONArray transcription = obj.optJSONArray("transcription");
        if (transcription != null) {
            for (int i = 0; i < transcription.length(); i++) {
                JSONObject seg = transcription.optJSONObject(i);
                if (seg == null) {
                    continue;
                }
                JSONObject offsets = seg.optJSONObject("offsets");
                double start = offsets == null ? 0.0 : offsets.optLong("from", 0) / 1000.0;
                double end = offsets == null ? clipDurationSec : offsets.optLong("to", 0) / 1000.0;
                addIfText(segments, seg.optString("text", ""), start, end);
            }
            return segments;
        }

        JSONArray segs = obj.optJSONArray("segments");
        if (segs != null) {
            for (int i = 0; i < segs.length(); i++) {
                JSONObject seg = segs.optJSONObject(i);
                if (seg == null) {
                    continue;
                }
                addIfText(segments, seg.optString("text", ""),
                        seg.optDouble("start", 0.0), seg.optDouble("end", clipDurationSec));
            }
            return segments;
        }

        addIfText(segments, obj.optString("text", ""), 0.0, clipDurationSec);
        return segments;
    }

    private static void addIfText(List<TranscriptionSegment> segments, String text, double start, double end) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        segments.add(new TranscriptionSegment(trimmed, start, Math.max(start, end)));
    }
}
