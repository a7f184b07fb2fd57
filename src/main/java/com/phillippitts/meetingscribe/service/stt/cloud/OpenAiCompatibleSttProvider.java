package com.phillippitts.meetingscribe.service.stt.cloud;

import com.phillippitts.meetingscribe.config.stt.CloudSttProperties;
import com.phillippitts.meetingscribe.config.stt.SttConcurrencyProperties;
import com.phillippitts.meetingscribe.domain.TranscriptionSegment;
import com.phillippitts.meetingscribe.exception.TranscriptionException;
import com.phillippitts.meetingscribe.exception.TranscriptionExceptionBuilder;
import com.phillippitts.meetingscribe.service.stt.BackendNames;
import com.phillippitts.meetingscribe.service.stt.util.ConcurrencyGuard;
import com.phillippitts.meetingscribe.util.LogSanitizer;
import com.phillippitts.meetingscribe.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link SttProvider} for OpenAI-compatible {@code POST /audio/transcriptions} endpoints.
 *
 * <p>Sends the payload as multipart/form-data with {@code response_format=verbose_json} so the
 * response carries timed {@code segments}. A response with only {@code text} becomes a single
 * segment at 0-0. Failed calls are not retried.
 *
 * <p><b>Privacy:</b> response bodies are logged only as truncated previews on error.
 */
@Component
public class OpenAiCompatibleSttProvider implements SttProvider {

    private static final Logger LOG = LogManager.getLogger(OpenAiCompatibleSttProvider.class);

    static final String TRANSCRIPTIONS_PATH = "/audio/transcriptions";
    private static final int ERROR_BODY_PREVIEW_CHARS = 512;

    private final CloudSttProperties properties;
    private final HttpClient httpClient;
    private final ConcurrencyGuard concurrencyGuard;

    public OpenAiCompatibleSttProvider(CloudSttProperties properties,
                                       SttConcurrencyProperties concurrencyProperties) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
                .build();
        this.concurrencyGuard = new ConcurrencyGuard(
                concurrencyProperties.cloudMax(), concurrencyProperties.acquireTimeoutMs(), BackendNames.CLOUD);
    }

    @Override
    public List<TranscriptionSegment> transcribe(byte[] audioPayload, AudioContainerFormat format) {
        Objects.requireNonNull(audioPayload, "audioPayload");
        Objects.requireNonNull(format, "format");

        long startTime = System.nanoTime();
        try (ConcurrencyGuard.Permit permit = concurrencyGuard.acquire()) {
            String boundary = UUID.randomUUID().toString();
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(endpoint()))
                    .timeout(Duration.ofMillis(properties.getRequestTimeoutMs()))
                    .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                    .POST(HttpRequest.BodyPublishers.ofByteArray(buildMultipartBody(audioPayload, format, boundary)));
            if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
                builder.header("Authorization", "Bearer " + properties.getApiKey());
            }

            HttpResponse<String> response = httpClient.send(builder.build(),
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() / 100 != 2) {
                throw TranscriptionExceptionBuilder.create("Transcription request rejected")
                        .backend(BackendNames.CLOUD)
                        .durationMs(TimeUtils.elapsedMillis(startTime))
                        .metadata("httpStatus", response.statusCode())
                        .metadata("body", LogSanitizer.truncate(response.body(), ERROR_BODY_PREVIEW_CHARS))
                        .build();
            }
            List<TranscriptionSegment> segments = parseResponse(response.body());
            LOG.debug("Cloud transcription returned {} segments in {} ms",
                    segments.size(), TimeUtils.elapsedMillis(startTime));
            return segments;
        } catch (IOException e) {
            throw TranscriptionExceptionBuilder.create("Transcription request failed: " + e.getMessage())
                    .backend(BackendNames.CLOUD)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .metadata("endpoint", endpoint())
                    .cause(e)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TranscriptionException("Transcription request interrupted", BackendNames.CLOUD, e);
        }
    }

    String endpoint() {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + TRANSCRIPTIONS_PATH;
    }

    /**
     * Builds the multipart body by hand; the JDK client has no multipart support.
     *
     * <pre>
     * --boundary
     * Content-Disposition: form-data; name="file"; filename="audio.wav"
     * Content-Type: audio/wav
     *
     * [binary data]
     * --boundary
     * Content-Disposition: form-data; name="model"
     *
     * whisper-1
     * --boundary
     * Content-Disposition: form-data; name="response_format"
     *
     * verbose_json
     * --boundary--
     * </pre>
     */
    byte[] buildMultipartBody(byte[] audioPayload, AudioContainerFormat format, String boundary) {
        ByteArrayOutputStream body = new ByteArrayOutputStream(audioPayload.length + 512);
        StringBuilder head = new StringBuilder();
        head.append("--").append(boundary).append("\r\n");
        head.append("Content-Disposition: form-data; name=\"file\"; filename=\"audio.")
                .append(format.fileExtension()).append("\"\r\n");
        head.append("Content-Type: ").append(format.mimeType()).append("\r\n\r\n");
        body.writeBytes(head.toString().getBytes(StandardCharsets.UTF_8));
        body.writeBytes(audioPayload);

        StringBuilder tail = new StringBuilder("\r\n");
        appendField(tail, boundary, "model", properties.getModel());
        appendField(tail, boundary, "response_format", "verbose_json");
        tail.append("--").append(boundary).append("--\r\n");
        body.writeBytes(tail.toString().getBytes(StandardCharsets.UTF_8));
        return body.toByteArray();
    }

    private static void appendField(StringBuilder sb, String boundary, String name, String value) {
        sb.append("--").append(boundary).append("\r\n");
        sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
        sb.append(value).append("\r\n");
    }

    static List<TranscriptionSegment> parseResponse(String body) {
        JSONObject obj;
        try {
            obj = new JSONObject(body);
        } catch (JSONException e) {
            throw new TranscriptionException("Unparseable transcription response: " + e.getMessage(),
                    BackendNames.CLOUD, e);
        }
        List<TranscriptionSegment> segments = new ArrayList<>();
        JSONArray segs = obj.optJSONArray("segments");
        if (segs != null && segs.length() > 0) {
            for (int i = 0; i < segs.length(); i++) {
                JSONObject seg = segs.optJSONObject(i);
                if (seg == null) {
                    continue;
                }
                String text = seg.optString("text", "").trim();
                if (text.isEmpty()) {
                    continue;
                }
                double start = seg.optDouble("start", 0.0);
                double end = Math.max(start, seg.optDouble("end", start));
                segments.add(new TranscriptionSegment(text, start, end));
            }
            return segments;
        }
        String text = obj.optString("text", "").trim();
        if (!text.isEmpty()) {
            segments.add(new TranscriptionSegment(text, 0.0, 0.0));
        }
        return segments;
    }

    @Override
    public String getProviderName() {
        return BackendNames.CLOUD;
    }

    @Override
    public boolean isConfigured() {
        return properties.getBaseUrl() != null && !properties.getBaseUrl().isBlank();
    }
}
