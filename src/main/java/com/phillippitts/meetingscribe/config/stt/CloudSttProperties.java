package com.phillippitts.meetingscribe.config.stt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * OpenAI-compatible transcription endpoint used when {@code transcription.backend=cloud}.
 *
 * <p>Properties:
 * <ul>
 *   <li>stt.cloud.base-url - API root; {@code /audio/transcriptions} is appended</li>
 *   <li>stt.cloud.api-key - bearer token; may be blank for local OpenAI-compatible servers</li>
 *   <li>stt.cloud.model - model name sent with each request (default: whisper-1)</li>
 *   <li>stt.cloud.connect-timeout-ms / stt.cloud.request-timeout-ms</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "stt.cloud")
@Validated
public class CloudSttProperties {

    @NotBlank(message = "Cloud STT base URL must not be blank")
    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey = "";

    @NotBlank(message = "Cloud STT model must not be blank")
    private String model = "whisper-1";

    @Positive(message = "Connect timeout must be positive")
    private int connectTimeoutMs = 5_000;

    @Positive(message = "Request timeout must be positive")
    private int requestTimeoutMs = 30_000;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(int connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }
}
