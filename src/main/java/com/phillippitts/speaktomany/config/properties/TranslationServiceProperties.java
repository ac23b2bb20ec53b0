package com.phillippitts.speaktomany.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the LLM translation provider (OpenAI-compatible chat completions).
 */
@ConfigurationProperties(prefix = "translation.service")
@Validated
public class TranslationServiceProperties {

    @NotBlank
    private String baseUrl = "https://api.openai.com/v1";

    /** Bearer token; blank disables the Authorization header. */
    private String apiKey = "";

    @NotBlank
    private String model = "gpt-4o-mini";

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.3;

    @Positive
    private int connectTimeoutMs = 1000;

    /** Read timeout of one call; also bounds fan-out collection per segment. */
    @Positive
    private int requestTimeoutMs = 2000;

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

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
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
