package com.phillippitts.speaktomany.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the HTTP text-to-speech endpoint.
 */
@ConfigurationProperties(prefix = "synthesis")
@Validated
public class SynthesisProperties {

    @NotBlank
    private String url = "https://api.deepgram.com/v1/speak";

    /** Full Authorization header value, e.g. {@code Token abc}; blank sends none. */
    private String authHeader = "";

    @Positive
    private int timeoutMs = 3000;

    @NotBlank
    private String responseFormat = "linear16";

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getAuthHeader() {
        return authHeader;
    }

    public void setAuthHeader(String authHeader) {
        this.authHeader = authHeader;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(int timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public String getResponseFormat() {
        return responseFormat;
    }

    public void setResponseFormat(String responseFormat) {
        this.responseFormat = responseFormat;
    }
}
