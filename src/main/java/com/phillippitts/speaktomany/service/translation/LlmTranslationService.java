package com.phillippitts.speaktomany.service.translation;

import com.phillippitts.speaktomany.config.properties.TranslationServiceProperties;
import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.TranslationPreferences;
import com.phillippitts.speaktomany.exception.TranslationException;
import com.phillippitts.speaktomany.exception.TranslationExceptionBuilder;
import com.phillippitts.speaktomany.util.LogSanitizer;
import com.phillippitts.speaktomany.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;

/**
 * Translation through an OpenAI-compatible chat completions endpoint.
 *
 * <p>Request: one system message built from the listener's preferences and one user message
 * with the spoken text. Response: {@code choices[0].message.content}, stripped.
 */
@Service
public class LlmTranslationService implements TranslationService {

    private static final Logger LOG = LogManager.getLogger(LlmTranslationService.class);
    static final String PROVIDER = "llm";

    private final RestClient restClient;
    private final TranslationServiceProperties props;

    public LlmTranslationService(@Qualifier("translationRestClient") RestClient restClient,
                                 TranslationServiceProperties props) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public String providerName() {
        return PROVIDER;
    }

    @Override
    public String translate(String text, Language source, Language target, TranslationPreferences preferences) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        if (source == target || text.isBlank()) {
            return text;
        }
        TranslationPreferences prefs = preferences == null ? TranslationPreferences.DEFAULT : preferences;

        long t0 = System.nanoTime();
        String responseBody;
        try {
            responseBody = restClient.post()
                    .uri("/chat/completions")
                    .body(buildRequest(text, source, target, prefs).toString())
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw TranslationExceptionBuilder.create("Translation provider returned an error")
                    .provider(PROVIDER)
                    .cause(e)
                    .languagePair(source, target)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .metadata("status", e.getStatusCode().value())
                    .build();
        } catch (RestClientException e) {
            throw TranslationExceptionBuilder.create("Translation request failed")
                    .provider(PROVIDER)
                    .cause(e)
                    .languagePair(source, target)
                    .durationMs(TimeUtils.elapsedMillis(t0))
                    .build();
        }

        String translated = parseContent(responseBody, source, target);
        LOG.debug("Translated {}->{} in {} ms: '{}'", source, target, TimeUtils.elapsedMillis(t0),
                LogSanitizer.preview(translated));
        return translated;
    }

    JSONObject buildRequest(String text, Language source, Language target, TranslationPreferences prefs) {
        JSONArray messages = new JSONArray()
                .put(new JSONObject()
                        .put("role", "system")
                        .put("content", TranslationPrompts.systemPrompt(source, target, prefs)))
                .put(new JSONObject()
                        .put("role", "user")
                        .put("content", text));
        return new JSONObject()
                .put("model", props.getModel())
                .put("temperature", props.getTemperature())
                .put("messages", messages);
    }

    private static String parseContent(String body, Language source, Language target) {
        if (body == null || body.isBlank()) {
            throw TranslationExceptionBuilder.create("Empty response from translation provider")
                    .provider(PROVIDER)
                    .languagePair(source, target)
                    .build();
        }
        try {
            JSONArray choices = new JSONObject(body).getJSONArray("choices");
            if (choices.isEmpty()) {
                throw new TranslationException("Translation provider returned no choices", PROVIDER);
            }
            return choices.getJSONObject(0).getJSONObject("message").getString("content").strip();
        } catch (JSONException e) {
            throw TranslationExceptionBuilder.create("Unparseable response from translation provider")
                    .provider(PROVIDER)
                    .cause(e)
                    .languagePair(source, target)
                    .metadata("body", LogSanitizer.truncate(body, 120))
                    .build();
        }
    }
}
