package com.phillippitts.speaktomany.service.translation;

import com.phillippitts.speaktomany.config.properties.SynthesisProperties;
import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.VoiceProfile;
import com.phillippitts.speaktomany.exception.SpeakToManyException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Objects;

/**
 * HTTP text-to-speech client: posts JSON to the configured endpoint and returns the binary body.
 */
@Service
public class HttpSpeechSynthesizer implements SpeechSynthesizer {

    private static final Logger LOG = LogManager.getLogger(HttpSpeechSynthesizer.class);

    private final RestClient restClient;
    private final SynthesisProperties props;

    public HttpSpeechSynthesizer(@Qualifier("synthesisRestClient") RestClient restClient,
                                 SynthesisProperties props) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    public byte[] synthesize(String text, Language language, VoiceProfile voice) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(language, "language");
        VoiceProfile v = voice == null ? language.defaultVoice() : voice;

        JSONObject body = new JSONObject()
                .put("input", text)
                .put("voice", v.voiceId())
                .put("model", v.model())
                .put("provider", v.provider())
                .put("lang_code", language.code())
                .put("response_format", props.getResponseFormat());

        byte[] audio;
        try {
            audio = restClient.post()
                    .uri(props.getUrl())
                    .body(body.toString())
                    .retrieve()
                    .body(byte[].class);
        } catch (RestClientException e) {
            throw new SpeakToManyException("Speech synthesis failed for voice " + v.voiceId(), e);
        }
        if (audio == null || audio.length == 0) {
            throw new SpeakToManyException("Speech synthesis returned no audio for voice " + v.voiceId());
        }
        LOG.debug("Synthesized {} bytes with voice {}", audio.length, v.voiceId());
        return audio;
    }
}
