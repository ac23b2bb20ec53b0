package com.phillippitts.speaktomany.service.translation;

import com.phillippitts.speaktomany.config.properties.TranslationServiceProperties;
import com.phillippitts.speaktomany.domain.Language;
import com.phillippitts.speaktomany.domain.TranslationPreferences;
import com.phillippitts.speaktomany.exception.TranslationException;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LlmTranslationServiceTest {

    private static final String COMPLETION = """
            {"choices":[{"message":{"role":"assistant","content":"  Hola, como estas?\\n"}}]}
            """;

    private MockRestServiceServer server;
    private LlmTranslationService service;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://llm.test/v1");
        server = MockRestServiceServer.bindTo(builder).build();
        service = new LlmTranslationService(builder.build(), new TranslationServiceProperties());
    }

    @Test
    void translatesThroughChatCompletions() {
        server.expect(requestTo("http://llm.test/v1/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().string(org.hamcrest.Matchers.containsString("Hello, how are you?")))
                .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));

        String result = service.translate("Hello, how are you?", Language.EN, Language.ES,
                TranslationPreferences.DEFAULT);

        assertThat(result).isEqualTo("Hola, como estas?");
        server.verify();
    }

    @Test
    void sameLanguageOrBlankSkipsProvider() {
        assertThat(service.translate("hello", Language.EN, Language.EN, null)).isEqualTo("hello");
        assertThat(service.translate("  ", Language.EN, Language.ES, null)).isEqualTo("  ");
        server.verify();
    }

    @Test
    void providerErrorBecomesTranslationException() {
        server.expect(requestTo("http://llm.test/v1/chat/completions"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> service.translate("hello", Language.EN, Language.FR, null))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("status=503")
                .hasMessageContaining("languages=en->fr")
                .hasMessageContaining("(provider: llm)");
    }

    @Test
    void unparseableResponseBecomesTranslationException() {
        server.expect(requestTo("http://llm.test/v1/chat/completions"))
                .andRespond(withSuccess("{\"unexpected\":true}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> service.translate("hello", Language.EN, Language.ES, null))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("Unparseable");
    }

    @Test
    void emptyChoicesBecomesTranslationException() {
        server.expect(requestTo("http://llm.test/v1/chat/completions"))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> service.translate("hello", Language.EN, Language.ES, null))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("no choices");
    }

    @Test
    void requestCarriesModelAndPrompts() {
        JSONObject request = service.buildRequest("good morning", Language.EN, Language.YO,
                new TranslationPreferences(true, false));

        assertThat(request.getString("model")).isEqualTo("gpt-4o-mini");
        assertThat(request.getJSONArray("messages").getJSONObject(0).getString("content"))
                .contains("English")
                .contains("Yoruba")
                .contains("formal and professional");
        assertThat(request.getJSONArray("messages").getJSONObject(1).getString("content"))
                .isEqualTo("good morning");
    }

    @Test
    void promptReflectsPreferences() {
        String casual = TranslationPrompts.systemPrompt(Language.ES, Language.EN, new TranslationPreferences(false, true));

        assertThat(casual).contains("natural and conversational").contains("preserve the emotional tone");
    }
}
