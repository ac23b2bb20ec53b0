package com.phillippitts.speaktomany.config;

import com.phillippitts.speaktomany.config.properties.SynthesisProperties;
import com.phillippitts.speaktomany.config.properties.TranslationServiceProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * HTTP clients for the external translation and synthesis providers.
 *
 * <p>Each client carries its own connect/read timeouts so one slow provider call cannot
 * hold a fan-out slot indefinitely.
 */
@Configuration
public class HttpClientConfig {

    @Bean(name = "translationRestClient")
    public RestClient translationRestClient(TranslationServiceProperties props) {
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(requestFactory(props.getConnectTimeoutMs(), props.getRequestTimeoutMs()))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey());
        }
        return builder.build();
    }

    @Bean(name = "synthesisRestClient")
    public RestClient synthesisRestClient(SynthesisProperties props) {
        RestClient.Builder builder = RestClient.builder()
                .requestFactory(requestFactory(props.getTimeoutMs(), props.getTimeoutMs()))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (props.getAuthHeader() != null && !props.getAuthHeader().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, props.getAuthHeader());
        }
        return builder.build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return factory;
    }
}
