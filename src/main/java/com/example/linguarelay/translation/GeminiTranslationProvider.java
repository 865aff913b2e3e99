package com.example.linguarelay.translation;

import com.example.linguarelay.config.TranslationProperties;
import com.example.linguarelay.model.LanguagePair;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Gemini generateContent client (plain RestTemplate, one attempt per call).
 * POST {baseUrl}/v1beta/models/{model}:generateContent?key={apiKey}
 */
public class GeminiTranslationProvider implements TranslationProvider {

    private final RestTemplate restTemplate;
    private final TranslationProperties.Gemini config;

    public GeminiTranslationProvider(RestTemplate restTemplate, TranslationProperties.Gemini config) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String translate(String text, LanguagePair languages) {
        URI uri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/v1beta/models/{model}:generateContent")
                .queryParam("key", config.getApiKey())
                .buildAndExpand(config.getModel())
                .encode()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of(
                        "parts", List.of(Map.of("text", prompt(text, languages))))));

        JsonNode resp = restTemplate.postForObject(uri, new HttpEntity<>(body, headers), JsonNode.class);
        return extractText(resp);
    }

    static String prompt(String text, LanguagePair languages) {
        return "Translate the following text from " + languages.source() + " to " + languages.target() + ".\n"
                + "Return only the translated text without any explanations:\n"
                + "\"" + text + "\"";
    }

    /** candidates[0].content.parts[0].text, trimmed; anything else is an error. */
    static String extractText(JsonNode resp) {
        if (resp == null) throw new IllegalStateException("Empty response from translation service");
        JsonNode textNode = resp.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (!textNode.isTextual() || textNode.asText().isBlank()) {
            String reason = resp.path("promptFeedback").path("blockReason").asText("");
            throw new IllegalStateException(reason.isEmpty()
                    ? "No translation in response"
                    : "Translation blocked: " + reason);
        }
        return textNode.asText().trim();
    }
}
