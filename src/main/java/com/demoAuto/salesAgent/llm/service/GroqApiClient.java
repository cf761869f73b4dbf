package com.demoAuto.salesAgent.llm.service;

import com.demoAuto.salesAgent.llm.dto.GroqApiRequest;
import com.demoAuto.salesAgent.llm.dto.GroqApiResponse;
import com.demoAuto.salesAgent.llm.model.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Client for the Groq chat completions API (OpenAI-compatible).
 * This is the production {@link TextGeneration} backend.
 */
@Slf4j
@Service
public class GroqApiClient implements TextGeneration {

    private static final String GROQ_API_URL = "https://api.groq.com/openai/v1/chat/completions";
    private static final String DEFAULT_MODEL = "llama-3.3-70b-versatile";

    private final RestClient restClient;

    @Value("${groq.api.key:}")
    private String apiKey;

    @Value("${groq.api.model:" + DEFAULT_MODEL + "}")
    private String model;

    @Value("${groq.api.temperature:0.2}")
    private Double temperature;

    @Value("${groq.api.max-completion-tokens:1024}")
    private Integer maxCompletionTokens;

    public GroqApiClient(@Value("${groq.api.timeout-millis:20000}") int timeoutMillis) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        this.restClient = RestClient.builder()
                .baseUrl(GROQ_API_URL)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * Sends the messages to Groq and returns the first choice's content.
     *
     * @param messages Role-tagged messages, system prompt first
     * @return Trimmed completion text
     * @throws GenerationUnavailableException if the key is missing, the call fails or the completion is empty
     */
    @Override
    public String complete(List<ChatMessage> messages) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new GenerationUnavailableException("Groq API key is not configured. Set groq.api.key in application.yaml");
        }

        GroqApiRequest request = GroqApiRequest.builder()
                .messages(messages.stream()
                        .map(message -> GroqApiRequest.Message.builder()
                                .role(message.getRole())
                                .content(message.getContent())
                                .build())
                        .toList())
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxCompletionTokens)
                .topP(1.0)
                .stream(false)
                .build();

        GroqApiResponse response;
        try {
            log.debug("Calling Groq API - model: {}, messages: {}", model, messages.size());

            response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(GroqApiResponse.class);
        } catch (Exception e) {
            log.error("Error calling Groq API", e);
            throw new GenerationUnavailableException("Failed to call Groq API: " + e.getMessage(), e);
        }

        String content = response != null ? response.getContent() : null;
        if (content == null || content.isBlank()) {
            throw new GenerationUnavailableException("Groq API returned an empty completion");
        }

        log.debug("Groq API response received - model: {}, tokens used: {}",
                response.getModel(),
                response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown");

        return content.trim();
    }
}
