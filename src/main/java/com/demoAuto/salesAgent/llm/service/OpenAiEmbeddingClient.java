package com.demoAuto.salesAgent.llm.service;

import com.demoAuto.salesAgent.llm.dto.EmbeddingApiRequest;
import com.demoAuto.salesAgent.llm.dto.EmbeddingApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

/**
 * Client for the OpenAI embeddings endpoint.
 */
@Slf4j
@Service
public class OpenAiEmbeddingClient implements EmbeddingClient {

    private static final String OPENAI_EMBEDDINGS_URL = "https://api.openai.com/v1/embeddings";

    private final RestClient restClient;

    @Value("${openai.api.key:}")
    private String apiKey;

    @Value("${openai.api.embedding-model:text-embedding-3-small}")
    private String embeddingModel;

    public OpenAiEmbeddingClient(@Value("${openai.api.timeout-millis:20000}") int timeoutMillis) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);
        this.restClient = RestClient.builder()
                .baseUrl(OPENAI_EMBEDDINGS_URL)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public float[] embed(String text) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new EmbeddingUnavailableException("OpenAI API key is not configured. Set openai.api.key in application.yaml");
        }
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("Cannot embed blank text");
        }

        EmbeddingApiResponse response;
        try {
            response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(EmbeddingApiRequest.builder()
                            .model(embeddingModel)
                            .input(text)
                            .build())
                    .retrieve()
                    .body(EmbeddingApiResponse.class);
        } catch (Exception e) {
            log.error("Error calling OpenAI embeddings API", e);
            throw new EmbeddingUnavailableException("Failed to call embeddings API: " + e.getMessage(), e);
        }

        float[] vector = response != null ? response.firstVector() : new float[0];
        if (vector.length == 0) {
            throw new EmbeddingUnavailableException("Embeddings API returned no vector");
        }
        return vector;
    }
}
