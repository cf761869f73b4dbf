package com.demoAuto.salesAgent.llm.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for the OpenAI embeddings endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class EmbeddingApiResponse {

    @JsonProperty("model")
    private String model;

    @JsonProperty("data")
    private List<EmbeddingData> data;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingData {
        @JsonProperty("index")
        private Integer index;

        @JsonProperty("embedding")
        private List<Double> embedding;
    }

    /**
     * Extracts the first embedding vector.
     *
     * @return Vector as float array, or an empty array if the response carried none
     */
    public float[] firstVector() {
        if (data == null || data.isEmpty() || data.get(0).getEmbedding() == null) {
            return new float[0];
        }
        List<Double> values = data.get(0).getEmbedding();
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = values.get(i).floatValue();
        }
        return vector;
    }
}
