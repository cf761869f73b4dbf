package com.demoAuto.salesAgent.llm.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for the OpenAI embeddings endpoint.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmbeddingApiRequest {

    @JsonProperty("model")
    private String model;

    @JsonProperty("input")
    private String input;
}
