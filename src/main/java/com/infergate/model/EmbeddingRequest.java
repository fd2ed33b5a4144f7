package com.infergate.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * OpenAI-compatible embedding request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmbeddingRequest {

    @JsonProperty("model")
    private String model;

    @JsonProperty("input")
    private Object input; // Can be String or List<String>

    @JsonProperty("encoding_format")
    @Builder.Default
    private String encodingFormat = "float";

    @JsonProperty("user")
    private String user;
}
