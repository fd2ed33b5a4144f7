package com.infergate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingData {

    @JsonProperty("object")
    @Builder.Default
    private String object = "embedding";

    @JsonProperty("index")
    private int index;

    @JsonProperty("embedding")
    private float[] embedding;
}
