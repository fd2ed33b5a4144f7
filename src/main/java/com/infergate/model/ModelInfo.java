package com.infergate.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelInfo {

    @JsonProperty("id")
    private String id;

    @JsonProperty("object")
    @Builder.Default
    private String object = "model";

    @JsonProperty("owned_by")
    @Builder.Default
    private String ownedBy = "local";

    @JsonProperty("embedding_dimensions")
    private Integer embeddingDimensions;

    @JsonProperty("capabilities")
    private List<String> capabilities;
}
