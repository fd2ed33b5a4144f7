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
public class ModelList {

    @JsonProperty("object")
    @Builder.Default
    private String object = "list";

    @JsonProperty("data")
    private List<ModelInfo> data;
}
