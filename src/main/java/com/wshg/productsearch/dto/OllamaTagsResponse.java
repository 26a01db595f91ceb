package com.wshg.productsearch.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Ollama /api/tags 响应体，只取模型名。
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OllamaTagsResponse {
    private List<Model> models;

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Model {
        private String name;
        private String model;
    }
}
