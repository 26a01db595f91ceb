package com.wshg.productsearch.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Ollama /api/embed 请求体。input 始终按数组发送，单条也是长度为 1 的数组，
 * 返回的 embeddings 与 input 按位置一一对应。
 */
@Data
@Builder
public class OllamaEmbedRequest {
    private String model;
    private List<String> input;

    public static OllamaEmbedRequest of(String model, List<String> texts) {
        return OllamaEmbedRequest.builder().model(model).input(texts).build();
    }
}
