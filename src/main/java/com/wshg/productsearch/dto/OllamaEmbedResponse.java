package com.wshg.productsearch.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * Ollama /api/embed 响应体。
 * 返回格式：{ "model": "...", "embeddings": [[0.1, -0.2, ...], [...]] }
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class OllamaEmbedResponse {
    private String model;
    private List<List<Double>> embeddings;

    public int size() {
        return embeddings == null ? 0 : embeddings.size();
    }

    /** 第 i 个向量；缺失或为空时返回 null */
    public float[] getEmbedding(int i) {
        if (embeddings == null || i < 0 || i >= embeddings.size()) return null;
        List<Double> list = embeddings.get(i);
        if (list == null || list.isEmpty()) return null;
        float[] arr = new float[list.size()];
        for (int k = 0; k < list.size(); k++) {
            Double v = list.get(k);
            if (v == null) return null;
            arr[k] = v.floatValue();
        }
        return arr;
    }
}
