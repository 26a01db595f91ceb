package com.wshg.productsearch.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 相似度检索命中：distance 为余弦距离 [0, 2]，similarityScore = 1 - distance / 2。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingMatch {
    private ProductEmbedding embedding;
    private double distance;
    private double similarityScore;
}
