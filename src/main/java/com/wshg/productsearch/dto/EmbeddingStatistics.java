package com.wshg.productsearch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 向量库统计：总数、启用/停用、按模型和版本分布、过期数量。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingStatistics {
    private long totalEmbeddings;
    private long activeEmbeddings;
    private long inactiveEmbeddings;
    private long uniqueProducts;
    /** embeddingVersion 低于当前模型版本的分块数 */
    private long outdatedEmbeddings;
    /** 已上架但尚未生成向量的商品数 */
    private long productsNeedingEmbedding;
    private int currentModelVersion;
    private String currentModelName;
    @Builder.Default
    private Map<String, Long> embeddingsByModel = new LinkedHashMap<>();
    @Builder.Default
    private Map<Integer, Long> embeddingsByVersion = new LinkedHashMap<>();
}
