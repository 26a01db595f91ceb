package com.wshg.productsearch.store;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * 商品分块向量（存储与检索的基本单位），(productId, chunkIndex) 唯一。
 * id 由向量库分配，更新时保持不变。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProductEmbedding {
    private Long id;
    private UUID productId;
    private UUID tenantId;
    private UUID shopId;
    private int chunkIndex;
    /** 原始分块文本，用于摘要展示与排查 */
    private String chunkText;
    private float[] embedding;
    private String embeddingModel;
    private int embeddingVersion;
    private int canonicalDocumentVersion;
    private Instant generatedAt;
    /** 展示用元数据 JSON：商品名、店铺、分类、价格、库存/促销、SKU */
    private String payloadJson;
    private boolean active;
}
