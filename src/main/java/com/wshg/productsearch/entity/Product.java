package com.wshg.productsearch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * 商品表（由商品管理模块维护）。向量流水线只读取商品内容，并回写规范文档缓存与向量生成标记。
 */
@Entity
@Table(name = "product", indexes = {
        @Index(name = "idx_product_tenant", columnList = "tenant_id"),
        @Index(name = "idx_product_shop", columnList = "shop_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id")
    private UUID tenantId;

    @Column(name = "shop_id", nullable = false)
    private UUID shopId;

    @Column(name = "category_id")
    private UUID categoryId;

    @Column(nullable = false, length = 256)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(length = 64)
    private String sku;

    @Column(precision = 18, scale = 2)
    private BigDecimal price;

    /** 划线价，高于 price 时视为促销中 */
    @Column(name = "compare_at_price", precision = 18, scale = 2)
    private BigDecimal compareAtPrice;

    @Column(name = "stock_quantity")
    private int stockQuantity;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    @Column(nullable = false)
    private boolean published;

    /** 动态属性 JSON：{"color": "red", "weight": 1.2, ...} */
    @Column(columnDefinition = "TEXT")
    private String attributes;

    /** 规范文档缓存（JSON），可随时由源数据重建 */
    @Column(name = "canonical_document", columnDefinition = "TEXT")
    private String canonicalDocument;

    @Column(name = "canonical_document_version")
    private int canonicalDocumentVersion;

    @Column(name = "canonical_document_updated_at")
    private Instant canonicalDocumentUpdatedAt;

    @Column(name = "embedding_generated")
    private boolean embeddingGenerated;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }

    public boolean isInStock() {
        return stockQuantity > 0;
    }

    public boolean isOnSale() {
        return compareAtPrice != null && price != null && compareAtPrice.compareTo(price) > 0;
    }

    /** 已上架且启用的商品才参与语义检索 */
    public boolean isEligibleForEmbedding() {
        return active && published;
    }

    /** 写入新的规范文档缓存，同时标记需要重新生成向量 */
    public void updateCanonicalDocument(String documentJson, int schemaVersion) {
        this.canonicalDocument = documentJson;
        this.canonicalDocumentVersion = schemaVersion;
        this.canonicalDocumentUpdatedAt = Instant.now();
        this.embeddingGenerated = false;
    }

    public void markEmbeddingGenerated() {
        this.embeddingGenerated = true;
    }
}
