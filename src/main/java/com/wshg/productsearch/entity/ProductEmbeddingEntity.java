package com.wshg.productsearch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * 商品向量表（MySQL），用于 vector-store-type=mysql 时持久化。
 * 每个商品每个分块一行，(product_id, chunk_index) 唯一。
 */
@Entity
@Table(name = "product_embedding",
        uniqueConstraints = @UniqueConstraint(name = "uk_product_chunk", columnNames = {"product_id", "chunk_index"}),
        indexes = {
                @Index(name = "idx_embedding_product", columnList = "product_id"),
                @Index(name = "idx_embedding_version", columnList = "embedding_version")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProductEmbeddingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "product_id", nullable = false)
    private UUID productId;

    @Column(name = "tenant_id")
    private UUID tenantId;

    @Column(name = "shop_id", nullable = false)
    private UUID shopId;

    @Column(name = "chunk_index", nullable = false)
    private int chunkIndex;

    @Column(name = "chunk_text", columnDefinition = "TEXT", nullable = false)
    private String chunkText;

    @Column(name = "embedding_json", columnDefinition = "TEXT", nullable = false)
    private String embeddingJson;

    @Column(name = "embedding_model", length = 128)
    private String embeddingModel;

    @Column(name = "embedding_version")
    private int embeddingVersion;

    @Column(name = "canonical_document_version")
    private int canonicalDocumentVersion;

    @Column(name = "generated_at")
    private Instant generatedAt;

    @Column(name = "payload_json", columnDefinition = "TEXT")
    private String payloadJson;

    @Column(nullable = false)
    private boolean active;

    @PrePersist
    public void prePersist() {
        if (generatedAt == null) generatedAt = Instant.now();
    }
}
