package com.wshg.productsearch.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * 店铺级商品属性定义：决定属性的数据类型、语义标签以及是否参与向量化。
 */
@Entity
@Table(name = "product_attribute_definition", indexes = {
        @Index(name = "idx_attr_def_shop", columnList = "shop_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProductAttributeDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id")
    private UUID tenantId;

    @Column(name = "shop_id", nullable = false)
    private UUID shopId;

    /** 属性键，与商品 attributes JSON 的 key 对应（忽略大小写） */
    @Column(nullable = false, length = 128)
    private String name;

    @Column(name = "display_name", length = 128)
    private String displayName;

    @Enumerated(EnumType.STRING)
    @Column(name = "data_type", length = 16)
    private AttributeDataType dataType;

    @Builder.Default
    @Column(name = "include_in_embedding")
    private boolean includeInEmbedding = true;

    /** 越大越靠前 */
    @Column(name = "embedding_priority")
    private int embeddingPriority;

    @Column(name = "semantic_label", length = 128)
    private String semanticLabel;
}
