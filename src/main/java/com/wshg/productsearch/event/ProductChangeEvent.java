package com.wshg.productsearch.event;

import com.wshg.productsearch.entity.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * 商品变更事件，由商品管理模块通过 ApplicationEventPublisher 发布。
 * eligibleForEmbedding 为发布时商品是否「启用且已上架」。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductChangeEvent {
    private ProductChangeType changeType;
    private UUID productId;
    private UUID shopId;
    private UUID tenantId;
    private String productName;
    private boolean eligibleForEmbedding;
    /** 规范文档版本提示，仅用于日志排查 */
    private int canonicalDocumentVersion;
    @Builder.Default
    private Instant changedAt = Instant.now();

    public static ProductChangeEvent of(ProductChangeType type, Product product) {
        return ProductChangeEvent.builder()
                .changeType(type)
                .productId(product.getId())
                .shopId(product.getShopId())
                .tenantId(product.getTenantId())
                .productName(product.getName())
                .eligibleForEmbedding(product.isEligibleForEmbedding())
                .canonicalDocumentVersion(product.getCanonicalDocumentVersion())
                .build();
    }
}
