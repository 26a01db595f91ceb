package com.wshg.productsearch.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductSearchResult {
    private UUID productId;
    private UUID shopId;
    /** 相似度 [0, 1]，1 为完全相同 */
    private double relevanceScore;
    @Builder.Default
    private String productName = "";
    @Builder.Default
    private String shopName = "";
    @Builder.Default
    private String categoryName = "";
    @Builder.Default
    private BigDecimal price = BigDecimal.ZERO;
    private boolean inStock;
    private boolean onSale;
    @Builder.Default
    private String sku = "";
    private String matchedSnippet;
}
