package com.wshg.productsearch.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * 向量记录上的展示元数据，检索结果直接由此填充，不再回查商品表。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProductPayload {
    private UUID productId;
    private String name;
    private UUID shopId;
    private String shopName;
    private String categoryName;
    private BigDecimal price;
    private boolean inStock;
    private boolean onSale;
    private String sku;
}
