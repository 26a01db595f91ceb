package com.wshg.productsearch.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * 商品规范文档：向量化用的商品快照，带 schemaVersion 以便判断缓存是否过期。
 * JSON 形式缓存在商品表上，任何时候都可由源数据重建。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CanonicalProductDocument {

    private int schemaVersion;
    private UUID productId;
    private UUID shopId;
    private UUID tenantId;
    private String name;
    private String description;
    private String sku;
    private BigDecimal price;
    private boolean inStock;
    private boolean onSale;
    private String categoryName;
    private String shopName;
    private Instant generatedAt;

    /** 保持插入顺序，排序时作为同优先级的次序 */
    @Builder.Default
    private Map<String, CanonicalAttribute> attributes = new LinkedHashMap<>();

    /**
     * 生成用于向量化的文本，同一文档多次调用结果一致。
     */
    public String toEmbeddingText() {
        StringBuilder sb = new StringBuilder();
        sb.append("Product: ").append(name != null ? name : "").append('\n');
        appendLine(sb, "Shop", shopName);
        appendLine(sb, "Category", categoryName);
        appendLine(sb, "Description", description);
        sb.append("Price: $")
                .append(String.format(Locale.ROOT, "%.2f", price != null ? price : BigDecimal.ZERO))
                .append('\n');
        if (onSale) {
            sb.append("This product is currently on sale.\n");
        }
        if (!inStock) {
            sb.append("This product is currently out of stock.\n");
        }
        if (attributes != null && !attributes.isEmpty()) {
            sb.append("Specifications:\n");
            // List.sort 是稳定排序，同优先级保持插入顺序
            List<Map.Entry<String, CanonicalAttribute>> sorted = new ArrayList<>(attributes.entrySet());
            sorted.sort(Comparator.comparingInt(
                    (Map.Entry<String, CanonicalAttribute> e) -> e.getValue().getPriority()).reversed());
            for (Map.Entry<String, CanonicalAttribute> e : sorted) {
                CanonicalAttribute attr = e.getValue();
                String label = attr.getSemanticLabel() != null && !attr.getSemanticLabel().isBlank()
                        ? attr.getSemanticLabel() : e.getKey();
                String value = attr.getValue() != null ? attr.getValue().getText() : "";
                sb.append("- ").append(label).append(": ").append(value).append('\n');
            }
        }
        return sb.toString().trim();
    }

    private static void appendLine(StringBuilder sb, String label, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(label).append(": ").append(value).append('\n');
        }
    }
}
