package com.wshg.productsearch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.productsearch.catalog.DataScope;
import com.wshg.productsearch.catalog.ProductCatalog;
import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;
import com.wshg.productsearch.common.convention.exception.ServiceException;
import com.wshg.productsearch.document.AttributeValue;
import com.wshg.productsearch.document.CanonicalAttribute;
import com.wshg.productsearch.document.CanonicalProductDocument;
import com.wshg.productsearch.entity.AttributeDataType;
import com.wshg.productsearch.entity.Product;
import com.wshg.productsearch.entity.ProductAttributeDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 由商品及其分类、店铺、属性定义构建规范文档。只读，不修改商品。
 * 分类/店铺/属性定义均按平台范围读取（向量数据跨租户）。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CanonicalDocumentBuilder {

    /** 文档结构变化时递增 */
    public static final int CURRENT_SCHEMA_VERSION = 1;

    private final ProductCatalog catalog;
    private final ObjectMapper objectMapper;

    public CanonicalProductDocument build(Product product) {
        Objects.requireNonNull(product, "product");
        DataScope scope = DataScope.platform();
        return CanonicalProductDocument.builder()
                .schemaVersion(CURRENT_SCHEMA_VERSION)
                .productId(product.getId())
                .shopId(product.getShopId())
                .tenantId(product.getTenantId())
                .name(product.getName())
                .description(product.getDescription())
                .sku(product.getSku())
                .price(product.getPrice())
                .inStock(product.isInStock())
                .onSale(product.isOnSale())
                .categoryName(catalog.findCategoryName(product.getCategoryId(), scope).orElse(null))
                .shopName(catalog.findShopName(product.getShopId(), scope).orElse(null))
                .generatedAt(Instant.now())
                .attributes(buildAttributes(product, scope))
                .build();
    }

    public int getCurrentSchemaVersion() {
        return CURRENT_SCHEMA_VERSION;
    }

    public String toJson(CanonicalProductDocument document) {
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new ServiceException("规范文档序列化失败: " + document.getProductId(), e,
                    ProductSearchErrorCode.SERVICE_ERROR);
        }
    }

    /**
     * 解析缓存的规范文档；为空或格式错误时返回 empty（调用方重建）。
     */
    public Optional<CanonicalProductDocument> fromJson(String json) {
        if (json == null || json.isBlank()) return Optional.empty();
        try {
            return Optional.ofNullable(objectMapper.readValue(json, CanonicalProductDocument.class));
        } catch (Exception e) {
            log.warn("[规范文档] 缓存解析失败，将重建: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Map<String, CanonicalAttribute> buildAttributes(Product product, DataScope scope) {
        Map<String, CanonicalAttribute> result = new LinkedHashMap<>();
        String raw = product.getAttributes();
        if (raw == null || raw.isBlank()) return result;

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (Exception e) {
            log.warn("[规范文档] 商品属性 JSON 无法解析，按空属性处理 productId={}", product.getId());
            return result;
        }
        if (root == null || !root.isObject() || root.isEmpty()) return result;

        Map<String, ProductAttributeDefinition> definitions = new HashMap<>();
        for (ProductAttributeDefinition d : catalog.findAttributeDefinitions(product.getShopId(), scope)) {
            if (d.getName() != null) definitions.put(d.getName().toLowerCase(Locale.ROOT), d);
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            ProductAttributeDefinition def = definitions.get(key.toLowerCase(Locale.ROOT));
            if (def != null && !def.isIncludeInEmbedding()) continue;

            AttributeDataType type = def != null && def.getDataType() != null ? def.getDataType() : AttributeDataType.TEXT;
            AttributeValue value = AttributeValue.resolve(field.getValue(), type);
            if (value == null) continue;

            CanonicalAttribute.CanonicalAttributeBuilder attr = CanonicalAttribute.builder()
                    .value(value)
                    .dataType(type);
            if (def != null) {
                attr.priority(def.getEmbeddingPriority())
                        .semanticLabel(firstNonBlank(def.getSemanticLabel(), def.getDisplayName(), key));
            } else {
                attr.priority(0).semanticLabel(key);
            }
            result.put(key, attr.build());
        }
        return result;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
