package com.wshg.productsearch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.productsearch.catalog.DataScope;
import com.wshg.productsearch.catalog.ProductCatalog;
import com.wshg.productsearch.client.EmbeddingClient;
import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;
import com.wshg.productsearch.common.convention.exception.ServiceException;
import com.wshg.productsearch.config.ProductSearchProperties;
import com.wshg.productsearch.document.CanonicalProductDocument;
import com.wshg.productsearch.document.ContentChunk;
import com.wshg.productsearch.dto.ProductPayload;
import com.wshg.productsearch.entity.Product;
import com.wshg.productsearch.store.ProductEmbedding;
import com.wshg.productsearch.store.ProductEmbeddingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 单个商品的向量流水线：规范文档 → 分块 → 向量化 → upsert，以及启用/停用/删除。
 * 所有操作幂等，异常直接抛给任务队列重试；失败留下的部分分块会在重试时被覆盖。
 */
@Slf4j
@Service
public class ProductEmbeddingWorker {

    private final ProductCatalog catalog;
    private final CanonicalDocumentBuilder documentBuilder;
    private final ContentChunker chunker;
    private final EmbeddingClient embeddingClient;
    private final ProductEmbeddingStore store;
    private final ObjectMapper objectMapper;
    private final boolean generationEnabled;

    public ProductEmbeddingWorker(ProductCatalog catalog,
                                  CanonicalDocumentBuilder documentBuilder,
                                  ContentChunker chunker,
                                  EmbeddingClient embeddingClient,
                                  ProductEmbeddingStore store,
                                  ObjectMapper objectMapper,
                                  ProductSearchProperties props) {
        this.catalog = catalog;
        this.documentBuilder = documentBuilder;
        this.chunker = chunker;
        this.embeddingClient = embeddingClient;
        this.store = store;
        this.objectMapper = objectMapper;
        this.generationEnabled = props.isEnableEmbeddingGeneration();
    }

    public void generateEmbedding(UUID productId) {
        if (!generationEnabled) {
            log.debug("[Worker] 向量生成已关闭，跳过 productId={}", productId);
            return;
        }
        Optional<Product> found = catalog.findProduct(productId, DataScope.platform());
        if (found.isEmpty()) {
            // 事件可能晚于删除到达
            log.warn("[Worker] 商品不存在，跳过 productId={}", productId);
            return;
        }
        Product product = found.get();
        if (!product.isEligibleForEmbedding()) {
            log.info("[Worker] 商品未启用或未上架，转为停用向量 productId={}", productId);
            deactivateEmbeddings(productId);
            return;
        }

        long start = System.currentTimeMillis();
        CanonicalProductDocument document = resolveDocument(product);
        List<ContentChunk> chunks = chunker.chunk(document.toEmbeddingText(), document.getName());
        if (chunks.isEmpty()) {
            log.warn("[Worker] 向量文本为空，跳过 productId={}", productId);
            return;
        }

        String payloadJson = buildPayload(document);
        String model = embeddingClient.getModelName();
        int modelVersion = embeddingClient.getModelVersion();
        Instant generatedAt = Instant.now();
        boolean hasInactive = false;
        for (ContentChunk chunk : chunks) {
            float[] vector = embeddingClient.generateEmbedding(chunk.getText());
            ProductEmbedding saved = store.upsert(ProductEmbedding.builder()
                    .productId(product.getId())
                    .tenantId(product.getTenantId())
                    .shopId(product.getShopId())
                    .chunkIndex(chunk.getIndex())
                    .chunkText(chunk.getText())
                    .embedding(vector)
                    .embeddingModel(model)
                    .embeddingVersion(modelVersion)
                    .canonicalDocumentVersion(document.getSchemaVersion())
                    .generatedAt(generatedAt)
                    .payloadJson(payloadJson)
                    .build());
            hasInactive |= !saved.isActive();
            log.debug("[Worker] 分块已写入 productId={}, chunk={}, dim={}", productId, chunk.getIndex(), vector.length);
        }
        int stale = store.deleteChunksFrom(productId, chunks.size());

        product.markEmbeddingGenerated();
        if (!catalog.saveEmbeddingState(product)) {
            log.warn("[Worker] 生成期间商品已被删除，清理向量 productId={}", productId);
            store.deleteByProduct(productId);
            return;
        }
        // 向量化耗时较长，期间商品可能已被下架，以最新状态为准
        boolean stillEligible = catalog.findProduct(productId, DataScope.platform())
                .map(Product::isEligibleForEmbedding)
                .orElse(false);
        if (!stillEligible) {
            log.info("[Worker] 生成期间商品已下架，停用向量 productId={}", productId);
            store.setActive(productId, false);
        } else if (hasInactive) {
            // 之前下架留下的停用分块，商品已重新上架
            store.setActive(productId, true);
        }
        log.info("[Worker] 向量生成完成 productId={}, chunks={}, 清理旧分块={}, model={} v{}, 耗时={}ms",
                productId, chunks.size(), stale, model, modelVersion, System.currentTimeMillis() - start);
    }

    public void deleteEmbeddings(UUID productId) {
        int n = store.deleteByProduct(productId);
        log.info("[Worker] 删除商品向量 productId={}, 删除数={}", productId, n);
    }

    public void deactivateEmbeddings(UUID productId) {
        int n = store.setActive(productId, false);
        log.info("[Worker] 停用商品向量 productId={}, 分块数={}", productId, n);
    }

    /**
     * 重新上架：已有向量直接启用，没有则完整生成。
     */
    public void activateEmbeddings(UUID productId) {
        if (store.getByProduct(productId).isEmpty()) {
            log.info("[Worker] 商品无向量，转为生成 productId={}", productId);
            generateEmbedding(productId);
            return;
        }
        Optional<Product> product = catalog.findProduct(productId, DataScope.platform());
        if (product.isPresent() && !product.get().isEligibleForEmbedding()) {
            // 上架事件晚于下架事件到达
            log.info("[Worker] 商品当前未上架，保持停用 productId={}", productId);
            return;
        }
        int n = store.setActive(productId, true);
        log.info("[Worker] 启用商品向量 productId={}, 分块数={}", productId, n);
    }

    /**
     * 优先复用商品上缓存的规范文档：能解析、schema 版本为当前版本、且不早于商品最后修改时间。
     * 否则重建并写回缓存（随商品一起保存）。
     */
    private CanonicalProductDocument resolveDocument(Product product) {
        int currentVersion = documentBuilder.getCurrentSchemaVersion();
        if (product.getCanonicalDocumentVersion() == currentVersion && isCacheFresh(product)) {
            Optional<CanonicalProductDocument> cached = documentBuilder.fromJson(product.getCanonicalDocument())
                    .filter(d -> d.getSchemaVersion() == currentVersion);
            if (cached.isPresent()) {
                log.debug("[Worker] 复用缓存的规范文档 productId={}", product.getId());
                return cached.get();
            }
        }
        CanonicalProductDocument document = documentBuilder.build(product);
        product.updateCanonicalDocument(documentBuilder.toJson(document), document.getSchemaVersion());
        return document;
    }

    private static boolean isCacheFresh(Product product) {
        Instant cachedAt = product.getCanonicalDocumentUpdatedAt();
        if (cachedAt == null) return false;
        return product.getUpdatedAt() == null || !cachedAt.isBefore(product.getUpdatedAt());
    }

    private String buildPayload(CanonicalProductDocument document) {
        ProductPayload payload = ProductPayload.builder()
                .productId(document.getProductId())
                .name(document.getName())
                .shopId(document.getShopId())
                .shopName(document.getShopName())
                .categoryName(document.getCategoryName())
                .price(document.getPrice())
                .inStock(document.isInStock())
                .onSale(document.isOnSale())
                .sku(document.getSku())
                .build();
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new ServiceException("展示元数据序列化失败: " + document.getProductId(), e,
                    ProductSearchErrorCode.SERVICE_ERROR);
        }
    }
}
