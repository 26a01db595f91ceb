package com.wshg.productsearch.service;

import com.wshg.productsearch.catalog.ProductCatalog;
import com.wshg.productsearch.client.EmbeddingClient;
import com.wshg.productsearch.dto.BulkReindexResult;
import com.wshg.productsearch.dto.EmbeddingStatistics;
import com.wshg.productsearch.entity.EmbeddingJobType;
import com.wshg.productsearch.job.EmbeddingJobQueue;
import com.wshg.productsearch.store.ProductEmbeddingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 运维操作：全量重建、模型升级后分批重建过期向量、统计与连通性检查。
 * 重建只负责入队，实际生成由后台任务完成。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkReindexService {

    public static final int DEFAULT_OUTDATED_BATCH_SIZE = 100;

    private final ProductCatalog catalog;
    private final ProductEmbeddingStore store;
    private final EmbeddingClient embeddingClient;
    private final EmbeddingJobQueue jobQueue;

    /**
     * 为所有启用且已上架的商品入队 GENERATE 任务（平台范围，可按租户/店铺过滤）。
     */
    public BulkReindexResult triggerBulkReindex(UUID tenantId, UUID shopId) {
        log.info("[重建] 开始全量重建 tenantId={}, shopId={}", tenantId, shopId);
        BulkReindexResult result = new BulkReindexResult();
        result.setStartedAt(Instant.now());
        List<UUID> productIds = catalog.findEligibleProductIds(tenantId, shopId);
        enqueueAll(productIds, result);
        log.info("[重建] 全量重建已入队 {}/{}，耗时 {}ms",
                result.getJobsEnqueued(), result.getTotalProducts(), result.getDurationMs());
        return result;
    }

    /**
     * 为向量版本低于当前模型版本的商品入队，每次最多 batchSize 个。
     */
    public BulkReindexResult reindexOutdatedEmbeddings(int batchSize) {
        int size = batchSize > 0 ? batchSize : DEFAULT_OUTDATED_BATCH_SIZE;
        int currentVersion = embeddingClient.getModelVersion();
        log.info("[重建] 开始重建过期向量 currentVersion={}, batchSize={}", currentVersion, size);
        BulkReindexResult result = new BulkReindexResult();
        result.setStartedAt(Instant.now());
        List<UUID> productIds = store.getProductsNeedingEmbedding(currentVersion, size);
        enqueueAll(productIds, result);
        log.info("[重建] 过期向量已入队 {}/{}", result.getJobsEnqueued(), result.getTotalProducts());
        return result;
    }

    public EmbeddingStatistics getStatistics() {
        int currentVersion = embeddingClient.getModelVersion();
        EmbeddingStatistics stats = store.statistics(currentVersion);
        stats.setCurrentModelVersion(currentVersion);
        stats.setCurrentModelName(embeddingClient.getModelName());
        stats.setProductsNeedingEmbedding(catalog.countProductsNeedingEmbedding());
        return stats;
    }

    public Map<String, Long> getEmbeddingCounts() {
        EmbeddingStatistics stats = store.statistics(embeddingClient.getModelVersion());
        return Map.of("total", stats.getTotalEmbeddings(), "active", stats.getActiveEmbeddings());
    }

    public boolean testConnection() {
        return embeddingClient.testConnection();
    }

    /** 逐个入队，单个失败记录错误并继续 */
    private void enqueueAll(List<UUID> productIds, BulkReindexResult result) {
        result.setTotalProducts(productIds.size());
        for (UUID productId : productIds) {
            try {
                jobQueue.enqueue(EmbeddingJobType.GENERATE, productId);
                result.setJobsEnqueued(result.getJobsEnqueued() + 1);
            } catch (RuntimeException e) {
                log.error("[重建] 入队失败 productId={}", productId, e);
                result.getErrors().add("入队失败 " + productId + ": " + e.getMessage());
            }
        }
        result.setCompletedAt(Instant.now());
        result.setSuccess(result.getErrors().isEmpty());
    }
}
