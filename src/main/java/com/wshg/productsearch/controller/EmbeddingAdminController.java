package com.wshg.productsearch.controller;

import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;
import com.wshg.productsearch.common.convention.exception.ClientException;
import com.wshg.productsearch.dto.BulkReindexResult;
import com.wshg.productsearch.dto.EmbeddingStatistics;
import com.wshg.productsearch.dto.ReindexRequest;
import com.wshg.productsearch.entity.EmbeddingJob;
import com.wshg.productsearch.entity.EmbeddingJobType;
import com.wshg.productsearch.job.EmbeddingJobQueue;
import com.wshg.productsearch.service.BulkReindexService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 向量运维 API：重建、统计、健康检查、任务查询。
 */
@Slf4j
@RestController
@RequestMapping("/api/embeddings")
@RequiredArgsConstructor
public class EmbeddingAdminController {

    private final BulkReindexService reindexService;
    private final EmbeddingJobQueue jobQueue;

    /**
     * 全量重建。
     * POST /api/embeddings/reindex Body（可选）: { "tenantId": "...", "shopId": "..." }
     */
    @PostMapping("/reindex")
    public ResponseEntity<BulkReindexResult> reindex(@RequestBody(required = false) ReindexRequest body) {
        UUID tenantId = body != null ? body.getTenantId() : null;
        UUID shopId = body != null ? body.getShopId() : null;
        log.info("[API] POST /api/embeddings/reindex tenantId={}, shopId={}", tenantId, shopId);
        return ResponseEntity.ok(reindexService.triggerBulkReindex(tenantId, shopId));
    }

    /**
     * 重建过期向量（模型版本升级后）。
     * POST /api/embeddings/reindex-outdated?batchSize=100
     */
    @PostMapping("/reindex-outdated")
    public ResponseEntity<BulkReindexResult> reindexOutdated(
            @RequestParam(value = "batchSize", defaultValue = "100") int batchSize) {
        log.info("[API] POST /api/embeddings/reindex-outdated batchSize={}", batchSize);
        return ResponseEntity.ok(reindexService.reindexOutdatedEmbeddings(batchSize));
    }

    /**
     * 重新生成单个商品的向量。
     * POST /api/embeddings/products/{productId}/regenerate
     */
    @PostMapping("/products/{productId}/regenerate")
    public ResponseEntity<Map<String, Object>> regenerate(@PathVariable UUID productId) {
        log.info("[API] POST /api/embeddings/products/{}/regenerate", productId);
        EmbeddingJob job = jobQueue.enqueue(EmbeddingJobType.GENERATE, productId);
        return ResponseEntity.accepted().body(toJobView(job));
    }

    @GetMapping("/stats")
    public ResponseEntity<EmbeddingStatistics> stats() {
        return ResponseEntity.ok(reindexService.getStatistics());
    }

    @GetMapping("/counts")
    public ResponseEntity<Map<String, Long>> counts() {
        return ResponseEntity.ok(reindexService.getEmbeddingCounts());
    }

    /**
     * Ollama 连通性及模型是否已加载。
     * GET /api/embeddings/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean ok = reindexService.testConnection();
        log.info("[API] /api/embeddings/health connected={}", ok);
        return ResponseEntity.status(ok ? 200 : 503).body(Map.of("connected", ok));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<Map<String, Object>> job(@PathVariable Long jobId) {
        EmbeddingJob job = jobQueue.find(jobId)
                .orElseThrow(() -> new ClientException("任务不存在: " + jobId, ProductSearchErrorCode.JOB_NOT_FOUND));
        return ResponseEntity.ok(toJobView(job));
    }

    private static Map<String, Object> toJobView(EmbeddingJob job) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", job.getId());
        view.put("type", job.getJobType());
        view.put("productId", job.getProductId());
        view.put("status", job.getStatus());
        view.put("attempts", job.getAttempts());
        view.put("nextAttemptAt", job.getNextAttemptAt());
        view.put("lastError", job.getLastError());
        return view;
    }
}
