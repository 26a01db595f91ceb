package com.wshg.productsearch.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;
import com.wshg.productsearch.common.convention.exception.ServiceException;
import com.wshg.productsearch.dto.EmbeddingStatistics;
import lombok.extern.slf4j.Slf4j;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 内存向量库，按 id 递增保存（即存储顺序）。
 * vector-store-type=file 时启动从文件加载、每次变更后整体写回文件；memory 时不落盘。
 * 写操作串行化，读操作基于并发 Map 快照。
 */
@Slf4j
public class InMemoryProductEmbeddingStore implements ProductEmbeddingStore {

    private final ObjectMapper objectMapper;
    /** 为 null 时不持久化 */
    private final Path persistPath;

    private final ConcurrentSkipListMap<Long, ProductEmbedding> store = new ConcurrentSkipListMap<>();
    private final Map<String, Long> chunkIndex = new HashMap<>();
    private final AtomicLong idSequence = new AtomicLong(1);

    public InMemoryProductEmbeddingStore(ObjectMapper objectMapper, Path persistPath) {
        this.objectMapper = objectMapper;
        this.persistPath = persistPath;
    }

    @PostConstruct
    public synchronized void loadFromFile() {
        if (persistPath == null || !Files.exists(persistPath)) return;
        try {
            String json = Files.readString(persistPath);
            List<ProductEmbedding> list = objectMapper.readValue(json, new TypeReference<>() {});
            if (list != null) {
                for (ProductEmbedding e : list) {
                    if (e == null || e.getId() == null || e.getProductId() == null) continue;
                    store.put(e.getId(), e);
                    chunkIndex.put(key(e.getProductId(), e.getChunkIndex()), e.getId());
                    idSequence.accumulateAndGet(e.getId() + 1, Math::max);
                }
                log.info("[向量库-文件] 已从文件加载: {} 条, 路径: {}", store.size(), persistPath);
            }
        } catch (Exception e) {
            log.warn("[向量库-文件] 加载失败: {}", persistPath, e);
        }
    }

    private void saveToFile() {
        if (persistPath == null) return;
        try {
            if (persistPath.getParent() != null) Files.createDirectories(persistPath.getParent());
            List<ProductEmbedding> list = new ArrayList<>(store.values());
            Files.writeString(persistPath, objectMapper.writeValueAsString(list));
        } catch (IOException e) {
            log.warn("[向量库-文件] 持久化失败: {}", persistPath, e);
        }
    }

    @Override
    public List<EmbeddingMatch> searchSimilar(float[] queryVector, int topK, UUID tenantId, UUID shopId,
                                              boolean activeOnly) {
        if (queryVector == null || store.isEmpty()) return List.of();
        List<ProductEmbedding> candidates = store.values().stream()
                .filter(e -> !activeOnly || e.isActive())
                .filter(e -> tenantId == null || tenantId.equals(e.getTenantId()))
                .filter(e -> shopId == null || shopId.equals(e.getShopId()))
                .map(InMemoryProductEmbeddingStore::copy)
                .collect(Collectors.toList());
        return VectorMath.rank(candidates, queryVector, topK);
    }

    @Override
    public List<ProductEmbedding> getByProduct(UUID productId) {
        if (productId == null) return List.of();
        return store.values().stream()
                .filter(e -> productId.equals(e.getProductId()))
                .sorted(Comparator.comparingInt(ProductEmbedding::getChunkIndex))
                .map(InMemoryProductEmbeddingStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized int deleteByProduct(UUID productId) {
        return removeWhere(e -> e.getProductId().equals(productId));
    }

    @Override
    public synchronized int deleteChunksFrom(UUID productId, int fromChunkIndex) {
        return removeWhere(e -> e.getProductId().equals(productId) && e.getChunkIndex() >= fromChunkIndex);
    }

    @Override
    public synchronized ProductEmbedding upsert(ProductEmbedding embedding) {
        validate(embedding);
        String k = key(embedding.getProductId(), embedding.getChunkIndex());
        Long existingId = chunkIndex.get(k);
        ProductEmbedding stored;
        if (existingId != null) {
            ProductEmbedding existing = store.get(existingId);
            stored = copy(embedding).toBuilder()
                    .id(existingId)
                    .active(existing.isActive())
                    .generatedAt(embedding.getGeneratedAt() != null ? embedding.getGeneratedAt() : Instant.now())
                    .build();
            log.debug("[向量库-内存] 更新 productId={}, chunk={}", embedding.getProductId(), embedding.getChunkIndex());
        } else {
            stored = copy(embedding).toBuilder()
                    .id(idSequence.getAndIncrement())
                    .active(true)
                    .generatedAt(embedding.getGeneratedAt() != null ? embedding.getGeneratedAt() : Instant.now())
                    .build();
            chunkIndex.put(k, stored.getId());
            log.debug("[向量库-内存] 新增 productId={}, chunk={}", embedding.getProductId(), embedding.getChunkIndex());
        }
        store.put(stored.getId(), stored);
        saveToFile();
        return copy(stored);
    }

    @Override
    public List<UUID> getProductsNeedingEmbedding(int currentModelVersion, int batchSize) {
        if (batchSize <= 0) return List.of();
        return store.values().stream()
                .filter(e -> e.getEmbeddingVersion() < currentModelVersion)
                .map(ProductEmbedding::getProductId)
                .distinct()
                .limit(batchSize)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized int setActive(UUID productId, boolean active) {
        int n = 0;
        for (ProductEmbedding e : store.values()) {
            if (e.getProductId().equals(productId)) {
                store.put(e.getId(), e.toBuilder().active(active).build());
                n++;
            }
        }
        if (n > 0) saveToFile();
        return n;
    }

    @Override
    public EmbeddingStatistics statistics(int currentModelVersion) {
        List<ProductEmbedding> all = new ArrayList<>(store.values());
        long active = all.stream().filter(ProductEmbedding::isActive).count();
        Map<String, Long> byModel = all.stream().collect(Collectors.groupingBy(
                e -> String.valueOf(e.getEmbeddingModel()), LinkedHashMap::new, Collectors.counting()));
        Map<Integer, Long> byVersion = all.stream().collect(Collectors.groupingBy(
                ProductEmbedding::getEmbeddingVersion, TreeMap::new, Collectors.counting()));
        return EmbeddingStatistics.builder()
                .totalEmbeddings(all.size())
                .activeEmbeddings(active)
                .inactiveEmbeddings(all.size() - active)
                .uniqueProducts(all.stream().map(ProductEmbedding::getProductId).distinct().count())
                .outdatedEmbeddings(all.stream().filter(e -> e.getEmbeddingVersion() < currentModelVersion).count())
                .embeddingsByModel(byModel)
                .embeddingsByVersion(new LinkedHashMap<>(byVersion))
                .build();
    }

    public int size() {
        return store.size();
    }

    private int removeWhere(Predicate<ProductEmbedding> predicate) {
        List<ProductEmbedding> removed = store.values().stream().filter(predicate).collect(Collectors.toList());
        for (ProductEmbedding e : removed) {
            store.remove(e.getId());
            chunkIndex.remove(key(e.getProductId(), e.getChunkIndex()));
        }
        if (!removed.isEmpty()) {
            log.debug("[向量库-内存] 删除 {} 条", removed.size());
            saveToFile();
        }
        return removed.size();
    }

    private static void validate(ProductEmbedding e) {
        if (e == null || e.getProductId() == null) {
            throw new ServiceException("向量记录缺少 productId", ProductSearchErrorCode.EMBEDDING_STORE_ERROR);
        }
        if (e.getEmbedding() == null || e.getEmbedding().length == 0) {
            throw new ServiceException("向量为空 productId=" + e.getProductId(), ProductSearchErrorCode.EMBEDDING_STORE_ERROR);
        }
    }

    private static String key(UUID productId, int chunkIndex) {
        return productId + "#" + chunkIndex;
    }

    private static ProductEmbedding copy(ProductEmbedding e) {
        return e.toBuilder()
                .embedding(e.getEmbedding() != null ? e.getEmbedding().clone() : null)
                .build();
    }
}
