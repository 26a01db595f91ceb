package com.wshg.productsearch.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.productsearch.common.convention.errorcode.ProductSearchErrorCode;
import com.wshg.productsearch.common.convention.exception.ServiceException;
import com.wshg.productsearch.dto.EmbeddingStatistics;
import com.wshg.productsearch.entity.ProductEmbeddingEntity;
import com.wshg.productsearch.repository.ProductEmbeddingRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * 向量库 MySQL 实现：每个分块一行，向量以 JSON 文本存储。
 * 租户/店铺/启用状态过滤在 SQL 中完成，余弦排序在内存中完成。
 */
@Slf4j
public class JpaProductEmbeddingStore implements ProductEmbeddingStore {

    private final ProductEmbeddingRepository repository;
    private final ObjectMapper objectMapper;

    public JpaProductEmbeddingStore(ProductEmbeddingRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(readOnly = true)
    public List<EmbeddingMatch> searchSimilar(float[] queryVector, int topK, UUID tenantId, UUID shopId,
                                              boolean activeOnly) {
        if (queryVector == null || topK <= 0) return List.of();
        List<ProductEmbedding> candidates = new ArrayList<>();
        for (ProductEmbeddingEntity e : repository.findCandidates(tenantId, shopId, activeOnly)) {
            ProductEmbedding model = toModel(e);
            if (model != null) candidates.add(model);
        }
        List<EmbeddingMatch> matches = VectorMath.rank(candidates, queryVector, topK);
        log.debug("[向量库-MySQL] 检索 候选={}, 返回={}", candidates.size(), matches.size());
        return matches;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ProductEmbedding> getByProduct(UUID productId) {
        if (productId == null) return List.of();
        return repository.findByProductIdOrderByChunkIndexAsc(productId).stream()
                .map(this::toModel)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional
    public int deleteByProduct(UUID productId) {
        if (productId == null) return 0;
        long n = repository.deleteByProductId(productId);
        if (n > 0) log.info("[向量库-MySQL] 删除商品向量 productId={}, 删除数={}", productId, n);
        return (int) n;
    }

    @Override
    @Transactional
    public int deleteChunksFrom(UUID productId, int fromChunkIndex) {
        if (productId == null) return 0;
        long n = repository.deleteByProductIdAndChunkIndexGreaterThanEqual(productId, fromChunkIndex);
        if (n > 0) log.debug("[向量库-MySQL] 清理多余分块 productId={}, from={}, 删除数={}", productId, fromChunkIndex, n);
        return (int) n;
    }

    @Override
    @Transactional
    public ProductEmbedding upsert(ProductEmbedding embedding) {
        validate(embedding);
        ProductEmbeddingEntity entity = repository
                .findByProductIdAndChunkIndex(embedding.getProductId(), embedding.getChunkIndex())
                .orElseGet(() -> ProductEmbeddingEntity.builder()
                        .productId(embedding.getProductId())
                        .chunkIndex(embedding.getChunkIndex())
                        .active(true)
                        .build());
        boolean created = entity.getId() == null;
        entity.setTenantId(embedding.getTenantId());
        entity.setShopId(embedding.getShopId());
        entity.setChunkText(embedding.getChunkText());
        entity.setEmbeddingJson(writeEmbedding(embedding.getEmbedding()));
        entity.setEmbeddingModel(embedding.getEmbeddingModel());
        entity.setEmbeddingVersion(embedding.getEmbeddingVersion());
        entity.setCanonicalDocumentVersion(embedding.getCanonicalDocumentVersion());
        entity.setGeneratedAt(embedding.getGeneratedAt() != null ? embedding.getGeneratedAt() : Instant.now());
        entity.setPayloadJson(embedding.getPayloadJson());
        ProductEmbeddingEntity saved = repository.save(entity);
        log.debug("[向量库-MySQL] {} productId={}, chunk={}, id={}",
                created ? "新增" : "更新", saved.getProductId(), saved.getChunkIndex(), saved.getId());
        return toModel(saved, embedding.getEmbedding().clone());
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> getProductsNeedingEmbedding(int currentModelVersion, int batchSize) {
        if (batchSize <= 0) return List.of();
        return repository.findProductIdsWithVersionBelow(currentModelVersion, PageRequest.of(0, batchSize));
    }

    @Override
    @Transactional
    public int setActive(UUID productId, boolean active) {
        if (productId == null) return 0;
        int n = repository.updateActiveByProductId(productId, active);
        if (n > 0) log.info("[向量库-MySQL] {} productId={}, 分块数={}", active ? "启用" : "停用", productId, n);
        return n;
    }

    @Override
    @Transactional(readOnly = true)
    public EmbeddingStatistics statistics(int currentModelVersion) {
        long total = repository.count();
        long active = repository.countByActiveTrue();
        Map<String, Long> byModel = new LinkedHashMap<>();
        for (Object[] row : repository.countGroupByModel()) {
            byModel.put(String.valueOf(row[0]), ((Number) row[1]).longValue());
        }
        Map<Integer, Long> byVersion = new TreeMap<>();
        for (Object[] row : repository.countGroupByVersion()) {
            byVersion.put(((Number) row[0]).intValue(), ((Number) row[1]).longValue());
        }
        return EmbeddingStatistics.builder()
                .totalEmbeddings(total)
                .activeEmbeddings(active)
                .inactiveEmbeddings(total - active)
                .uniqueProducts(repository.countDistinctProducts())
                .outdatedEmbeddings(repository.countByEmbeddingVersionLessThan(currentModelVersion))
                .embeddingsByModel(byModel)
                .embeddingsByVersion(new LinkedHashMap<>(byVersion))
                .build();
    }

    private ProductEmbedding toModel(ProductEmbeddingEntity e) {
        float[] emb = parseEmbedding(e.getEmbeddingJson());
        if (emb == null) {
            log.warn("[向量库-MySQL] 向量 JSON 无法解析，跳过 id={}, productId={}", e.getId(), e.getProductId());
            return null;
        }
        return toModel(e, emb);
    }

    private ProductEmbedding toModel(ProductEmbeddingEntity e, float[] emb) {
        return ProductEmbedding.builder()
                .id(e.getId())
                .productId(e.getProductId())
                .tenantId(e.getTenantId())
                .shopId(e.getShopId())
                .chunkIndex(e.getChunkIndex())
                .chunkText(e.getChunkText())
                .embedding(emb)
                .embeddingModel(e.getEmbeddingModel())
                .embeddingVersion(e.getEmbeddingVersion())
                .canonicalDocumentVersion(e.getCanonicalDocumentVersion())
                .generatedAt(e.getGeneratedAt())
                .payloadJson(e.getPayloadJson())
                .active(e.isActive())
                .build();
    }

    private float[] parseEmbedding(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            List<Number> list = objectMapper.readValue(json, new TypeReference<>() {});
            if (list == null || list.isEmpty()) return null;
            float[] a = new float[list.size()];
            for (int i = 0; i < list.size(); i++) a[i] = list.get(i).floatValue();
            return a;
        } catch (Exception ex) {
            return null;
        }
    }

    private String writeEmbedding(float[] embedding) {
        try {
            return objectMapper.writeValueAsString(embedding);
        } catch (Exception e) {
            throw new ServiceException("向量序列化失败", e, ProductSearchErrorCode.EMBEDDING_STORE_ERROR);
        }
    }

    private static void validate(ProductEmbedding e) {
        if (e == null || e.getProductId() == null || e.getShopId() == null) {
            throw new ServiceException("向量记录缺少 productId 或 shopId", ProductSearchErrorCode.EMBEDDING_STORE_ERROR);
        }
        if (e.getEmbedding() == null || e.getEmbedding().length == 0) {
            throw new ServiceException("向量为空 productId=" + e.getProductId(), ProductSearchErrorCode.EMBEDDING_STORE_ERROR);
        }
    }
}
