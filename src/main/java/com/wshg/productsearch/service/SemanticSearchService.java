package com.wshg.productsearch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.productsearch.client.EmbeddingClient;
import com.wshg.productsearch.config.ProductSearchProperties;
import com.wshg.productsearch.dto.ProductPayload;
import com.wshg.productsearch.dto.ProductSearchResult;
import com.wshg.productsearch.store.EmbeddingMatch;
import com.wshg.productsearch.store.ProductEmbedding;
import com.wshg.productsearch.store.ProductEmbeddingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 语义检索：查询向量化 → 向量库召回 → 按商品去重（保留最高分分块）→ 排序截断 → 填充展示字段。
 * 去重后不足 topK 且召回结果已满时，扩大召回量重试（最多 maxFetchRounds 轮）。
 * 向量库每次检索只扫描一次，扩大召回在同一份有序结果上进行。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticSearchService {

    static final int MAX_TOP_K = 50;
    static final int DEFAULT_SIMILAR_TOP_K = 5;
    /** 召回量按轮翻倍，限制轮数避免溢出 */
    private static final int MAX_FETCH_ROUNDS = 8;

    private final EmbeddingClient embeddingClient;
    private final ProductEmbeddingStore store;
    private final ProductSearchProperties props;
    private final ObjectMapper objectMapper;

    public List<ProductSearchResult> search(String query, Integer topK, UUID tenantId, UUID shopId) {
        if (query == null || query.isBlank()) return List.of();
        int k = normalizeTopK(topK, props.getDefaultTopK());
        long start = System.currentTimeMillis();
        float[] queryVector = embeddingClient.generateEmbedding(query.trim());
        List<ProductSearchResult> results = searchByVector(queryVector, k, tenantId, shopId, null);
        log.info("[Search] query={}, topK={}, 命中={}, 耗时={}ms",
                abbreviate(query), k, results.size(), System.currentTimeMillis() - start);
        return results;
    }

    /**
     * 以商品 0 号分块的向量为查询向量，返回除自身外最相似的商品；商品无向量时返回空列表。
     */
    public List<ProductSearchResult> getSimilarProducts(UUID productId, Integer topK) {
        int k = normalizeTopK(topK, DEFAULT_SIMILAR_TOP_K);
        List<ProductEmbedding> own = store.getByProduct(productId);
        Optional<ProductEmbedding> primary = own.stream()
                .min(Comparator.comparingInt(ProductEmbedding::getChunkIndex));
        if (primary.isEmpty()) {
            log.warn("[Search] 参考商品无向量 productId={}", productId);
            return List.of();
        }
        List<ProductSearchResult> results = searchByVector(primary.get().getEmbedding(), k, null, null, productId);
        log.info("[Search] 相似商品 productId={}, topK={}, 命中={}", productId, k, results.size());
        return results;
    }

    private List<ProductSearchResult> searchByVector(float[] vector, int topK, UUID tenantId, UUID shopId,
                                                     UUID excludeProductId) {
        int multiplier = Math.max(1, props.getCandidateMultiplier());
        int fetch = excludeProductId == null ? multiplier * topK : multiplier * (topK + 1);
        int maxRounds = maxFetchRounds();

        // 向量库只扫描一次，按最后一轮的召回量取排序结果；各轮在这份有序列表的前缀上扩大
        List<EmbeddingMatch> ranked = store.searchSimilar(vector, fetch << (maxRounds - 1), tenantId, shopId, true);
        Map<UUID, EmbeddingMatch> best;
        for (int round = 1; ; round++) {
            List<EmbeddingMatch> raw = ranked.subList(0, Math.min(fetch, ranked.size()));
            best = dedupe(raw, excludeProductId);
            if (best.size() >= topK || raw.size() < fetch || round >= maxRounds) break;
            log.debug("[Search] 去重后不足 topK，扩大召回 round={}, fetch={}, 商品数={}", round, fetch, best.size());
            fetch *= 2;
        }

        return best.values().stream()
                .sorted(Comparator.comparingDouble(EmbeddingMatch::getSimilarityScore).reversed())
                .limit(topK)
                .map(this::toResult)
                .collect(Collectors.toList());
    }

    private int maxFetchRounds() {
        return Math.min(Math.max(1, props.getMaxFetchRounds()), MAX_FETCH_ROUNDS);
    }

    /** 每个商品只保留相似度最高的分块，保持首次出现顺序 */
    static Map<UUID, EmbeddingMatch> dedupe(List<EmbeddingMatch> raw, UUID excludeProductId) {
        Map<UUID, EmbeddingMatch> best = new LinkedHashMap<>();
        for (EmbeddingMatch m : raw) {
            UUID pid = m.getEmbedding().getProductId();
            if (pid == null || pid.equals(excludeProductId)) continue;
            EmbeddingMatch current = best.get(pid);
            if (current == null || m.getSimilarityScore() > current.getSimilarityScore()) {
                best.put(pid, m);
            }
        }
        return best;
    }

    private ProductSearchResult toResult(EmbeddingMatch match) {
        ProductEmbedding e = match.getEmbedding();
        ProductSearchResult.ProductSearchResultBuilder result = ProductSearchResult.builder()
                .productId(e.getProductId())
                .shopId(e.getShopId())
                .relevanceScore(match.getSimilarityScore())
                .matchedSnippet(snippet(e.getChunkText()));
        ProductPayload payload = parsePayload(e);
        if (payload != null) {
            result.productName(nullToEmpty(payload.getName()))
                    .shopName(nullToEmpty(payload.getShopName()))
                    .categoryName(nullToEmpty(payload.getCategoryName()))
                    .price(payload.getPrice() != null ? payload.getPrice() : BigDecimal.ZERO)
                    .inStock(payload.isInStock())
                    .onSale(payload.isOnSale())
                    .sku(nullToEmpty(payload.getSku()));
        }
        return result.build();
    }

    private ProductPayload parsePayload(ProductEmbedding e) {
        if (e.getPayloadJson() == null || e.getPayloadJson().isBlank()) return null;
        try {
            return objectMapper.readValue(e.getPayloadJson(), ProductPayload.class);
        } catch (Exception ex) {
            log.warn("[Search] 展示元数据解析失败，使用默认值 productId={}, embeddingId={}", e.getProductId(), e.getId());
            return null;
        }
    }

    String snippet(String text) {
        if (text == null) return "";
        int max = Math.max(4, props.getSnippetLength());
        if (text.length() <= max) return text;
        return text.substring(0, max - 3) + "...";
    }

    private static int normalizeTopK(Integer topK, int defaultTopK) {
        int k = topK == null || topK <= 0 ? defaultTopK : topK;
        return Math.min(Math.max(k, 1), MAX_TOP_K);
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }

    private static String abbreviate(String query) {
        return query.length() > 30 ? query.substring(0, 30) + "..." : query;
    }
}
