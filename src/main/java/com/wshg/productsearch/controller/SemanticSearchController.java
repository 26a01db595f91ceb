package com.wshg.productsearch.controller;

import com.wshg.productsearch.dto.ProductSearchResult;
import com.wshg.productsearch.dto.SearchRequest;
import com.wshg.productsearch.service.SemanticSearchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 商品语义检索 API。
 */
@Slf4j
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SemanticSearchController {

    private final SemanticSearchService searchService;

    /**
     * 语义检索。
     * GET /api/search?query=xxx&topK=10&tenantId=&shopId=
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> searchGet(
            @RequestParam("query") String query,
            @RequestParam(value = "topK", required = false) Integer topK,
            @RequestParam(value = "tenantId", required = false) UUID tenantId,
            @RequestParam(value = "shopId", required = false) UUID shopId) {
        return doSearch(query, topK, tenantId, shopId);
    }

    /**
     * POST /api/search Body: { "query": "xxx", "topK": 10, "tenantId": null, "shopId": null }
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> searchPost(@RequestBody SearchRequest body) {
        return doSearch(body.getQuery(), body.getTopK(), body.getTenantId(), body.getShopId());
    }

    /**
     * 相似商品。
     * GET /api/search/similar/{productId}?topK=5
     */
    @GetMapping("/similar/{productId}")
    public ResponseEntity<Map<String, Object>> similar(@PathVariable UUID productId,
                                                       @RequestParam(value = "topK", required = false) Integer topK) {
        log.info("[API] GET /api/search/similar/{} topK={}", productId, topK);
        List<ProductSearchResult> results = searchService.getSimilarProducts(productId, topK);
        return ResponseEntity.ok(Map.of(
                "productId", productId,
                "results", results,
                "count", results.size()
        ));
    }

    private ResponseEntity<Map<String, Object>> doSearch(String query, Integer topK, UUID tenantId, UUID shopId) {
        String q = query != null ? query : "";
        log.info("[API] /api/search query={}, topK={}, tenantId={}, shopId={}",
                q.length() > 30 ? q.substring(0, 30) + "..." : q, topK, tenantId, shopId);
        // 空查询由检索服务直接返回空结果
        List<ProductSearchResult> results = searchService.search(q, topK, tenantId, shopId);
        return ResponseEntity.ok(Map.of(
                "query", q,
                "results", results,
                "count", results.size()
        ));
    }
}
