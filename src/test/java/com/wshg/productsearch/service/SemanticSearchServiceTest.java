package com.wshg.productsearch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.productsearch.client.EmbeddingClient;
import com.wshg.productsearch.common.convention.exception.UpstreamException;
import com.wshg.productsearch.config.ProductSearchProperties;
import com.wshg.productsearch.dto.ProductSearchResult;
import com.wshg.productsearch.entity.ProductEmbeddingEntity;
import com.wshg.productsearch.repository.ProductEmbeddingRepository;
import com.wshg.productsearch.store.EmbeddingMatch;
import com.wshg.productsearch.store.JpaProductEmbeddingStore;
import com.wshg.productsearch.store.ProductEmbedding;
import com.wshg.productsearch.store.ProductEmbeddingStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class SemanticSearchServiceTest {

    private static final float[] QUERY = {0.1f, 0.2f, 0.3f};

    private EmbeddingClient embeddingClient;
    private ProductEmbeddingStore store;
    private ProductSearchProperties props;
    private SemanticSearchService service;

    @BeforeEach
    void setUp() {
        embeddingClient = mock(EmbeddingClient.class);
        store = mock(ProductEmbeddingStore.class);
        props = new ProductSearchProperties();
        service = new SemanticSearchService(embeddingClient, store, props, new ObjectMapper().findAndRegisterModules());
        when(embeddingClient.generateEmbedding(anyString())).thenReturn(QUERY);
    }

    private static EmbeddingMatch match(UUID productId, int chunkIndex, double score, String text, String payload) {
        ProductEmbedding e = ProductEmbedding.builder()
                .id((long) chunkIndex + 1)
                .productId(productId)
                .shopId(UUID.nameUUIDFromBytes("shop".getBytes()))
                .chunkIndex(chunkIndex)
                .chunkText(text)
                .embedding(new float[]{1, 0, 0})
                .payloadJson(payload)
                .active(true)
                .build();
        return EmbeddingMatch.builder()
                .embedding(e)
                .distance((1 - score) * 2)
                .similarityScore(score)
                .build();
    }

    @Test
    void search_blankQueryReturnsEmptyWithoutCallingBackend() {
        assertTrue(service.search("   ", 5, null, null).isEmpty());
        assertTrue(service.search(null, 5, null, null).isEmpty());

        verifyNoInteractions(embeddingClient, store);
    }

    @Test
    void search_keepsBestChunkPerProduct() {
        UUID p = UUID.randomUUID();
        UUID q = UUID.randomUUID();
        when(store.searchSimilar(eq(QUERY), eq(40), isNull(), isNull(), eq(true))).thenReturn(List.of(
                match(p, 1, 0.8, "chunk one", null),
                match(q, 0, 0.7, "other", null),
                match(p, 0, 0.95, "chunk zero", null)));

        List<ProductSearchResult> results = service.search("running shoe", 5, null, null);

        assertEquals(2, results.size());
        assertEquals(p, results.get(0).getProductId());
        assertEquals(0.95, results.get(0).getRelevanceScore(), 1e-9);
        assertEquals("chunk zero", results.get(0).getMatchedSnippet());
        assertEquals(q, results.get(1).getProductId());
        verify(embeddingClient).generateEmbedding("running shoe");
    }

    @Test
    void search_hydratesFromPayloadAndTruncatesSnippet() {
        UUID p = UUID.randomUUID();
        String payload = "{\"productId\":\"" + p + "\",\"name\":\"Trail Runner\",\"shopName\":\"Acme\","
                + "\"categoryName\":\"Shoes\",\"price\":89.5,\"inStock\":true,\"onSale\":true,\"sku\":\"TR-1\"}";
        String longText = "x".repeat(500);
        when(store.searchSimilar(any(), anyInt(), any(), any(), eq(true)))
                .thenReturn(List.of(match(p, 0, 0.9, longText, payload)));

        ProductSearchResult r = service.search("shoe", 1, null, null).get(0);

        assertEquals("Trail Runner", r.getProductName());
        assertEquals("Acme", r.getShopName());
        assertEquals("Shoes", r.getCategoryName());
        assertEquals(0, new BigDecimal("89.5").compareTo(r.getPrice()));
        assertTrue(r.isInStock());
        assertTrue(r.isOnSale());
        assertEquals("TR-1", r.getSku());
        assertEquals(200, r.getMatchedSnippet().length());
        assertTrue(r.getMatchedSnippet().endsWith("..."));
    }

    @Test
    void search_malformedPayloadFallsBackToDefaults() {
        UUID p = UUID.randomUUID();
        when(store.searchSimilar(any(), anyInt(), any(), any(), eq(true)))
                .thenReturn(List.of(match(p, 0, 0.9, "text", "{not json")));

        ProductSearchResult r = service.search("shoe", 1, null, null).get(0);

        assertEquals(p, r.getProductId());
        assertEquals("", r.getProductName());
        assertEquals(BigDecimal.ZERO, r.getPrice());
        assertFalse(r.isInStock());
    }

    @Test
    void search_widensOverSingleRankedScan() {
        UUID p = UUID.randomUUID();
        UUID q = UUID.randomUUID();
        // topK=2 → 首轮 4 条，最多 3 轮，一次取 16 条
        when(store.searchSimilar(any(), eq(16), any(), any(), eq(true))).thenReturn(List.of(
                match(p, 0, 0.99, "a", null), match(p, 1, 0.98, "b", null),
                match(p, 2, 0.97, "c", null), match(p, 3, 0.96, "d", null),
                match(q, 0, 0.5, "e", null)));

        List<ProductSearchResult> results = service.search("shoe", 2, null, null);

        assertEquals(List.of(p, q), results.stream().map(ProductSearchResult::getProductId).toList());
        verify(store, times(1)).searchSimilar(any(), anyInt(), any(), any(), anyBoolean());
    }

    @Test
    void search_stopsWideningAtMaxRounds() {
        props.setMaxFetchRounds(1);
        UUID p = UUID.randomUUID();
        when(store.searchSimilar(any(), eq(4), any(), any(), eq(true))).thenReturn(List.of(
                match(p, 0, 0.99, "a", null), match(p, 1, 0.98, "b", null),
                match(p, 2, 0.97, "c", null), match(p, 3, 0.96, "d", null)));

        List<ProductSearchResult> results = service.search("shoe", 2, null, null);

        assertEquals(1, results.size());
    }

    @Test
    void search_scansMysqlStoreOncePerQuery() {
        ProductEmbeddingRepository repository = mock(ProductEmbeddingRepository.class);
        List<ProductEmbeddingEntity> rows = new ArrayList<>();
        UUID p = UUID.randomUUID();
        for (int i = 0; i < 6; i++) {
            rows.add(ProductEmbeddingEntity.builder()
                    .id((long) i + 1)
                    .productId(p)
                    .shopId(UUID.randomUUID())
                    .chunkIndex(i)
                    .chunkText("chunk " + i)
                    .embeddingJson("[0.1,0.2,0.3]")
                    .active(true)
                    .build());
        }
        when(repository.findCandidates(null, null, true)).thenReturn(rows);
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        SemanticSearchService mysqlBacked = new SemanticSearchService(embeddingClient,
                new JpaProductEmbeddingStore(repository, objectMapper), props, objectMapper);

        List<ProductSearchResult> results = mysqlBacked.search("shoe", 3, null, null);

        assertEquals(1, results.size());
        verify(repository, times(1)).findCandidates(null, null, true);
    }

    @Test
    void search_passesTenantAndShopFilters() {
        UUID tenant = UUID.randomUUID();
        UUID shop = UUID.randomUUID();
        when(store.searchSimilar(any(), anyInt(), any(), any(), eq(true))).thenReturn(List.of());

        assertTrue(service.search("shoe", 3, tenant, shop).isEmpty());

        verify(store).searchSimilar(QUERY, 24, tenant, shop, true);
    }

    @Test
    void search_clampsTopK() {
        when(store.searchSimilar(any(), anyInt(), any(), any(), eq(true))).thenReturn(List.of());

        service.search("shoe", 500, null, null);
        service.search("shoe", null, null, null);

        verify(store).searchSimilar(QUERY, 400, null, null, true);
        verify(store).searchSimilar(QUERY, 80, null, null, true);
    }

    @Test
    void search_upstreamFailurePropagates() {
        when(embeddingClient.generateEmbedding(anyString())).thenThrow(new UpstreamException("down"));

        assertThrows(UpstreamException.class, () -> service.search("shoe", 5, null, null));
        verifyNoInteractions(store);
    }

    @Test
    void similarProducts_usesFirstChunkAndExcludesSelf() {
        UUID self = UUID.randomUUID();
        UUID other = UUID.randomUUID();
        float[] firstChunk = {0f, 1f, 0f};
        when(store.getByProduct(self)).thenReturn(List.of(
                ProductEmbedding.builder().productId(self).chunkIndex(0).embedding(firstChunk).build(),
                ProductEmbedding.builder().productId(self).chunkIndex(1).embedding(new float[]{1f, 0f, 0f}).build()));
        when(store.searchSimilar(eq(firstChunk), eq(48), isNull(), isNull(), eq(true))).thenReturn(List.of(
                match(self, 0, 1.0, "self", null),
                match(other, 0, 0.8, "other", null)));

        List<ProductSearchResult> results = service.getSimilarProducts(self, null);

        assertEquals(1, results.size());
        assertEquals(other, results.get(0).getProductId());
        verifyNoInteractions(embeddingClient);
    }

    @Test
    void similarProducts_emptyWhenProductHasNoEmbeddings() {
        UUID p = UUID.randomUUID();
        when(store.getByProduct(p)).thenReturn(List.of());

        assertTrue(service.getSimilarProducts(p, 5).isEmpty());
        verify(store, never()).searchSimilar(any(), anyInt(), any(), any(), anyBoolean());
    }

    @Test
    void dedupe_dropsExcludedProduct() {
        UUID p = UUID.randomUUID();
        assertTrue(SemanticSearchService.dedupe(List.of(match(p, 0, 0.9, "t", null)), p).isEmpty());
    }
}
