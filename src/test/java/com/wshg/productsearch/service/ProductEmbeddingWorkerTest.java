package com.wshg.productsearch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.productsearch.catalog.DataScope;
import com.wshg.productsearch.catalog.ProductCatalog;
import com.wshg.productsearch.client.EmbeddingClient;
import com.wshg.productsearch.common.convention.exception.UpstreamException;
import com.wshg.productsearch.config.ProductSearchProperties;
import com.wshg.productsearch.dto.ProductPayload;
import com.wshg.productsearch.entity.Product;
import com.wshg.productsearch.store.EmbeddingMatch;
import com.wshg.productsearch.store.InMemoryProductEmbeddingStore;
import com.wshg.productsearch.store.ProductEmbedding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ProductEmbeddingWorkerTest {

    private static final float[] VECTOR = {1f, 0f, 0f};

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final UUID shopId = UUID.randomUUID();

    private ProductCatalog catalog;
    private EmbeddingClient embeddingClient;
    private InMemoryProductEmbeddingStore store;
    private ProductSearchProperties props;
    private Product product;

    @BeforeEach
    void setUp() {
        catalog = mock(ProductCatalog.class);
        embeddingClient = mock(EmbeddingClient.class);
        store = new InMemoryProductEmbeddingStore(objectMapper, null);
        props = new ProductSearchProperties();

        product = Product.builder()
                .id(UUID.randomUUID())
                .tenantId(UUID.randomUUID())
                .shopId(shopId)
                .name("Trail Runner")
                .description("Light shoe for rocky paths.")
                .sku("TR-1")
                .price(new BigDecimal("89.50"))
                .stockQuantity(3)
                .published(true)
                .updatedAt(Instant.now().minusSeconds(60))
                .build();

        when(catalog.findProduct(product.getId(), DataScope.platform())).thenAnswer(inv -> Optional.of(product));
        when(catalog.findShopName(shopId, DataScope.platform())).thenReturn(Optional.of("Acme"));
        when(catalog.saveEmbeddingState(any())).thenReturn(true);
        when(embeddingClient.generateEmbedding(anyString())).thenReturn(VECTOR);
        when(embeddingClient.getModelName()).thenReturn("embeddinggemma");
        when(embeddingClient.getModelVersion()).thenReturn(2);
    }

    private ProductEmbeddingWorker worker() {
        return new ProductEmbeddingWorker(catalog, new CanonicalDocumentBuilder(catalog, objectMapper),
                new ContentChunker(props), embeddingClient, store, objectMapper, props);
    }

    @Test
    void generate_writesActiveChunkWithPayloadAndMarksProduct() throws Exception {
        worker().generateEmbedding(product.getId());

        List<ProductEmbedding> stored = store.getByProduct(product.getId());
        assertEquals(1, stored.size());
        ProductEmbedding e = stored.get(0);
        assertTrue(e.isActive());
        assertEquals(0, e.getChunkIndex());
        assertEquals(shopId, e.getShopId());
        assertEquals(product.getTenantId(), e.getTenantId());
        assertEquals("embeddinggemma", e.getEmbeddingModel());
        assertEquals(2, e.getEmbeddingVersion());
        assertEquals(CanonicalDocumentBuilder.CURRENT_SCHEMA_VERSION, e.getCanonicalDocumentVersion());
        assertTrue(e.getChunkText().startsWith("Product: Trail Runner"));

        ProductPayload payload = objectMapper.readValue(e.getPayloadJson(), ProductPayload.class);
        assertEquals("Trail Runner", payload.getName());
        assertEquals("Acme", payload.getShopName());
        assertEquals(0, new BigDecimal("89.50").compareTo(payload.getPrice()));
        assertTrue(payload.isInStock());

        assertTrue(product.isEmbeddingGenerated());
        assertNotNull(product.getCanonicalDocument());
        verify(catalog).saveEmbeddingState(product);
    }

    @Test
    void generateThenUnpublish_hidesProductFromSearch() {
        ProductEmbeddingWorker worker = worker();
        worker.generateEmbedding(product.getId());
        assertEquals(1, store.searchSimilar(VECTOR, 5, null, null, true).size());

        product.setPublished(false);
        worker.generateEmbedding(product.getId());

        assertTrue(store.searchSimilar(VECTOR, 5, null, null, true).isEmpty());
        assertFalse(store.getByProduct(product.getId()).get(0).isActive());
    }

    @Test
    void generate_skipsWhenDisabled() {
        props.setEnableEmbeddingGeneration(false);

        worker().generateEmbedding(product.getId());

        verifyNoInteractions(embeddingClient);
        assertTrue(store.getByProduct(product.getId()).isEmpty());
    }

    @Test
    void generate_skipsMissingProduct() {
        UUID missing = UUID.randomUUID();
        when(catalog.findProduct(missing, DataScope.platform())).thenReturn(Optional.empty());

        worker().generateEmbedding(missing);

        verifyNoInteractions(embeddingClient);
        verify(catalog, never()).saveEmbeddingState(any());
    }

    @Test
    void generate_upstreamFailurePropagatesAndLeavesProductUnmarked() {
        when(embeddingClient.generateEmbedding(anyString())).thenThrow(new UpstreamException("down"));

        assertThrows(UpstreamException.class, () -> worker().generateEmbedding(product.getId()));

        assertFalse(product.isEmbeddingGenerated());
        verify(catalog, never()).saveEmbeddingState(any());
        assertTrue(store.getByProduct(product.getId()).isEmpty());
    }

    @Test
    void generate_unpublishDuringEmbeddingLeavesChunksInactive() {
        when(embeddingClient.generateEmbedding(anyString())).thenAnswer(inv -> {
            // 商品模块在向量化期间下架了商品
            product.setPublished(false);
            return VECTOR;
        });

        worker().generateEmbedding(product.getId());

        List<ProductEmbedding> stored = store.getByProduct(product.getId());
        assertEquals(1, stored.size());
        assertFalse(stored.get(0).isActive());
        assertTrue(store.searchSimilar(VECTOR, 5, null, null, true).isEmpty());
        verify(catalog).saveEmbeddingState(product);
    }

    @Test
    void generate_productDeletedDuringEmbeddingDropsChunks() {
        when(catalog.saveEmbeddingState(any())).thenReturn(false);

        worker().generateEmbedding(product.getId());

        assertTrue(store.getByProduct(product.getId()).isEmpty());
    }

    @Test
    void generate_reusesFreshCachedDocument() {
        ProductEmbeddingWorker worker = worker();
        worker.generateEmbedding(product.getId());
        verify(catalog, times(1)).findShopName(shopId, DataScope.platform());

        worker.generateEmbedding(product.getId());

        verify(catalog, times(1)).findShopName(shopId, DataScope.platform());
    }

    @Test
    void generate_rebuildsCacheOlderThanProduct() {
        ProductEmbeddingWorker worker = worker();
        worker.generateEmbedding(product.getId());

        product.setDescription("Now with a wider toe box.");
        product.setUpdatedAt(Instant.now().plusSeconds(60));
        worker.generateEmbedding(product.getId());

        verify(catalog, times(2)).findShopName(shopId, DataScope.platform());
        assertTrue(store.getByProduct(product.getId()).get(0).getChunkText().contains("wider toe box"));
    }

    @Test
    void generate_removesChunksBeyondShorterDocument() {
        product.setDescription("Light and durable for long days outdoors. ".repeat(120));
        ProductEmbeddingWorker worker = worker();
        worker.generateEmbedding(product.getId());
        assertTrue(store.getByProduct(product.getId()).size() > 1);

        product.setDescription("Short.");
        product.setUpdatedAt(Instant.now().plusSeconds(60));
        worker.generateEmbedding(product.getId());

        List<ProductEmbedding> stored = store.getByProduct(product.getId());
        assertEquals(1, stored.size());
        assertTrue(stored.get(0).getChunkText().contains("Short."));
    }

    @Test
    void generate_reactivatesPreviouslyDeactivatedChunks() {
        ProductEmbeddingWorker worker = worker();
        worker.generateEmbedding(product.getId());
        worker.deactivateEmbeddings(product.getId());

        worker.generateEmbedding(product.getId());

        assertTrue(store.getByProduct(product.getId()).get(0).isActive());
    }

    @Test
    void activate_generatesWhenNoEmbeddingsExist() {
        worker().activateEmbeddings(product.getId());

        assertEquals(1, store.getByProduct(product.getId()).size());
        verify(embeddingClient).generateEmbedding(anyString());
    }

    @Test
    void activate_reenablesExistingChunksWithoutCallingBackend() {
        ProductEmbeddingWorker worker = worker();
        worker.generateEmbedding(product.getId());
        worker.deactivateEmbeddings(product.getId());
        clearInvocations(embeddingClient);

        worker.activateEmbeddings(product.getId());

        List<EmbeddingMatch> matches = store.searchSimilar(VECTOR, 5, null, null, true);
        assertEquals(1, matches.size());
        verify(embeddingClient, never()).generateEmbedding(anyString());
    }

    @Test
    void activate_keepsChunksInactiveWhileProductUnpublished() {
        ProductEmbeddingWorker worker = worker();
        worker.generateEmbedding(product.getId());
        worker.deactivateEmbeddings(product.getId());
        product.setPublished(false);

        worker.activateEmbeddings(product.getId());

        assertFalse(store.getByProduct(product.getId()).get(0).isActive());
    }

    @Test
    void delete_isIdempotent() {
        ProductEmbeddingWorker worker = worker();
        worker.generateEmbedding(product.getId());

        worker.deleteEmbeddings(product.getId());
        worker.deleteEmbeddings(product.getId());

        assertTrue(store.getByProduct(product.getId()).isEmpty());
    }
}
