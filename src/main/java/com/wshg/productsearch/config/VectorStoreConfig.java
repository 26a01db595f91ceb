package com.wshg.productsearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wshg.productsearch.repository.ProductEmbeddingRepository;
import com.wshg.productsearch.store.InMemoryProductEmbeddingStore;
import com.wshg.productsearch.store.JpaProductEmbeddingStore;
import com.wshg.productsearch.store.ProductEmbeddingStore;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 按 product-search.vector-store-type 选择向量库实现：mysql（默认）/ file / memory。
 */
@Configuration
public class VectorStoreConfig {

    @Bean
    @ConditionalOnProperty(name = "product-search.vector-store-type", havingValue = "memory")
    public ProductEmbeddingStore memoryEmbeddingStore(ObjectMapper objectMapper) {
        return new InMemoryProductEmbeddingStore(objectMapper, null);
    }

    @Bean
    @ConditionalOnProperty(name = "product-search.vector-store-type", havingValue = "file")
    public ProductEmbeddingStore fileEmbeddingStore(ProductSearchProperties props, ObjectMapper objectMapper) {
        return new InMemoryProductEmbeddingStore(objectMapper, props.getVectorStoreFilePath());
    }

    @Bean
    @ConditionalOnProperty(name = "product-search.vector-store-type", havingValue = "mysql", matchIfMissing = true)
    public ProductEmbeddingStore mysqlEmbeddingStore(ProductEmbeddingRepository repository, ObjectMapper objectMapper) {
        return new JpaProductEmbeddingStore(repository, objectMapper);
    }
}
