package com.wshg.productsearch.repository;

import com.wshg.productsearch.entity.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProductRepository extends JpaRepository<Product, UUID> {

    Optional<Product> findByIdAndTenantId(UUID id, UUID tenantId);

    /** 已启用且已上架的商品 ID，tenantId / shopId 为空时不过滤 */
    @Query("select p.id from Product p where p.active = true and p.published = true "
            + "and (:tenantId is null or p.tenantId = :tenantId) "
            + "and (:shopId is null or p.shopId = :shopId) "
            + "order by p.createdAt")
    List<UUID> findEligibleIds(@Param("tenantId") UUID tenantId, @Param("shopId") UUID shopId);

    long countByActiveTrueAndPublishedTrueAndEmbeddingGeneratedFalse();

    /** 只更新流水线维护的列（规范文档缓存与向量生成标记），不覆盖商品模块的字段 */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update Product p set p.canonicalDocument = :document, "
            + "p.canonicalDocumentVersion = :documentVersion, "
            + "p.canonicalDocumentUpdatedAt = :documentUpdatedAt, "
            + "p.embeddingGenerated = :embeddingGenerated "
            + "where p.id = :id")
    int updateEmbeddingState(@Param("id") UUID id,
                             @Param("document") String document,
                             @Param("documentVersion") int documentVersion,
                             @Param("documentUpdatedAt") Instant documentUpdatedAt,
                             @Param("embeddingGenerated") boolean embeddingGenerated);
}
