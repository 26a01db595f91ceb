package com.wshg.productsearch.repository;

import com.wshg.productsearch.entity.ProductEmbeddingEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProductEmbeddingRepository extends JpaRepository<ProductEmbeddingEntity, Long> {

    Optional<ProductEmbeddingEntity> findByProductIdAndChunkIndex(UUID productId, int chunkIndex);

    List<ProductEmbeddingEntity> findByProductIdOrderByChunkIndexAsc(UUID productId);

    long deleteByProductId(UUID productId);

    long deleteByProductIdAndChunkIndexGreaterThanEqual(UUID productId, int chunkIndex);

    /** 检索候选集：先按状态/租户/店铺过滤，按存储顺序返回，排序在内存中完成 */
    @Query("select e from ProductEmbeddingEntity e "
            + "where (:activeOnly = false or e.active = true) "
            + "and (:tenantId is null or e.tenantId = :tenantId) "
            + "and (:shopId is null or e.shopId = :shopId) "
            + "order by e.id")
    List<ProductEmbeddingEntity> findCandidates(@Param("tenantId") UUID tenantId,
                                                @Param("shopId") UUID shopId,
                                                @Param("activeOnly") boolean activeOnly);

    @Query("select distinct e.productId from ProductEmbeddingEntity e where e.embeddingVersion < :version")
    List<UUID> findProductIdsWithVersionBelow(@Param("version") int version, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ProductEmbeddingEntity e set e.active = :active where e.productId = :productId")
    int updateActiveByProductId(@Param("productId") UUID productId, @Param("active") boolean active);

    long countByActiveTrue();

    long countByEmbeddingVersionLessThan(int version);

    @Query("select count(distinct e.productId) from ProductEmbeddingEntity e")
    long countDistinctProducts();

    @Query("select e.embeddingModel, count(e) from ProductEmbeddingEntity e group by e.embeddingModel")
    List<Object[]> countGroupByModel();

    @Query("select e.embeddingVersion, count(e) from ProductEmbeddingEntity e group by e.embeddingVersion")
    List<Object[]> countGroupByVersion();
}
