package com.wshg.productsearch.store;

import com.wshg.productsearch.dto.EmbeddingStatistics;

import java.util.List;
import java.util.UUID;

/**
 * 商品向量库。流水线 Worker 是唯一写入方，检索服务只读。
 * 实现：内存/文件（InMemoryProductEmbeddingStore）、MySQL（JpaProductEmbeddingStore），
 * 由 product-search.vector-store-type 选择。
 */
public interface ProductEmbeddingStore {

    /**
     * 余弦相似度检索。先按租户/店铺/启用状态过滤再排序，距离升序，距离相同按存储顺序。
     *
     * @param tenantId   为 null 时不过滤
     * @param shopId     为 null 时不过滤
     * @param activeOnly 为 true 时排除已停用的向量
     */
    List<EmbeddingMatch> searchSimilar(float[] queryVector, int topK, UUID tenantId, UUID shopId, boolean activeOnly);

    /** 按 chunkIndex 升序 */
    List<ProductEmbedding> getByProduct(UUID productId);

    /** 删除商品的全部分块，幂等；返回删除条数 */
    int deleteByProduct(UUID productId);

    /**
     * 按 (productId, chunkIndex) 插入或原地更新（保留 id 与启用状态）。新插入的记录为启用状态。
     */
    ProductEmbedding upsert(ProductEmbedding embedding);

    /** 删除 chunkIndex >= fromChunkIndex 的分块（文档变短后清理多余分块） */
    int deleteChunksFrom(UUID productId, int fromChunkIndex);

    /** 向量版本低于当前模型版本的商品 ID（去重），最多 batchSize 个 */
    List<UUID> getProductsNeedingEmbedding(int currentModelVersion, int batchSize);

    /** 批量设置商品全部分块的启用状态，返回影响条数 */
    int setActive(UUID productId, boolean active);

    EmbeddingStatistics statistics(int currentModelVersion);
}
