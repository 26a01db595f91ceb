package com.wshg.productsearch.catalog;

import com.wshg.productsearch.entity.Category;
import com.wshg.productsearch.entity.Product;
import com.wshg.productsearch.entity.ProductAttributeDefinition;
import com.wshg.productsearch.entity.Shop;
import com.wshg.productsearch.repository.CategoryRepository;
import com.wshg.productsearch.repository.ProductAttributeDefinitionRepository;
import com.wshg.productsearch.repository.ProductRepository;
import com.wshg.productsearch.repository.ShopRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 商品目录读写入口：商品、分类、店铺、属性定义。每次读取都显式指定 {@link DataScope}。
 * 流水线只写回自己维护的列，见 {@link #saveEmbeddingState(Product)}。
 */
@Service
@RequiredArgsConstructor
public class ProductCatalog {

    private final ProductRepository productRepository;
    private final CategoryRepository categoryRepository;
    private final ShopRepository shopRepository;
    private final ProductAttributeDefinitionRepository attributeDefinitionRepository;

    @Transactional(readOnly = true)
    public Optional<Product> findProduct(UUID productId, DataScope scope) {
        if (productId == null) return Optional.empty();
        return scope.isPlatform()
                ? productRepository.findById(productId)
                : productRepository.findByIdAndTenantId(productId, scope.getTenantId());
    }

    @Transactional(readOnly = true)
    public Optional<String> findCategoryName(UUID categoryId, DataScope scope) {
        if (categoryId == null) return Optional.empty();
        Optional<Category> category = scope.isPlatform()
                ? categoryRepository.findById(categoryId)
                : categoryRepository.findByIdAndTenantId(categoryId, scope.getTenantId());
        return category.map(Category::getName);
    }

    @Transactional(readOnly = true)
    public Optional<String> findShopName(UUID shopId, DataScope scope) {
        if (shopId == null) return Optional.empty();
        Optional<Shop> shop = scope.isPlatform()
                ? shopRepository.findById(shopId)
                : shopRepository.findByIdAndTenantId(shopId, scope.getTenantId());
        return shop.map(Shop::getName);
    }

    @Transactional(readOnly = true)
    public List<ProductAttributeDefinition> findAttributeDefinitions(UUID shopId, DataScope scope) {
        if (shopId == null) return List.of();
        return scope.isPlatform()
                ? attributeDefinitionRepository.findByShopId(shopId)
                : attributeDefinitionRepository.findByShopIdAndTenantId(shopId, scope.getTenantId());
    }

    /** 已启用且已上架的商品 ID（平台范围），tenantId / shopId 为可选过滤条件 */
    @Transactional(readOnly = true)
    public List<UUID> findEligibleProductIds(UUID tenantId, UUID shopId) {
        return productRepository.findEligibleIds(tenantId, shopId);
    }

    @Transactional(readOnly = true)
    public long countProductsNeedingEmbedding() {
        return productRepository.countByActiveTrueAndPublishedTrueAndEmbeddingGeneratedFalse();
    }

    /**
     * 回写规范文档缓存与向量生成标记。只更新这几列，流水线运行期间商品模块对其他字段的修改不会被覆盖。
     *
     * @return 商品已被删除时返回 false
     */
    @Transactional
    public boolean saveEmbeddingState(Product product) {
        return productRepository.updateEmbeddingState(product.getId(),
                product.getCanonicalDocument(),
                product.getCanonicalDocumentVersion(),
                product.getCanonicalDocumentUpdatedAt(),
                product.isEmbeddingGenerated()) > 0;
    }
}
