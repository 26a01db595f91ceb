package com.wshg.productsearch.repository;

import com.wshg.productsearch.entity.ProductAttributeDefinition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ProductAttributeDefinitionRepository extends JpaRepository<ProductAttributeDefinition, UUID> {

    List<ProductAttributeDefinition> findByShopId(UUID shopId);

    List<ProductAttributeDefinition> findByShopIdAndTenantId(UUID shopId, UUID tenantId);
}
