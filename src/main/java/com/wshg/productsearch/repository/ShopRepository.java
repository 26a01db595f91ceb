package com.wshg.productsearch.repository;

import com.wshg.productsearch.entity.Shop;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface ShopRepository extends JpaRepository<Shop, UUID> {

    Optional<Shop> findByIdAndTenantId(UUID id, UUID tenantId);
}
