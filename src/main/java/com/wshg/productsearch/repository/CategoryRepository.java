package com.wshg.productsearch.repository;

import com.wshg.productsearch.entity.Category;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

public interface CategoryRepository extends JpaRepository<Category, UUID> {

    Optional<Category> findByIdAndTenantId(UUID id, UUID tenantId);
}
