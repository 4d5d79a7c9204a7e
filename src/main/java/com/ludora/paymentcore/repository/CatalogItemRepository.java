package com.ludora.paymentcore.repository;

import com.ludora.paymentcore.entity.CatalogItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CatalogItemRepository extends JpaRepository<CatalogItem, Long> {

    Optional<CatalogItem> findByEntityTypeAndEntityId(String entityType, String entityId);
}
