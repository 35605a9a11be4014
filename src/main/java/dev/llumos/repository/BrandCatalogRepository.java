package dev.llumos.repository;

import dev.llumos.domain.entity.BrandCatalogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BrandCatalogRepository extends JpaRepository<BrandCatalogEntry, UUID> {
    List<BrandCatalogEntry> findByOrgId(UUID orgId);
}
