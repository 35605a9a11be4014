package dev.llumos.repository;

import dev.llumos.domain.entity.Prompt;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PromptRepository extends JpaRepository<Prompt, UUID> {
    List<Prompt> findByOrgIdAndActiveTrueOrderByCreatedAtAsc(UUID orgId, Pageable pageable);
    long countByOrgIdAndActiveTrue(UUID orgId);
}
