package dev.llumos.repository;

import dev.llumos.domain.entity.ResponseRecord;
import dev.llumos.domain.enums.LlmProvider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ResponseRecordRepository extends JpaRepository<ResponseRecord, UUID> {
    boolean existsByBatchJobIdAndPromptIdAndProvider(UUID batchJobId, UUID promptId, LlmProvider provider);
}
