package dev.llumos.repository;

import dev.llumos.domain.entity.SchedulerRun;
import dev.llumos.domain.enums.SchedulerRunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SchedulerRunRepository extends JpaRepository<SchedulerRun, UUID> {
    boolean existsByFunctionNameAndRunKeyAndStatus(String functionName, String runKey, SchedulerRunStatus status);
    List<SchedulerRun> findTop10ByOrderByStartedAtDesc();
}
