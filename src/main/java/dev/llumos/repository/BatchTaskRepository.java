package dev.llumos.repository;

import dev.llumos.domain.entity.BatchTask;
import dev.llumos.domain.enums.TaskStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface BatchTaskRepository extends JpaRepository<BatchTask, UUID> {

    /** Ordered by prompt so that a slice keeps a prompt's providers together. */
    List<BatchTask> findByBatchJobIdAndStatusOrderByPromptIdAscProviderAsc(
            UUID batchJobId, TaskStatus status, Pageable pageable);

    List<BatchTask> findByBatchJobIdAndStatusInOrderByCompletedAtAsc(UUID batchJobId, Collection<TaskStatus> statuses);

    @Query("select t.status, count(t) from BatchTask t where t.batchJobId = :jobId group by t.status")
    List<Object[]> countGroupedByStatus(@Param("jobId") UUID jobId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BatchTask t
            set t.status = dev.llumos.domain.enums.TaskStatus.PROCESSING,
                t.attempts = t.attempts + 1,
                t.startedAt = :now
            where t.id = :id and t.status = dev.llumos.domain.enums.TaskStatus.PENDING
            """)
    int claim(@Param("id") UUID id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BatchTask t
            set t.status = dev.llumos.domain.enums.TaskStatus.PENDING, t.startedAt = null
            where t.id = :id and t.status = dev.llumos.domain.enums.TaskStatus.PROCESSING
            """)
    int release(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BatchTask t
            set t.status = :target, t.completedAt = :now, t.errorMessage = :error
            where t.id = :id and t.status = dev.llumos.domain.enums.TaskStatus.PROCESSING
            """)
    int finish(@Param("id") UUID id, @Param("target") TaskStatus target,
               @Param("error") String error, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BatchTask t
            set t.status = dev.llumos.domain.enums.TaskStatus.CANCELLED, t.completedAt = :now
            where t.batchJobId = :jobId
              and t.status in (dev.llumos.domain.enums.TaskStatus.PENDING,
                               dev.llumos.domain.enums.TaskStatus.PROCESSING)
            """)
    int cancelOpenTasks(@Param("jobId") UUID jobId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BatchTask t
            set t.status = dev.llumos.domain.enums.TaskStatus.PENDING, t.startedAt = null
            where t.batchJobId = :jobId
              and t.status = dev.llumos.domain.enums.TaskStatus.PROCESSING
              and (t.startedAt is null or t.startedAt < :olderThan)
            """)
    int resetStuck(@Param("jobId") UUID jobId, @Param("olderThan") Instant olderThan);
}
