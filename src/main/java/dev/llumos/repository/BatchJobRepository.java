package dev.llumos.repository;

import dev.llumos.domain.entity.BatchJob;
import dev.llumos.domain.enums.JobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every write after creation is a guarded single-statement update. The return value is the
 * number of rows changed, so callers can tell whether they won the race.
 */
@Repository
public interface BatchJobRepository extends JpaRepository<BatchJob, UUID> {

    Optional<BatchJob> findFirstByOrgIdAndStatusInOrderByCreatedAtDesc(UUID orgId, Collection<JobStatus> statuses);

    Optional<BatchJob> findFirstByOrgIdAndStatusNotAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
            UUID orgId, JobStatus excluded, Instant since);

    List<BatchJob> findByOrgIdOrderByCreatedAtDesc(UUID orgId, Pageable pageable);

    List<BatchJob> findByOrgIdAndStatusIn(UUID orgId, Collection<JobStatus> statuses);

    @Query("select j.orgId from BatchJob j where j.id = :id")
    Optional<UUID> findOrgIdById(@Param("id") UUID id);

    @Query("""
            select j from BatchJob j
            where j.status in :statuses and coalesce(j.lastHeartbeat, j.createdAt) < :before
            order by coalesce(j.lastHeartbeat, j.createdAt) asc
            """)
    List<BatchJob> findStale(@Param("statuses") Collection<JobStatus> statuses, @Param("before") Instant before);

    @Query("select j.status, count(j) from BatchJob j group by j.status")
    List<Object[]> countGroupedByStatus();

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BatchJob j
            set j.completedTasks = j.completedTasks + :completed,
                j.failedTasks = j.failedTasks + :failed,
                j.lastHeartbeat = :now
            where j.id = :id
              and j.completedTasks + j.failedTasks + :completed + :failed <= j.totalTasks
            """)
    int incrementCounters(@Param("id") UUID id, @Param("completed") int completed,
                          @Param("failed") int failed, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
            update batch_jobs j
            set completed_tasks = (select count(*) from batch_tasks t
                                   where t.batch_job_id = j.id and t.status = 'COMPLETED'),
                failed_tasks = (select count(*) from batch_tasks t
                                where t.batch_job_id = j.id and t.status = 'FAILED')
            where j.id = :id
            """, nativeQuery = true)
    int syncCountersFromTasks(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BatchJob j
            set j.status = dev.llumos.domain.enums.JobStatus.PROCESSING,
                j.startedAt = coalesce(j.startedAt, :now),
                j.lastHeartbeat = :now
            where j.id = :id and j.status in :sources
            """)
    int markStarted(@Param("id") UUID id, @Param("sources") Collection<JobStatus> sources, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BatchJob j
            set j.status = :target, j.completedAt = :now, j.lastHeartbeat = :now
            where j.id = :id and j.status in :sources
            """)
    int markFinished(@Param("id") UUID id, @Param("target") JobStatus target,
                     @Param("sources") Collection<JobStatus> sources, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BatchJob j set j.cancellationRequested = true
            where j.id = :id and j.status in :active
            """)
    int requestCancellation(@Param("id") UUID id, @Param("active") Collection<JobStatus> active);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BatchJob j set j.lastHeartbeat = :now, j.runnerId = :runner
            where j.id = :id and j.status in :active
            """)
    int heartbeat(@Param("id") UUID id, @Param("runner") String runner,
                  @Param("active") Collection<JobStatus> active, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BatchJob j set j.lastHeartbeat = :now, j.runnerId = :runner
            where j.id = :id and j.status in :active and j.lastHeartbeat = :observed
            """)
    int takeOver(@Param("id") UUID id, @Param("observed") Instant observed, @Param("runner") String runner,
                 @Param("active") Collection<JobStatus> active, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update BatchJob j set j.lastHeartbeat = :now, j.runnerId = :runner
            where j.id = :id and j.status in :active and j.lastHeartbeat is null
            """)
    int takeOverNeverBeaten(@Param("id") UUID id, @Param("runner") String runner,
                            @Param("active") Collection<JobStatus> active, @Param("now") Instant now);
}
