package com.lexinsight.llmjob.repository;

import com.lexinsight.llmjob.entity.llm.LlmJob;
import com.lexinsight.llmjob.entity.llm.LlmJobItemStatus;
import com.lexinsight.llmjob.entity.llm.LlmJobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface LlmJobRepository extends JpaRepository<LlmJob, Long> {

    Optional<LlmJob> findByIdAndDeletedFalse(Long id);

    /**
     * Live jobs that still have work, oldest first
     */
    @Query("SELECT j FROM LlmJob j WHERE j.deleted = false AND j.status IN :statuses ORDER BY j.createdAt ASC, j.id ASC")
    List<LlmJob> findActiveJobs(@Param("statuses") Collection<LlmJobStatus> statuses);

    default List<LlmJob> findActiveJobs() {
        return findActiveJobs(LlmJobStatus.ACTIVE);
    }

    @Query("SELECT j.id FROM LlmJob j WHERE j.deleted = false AND j.status IN :statuses AND j.createdAt < :before")
    List<Long> findStuckJobIds(@Param("statuses") Collection<LlmJobStatus> statuses,
                               @Param("before") LocalDateTime before);

    default List<Long> findStuckJobIds(LocalDateTime before) {
        return findStuckJobIds(LlmJobStatus.ACTIVE, before);
    }

    /**
     * Cancelled jobs that still have non-terminal items out at the provider
     */
    @Query("SELECT j FROM LlmJob j WHERE j.deleted = false AND j.status = :cancelled AND EXISTS (" +
           "SELECT i.id FROM LlmJobItem i WHERE i.jobId = j.id AND i.status NOT IN :terminal) " +
           "ORDER BY j.id ASC")
    List<LlmJob> findCancelledWithPendingItems(@Param("cancelled") LlmJobStatus cancelled,
                                               @Param("terminal") Collection<LlmJobItemStatus> terminal);

    default List<LlmJob> findCancelledWithPendingItems() {
        return findCancelledWithPendingItems(LlmJobStatus.CANCELLED, LlmJobItemStatus.TERMINAL);
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJob j SET j.status = :failed, j.completedAt = :now " +
           "WHERE j.id IN :ids AND j.status IN :statuses")
    int failJobs(@Param("ids") Collection<Long> ids,
                 @Param("now") LocalDateTime now,
                 @Param("failed") LlmJobStatus failed,
                 @Param("statuses") Collection<LlmJobStatus> statuses);

    default int failJobs(Collection<Long> ids, LocalDateTime now) {
        return failJobs(ids, now, LlmJobStatus.FAILED, LlmJobStatus.ACTIVE);
    }

    /**
     * queued -> running on claim or aggregation. A running job without a start time gets one; an existing one is kept.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJob j SET j.status = :running, j.startedAt = COALESCE(j.startedAt, :now) " +
           "WHERE j.id IN :ids AND j.status IN :statuses")
    int markRunning(@Param("ids") Collection<Long> ids,
                    @Param("now") LocalDateTime now,
                    @Param("running") LlmJobStatus running,
                    @Param("statuses") Collection<LlmJobStatus> statuses);

    default int markRunning(Collection<Long> ids, LocalDateTime now) {
        return markRunning(ids, now, LlmJobStatus.RUNNING, LlmJobStatus.ACTIVE);
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJob j SET j.submittedItems = j.submittedItems + :count WHERE j.id = :id")
    int incrementSubmitted(@Param("id") Long id, @Param("count") int count);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJob j SET j.totalItems = :total, j.submittedItems = :submitted, " +
           "j.processedItems = :processed, j.succeededItems = :succeeded, j.failedItems = :failed, " +
           "j.flaggedItems = :flagged, j.inputTokens = :inputTokens, j.outputTokens = :outputTokens, " +
           "j.costMicrounits = :cost WHERE j.id = :id")
    int updateCounters(@Param("id") Long id,
                       @Param("total") int total,
                       @Param("submitted") int submitted,
                       @Param("processed") int processed,
                       @Param("succeeded") int succeeded,
                       @Param("failed") int failed,
                       @Param("flagged") int flagged,
                       @Param("inputTokens") long inputTokens,
                       @Param("outputTokens") long outputTokens,
                       @Param("cost") Long cost);

    /**
     * Write a derived completed/failed status onto a job that is still queued or running.
     * Resolved jobs, cancelled ones included, are never rewritten.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJob j SET j.status = :status, j.completedAt = COALESCE(j.completedAt, :now) " +
           "WHERE j.id = :id AND j.status IN :statuses")
    int markResolved(@Param("id") Long id,
                     @Param("status") LlmJobStatus status,
                     @Param("now") LocalDateTime now,
                     @Param("statuses") Collection<LlmJobStatus> statuses);

    default int markResolved(Long id, LlmJobStatus status, LocalDateTime now) {
        return markResolved(id, status, now, LlmJobStatus.ACTIVE);
    }

    /**
     * Request cancellation of a job that has not finished yet
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJob j SET j.status = :cancelled, j.completedAt = :now " +
           "WHERE j.id = :id AND j.deleted = false AND j.status IN :statuses")
    int cancel(@Param("id") Long id,
               @Param("now") LocalDateTime now,
               @Param("cancelled") LlmJobStatus cancelled,
               @Param("statuses") Collection<LlmJobStatus> statuses);

    default int cancel(Long id, LocalDateTime now) {
        return cancel(id, now, LlmJobStatus.CANCELLED, LlmJobStatus.ACTIVE);
    }
}
