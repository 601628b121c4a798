package com.lexinsight.llmjob.repository;

import com.lexinsight.llmjob.entity.llm.LlmJobItem;
import com.lexinsight.llmjob.entity.llm.LlmJobItemStatus;
import com.lexinsight.llmjob.entity.llm.LlmJobStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Work item store for the LLM job poller.
 *
 * Every status transition is a conditional UPDATE: item updates never touch rows that are already
 * terminal, and submission updates only touch rows still held by the caller's claim.
 * Each modifying query commits on its own.
 */
@Repository
public interface LlmJobItemRepository extends JpaRepository<LlmJobItem, Long> {

    // ========================================
    // Claim
    // ========================================

    @Query("SELECT i.id FROM LlmJobItem i JOIN i.job j " +
           "WHERE i.status = :itemStatus AND i.providerTaskId IS NULL " +
           "AND j.deleted = false AND j.status IN :jobStatuses " +
           "ORDER BY i.id ASC")
    List<Long> findClaimCandidateIds(
            @Param("itemStatus") LlmJobItemStatus itemStatus,
            @Param("jobStatuses") Collection<LlmJobStatus> jobStatuses,
            Pageable pageable);

    /**
     * Queued, unsubmitted items of live jobs, oldest first
     */
    default List<Long> findClaimCandidateIds(int limit) {
        return findClaimCandidateIds(LlmJobItemStatus.QUEUED, LlmJobStatus.ACTIVE, Pageable.ofSize(limit));
    }

    /**
     * Reserve items for submission. Only rows that are still queued and unsubmitted at update time
     * are claimed; the claim token identifies which rows this call won.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJobItem i SET i.status = :submitting, i.startedAt = :now, i.claimToken = :token " +
           "WHERE i.id IN :ids AND i.status = :queued AND i.providerTaskId IS NULL")
    int claim(@Param("ids") Collection<Long> ids,
              @Param("token") String token,
              @Param("now") LocalDateTime now,
              @Param("queued") LlmJobItemStatus queued,
              @Param("submitting") LlmJobItemStatus submitting);

    default int claim(Collection<Long> ids, String token, LocalDateTime now) {
        return claim(ids, token, now, LlmJobItemStatus.QUEUED, LlmJobItemStatus.SUBMITTING);
    }

    @Query("SELECT i FROM LlmJobItem i JOIN FETCH i.job " +
           "WHERE i.claimToken = :token AND i.status = :submitting ORDER BY i.id ASC")
    List<LlmJobItem> findClaimed(@Param("token") String token,
                                 @Param("submitting") LlmJobItemStatus submitting);

    default List<LlmJobItem> findClaimed(String token) {
        return findClaimed(token, LlmJobItemStatus.SUBMITTING);
    }

    // ========================================
    // Submission results
    // ========================================

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJobItem i SET i.status = :processing, i.providerTaskId = :taskId, " +
           "i.startedAt = :now, i.attemptCount = i.attemptCount + :attempts " +
           "WHERE i.id = :id AND i.status = :submitting AND i.claimToken = :token " +
           "AND i.providerTaskId IS NULL")
    int markSubmitted(@Param("id") Long id,
                      @Param("token") String token,
                      @Param("taskId") String taskId,
                      @Param("attempts") int attempts,
                      @Param("now") LocalDateTime now,
                      @Param("submitting") LlmJobItemStatus submitting,
                      @Param("processing") LlmJobItemStatus processing);

    default int markSubmitted(Long id, String token, String taskId, int attempts, LocalDateTime now) {
        return markSubmitted(id, token, taskId, attempts, now,
                LlmJobItemStatus.SUBMITTING, LlmJobItemStatus.PROCESSING);
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJobItem i SET i.status = :failed, i.lastError = :error, i.completedAt = :now, " +
           "i.attemptCount = i.attemptCount + :attempts " +
           "WHERE i.id = :id AND i.status = :submitting AND i.claimToken = :token")
    int markSubmissionFailed(@Param("id") Long id,
                             @Param("token") String token,
                             @Param("error") String error,
                             @Param("attempts") int attempts,
                             @Param("now") LocalDateTime now,
                             @Param("submitting") LlmJobItemStatus submitting,
                             @Param("failed") LlmJobItemStatus failed);

    default int markSubmissionFailed(Long id, String token, String error, int attempts, LocalDateTime now) {
        return markSubmissionFailed(id, token, error, attempts, now,
                LlmJobItemStatus.SUBMITTING, LlmJobItemStatus.FAILED);
    }

    // ========================================
    // Polling results
    // ========================================

    @Query("SELECT i FROM LlmJobItem i WHERE i.jobId = :jobId AND i.status NOT IN :terminal ORDER BY i.id ASC")
    List<LlmJobItem> findNonTerminalByJobId(@Param("jobId") Long jobId,
                                            @Param("terminal") Collection<LlmJobItemStatus> terminal,
                                            Pageable pageable);

    default List<LlmJobItem> findNonTerminalByJobId(Long jobId, int limit) {
        return findNonTerminalByJobId(jobId, LlmJobItemStatus.TERMINAL, Pageable.ofSize(limit));
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJobItem i SET i.status = :processing, i.responsePayload = :payload " +
           "WHERE i.id = :id AND i.status NOT IN :terminal")
    int markStillProcessing(@Param("id") Long id,
                            @Param("payload") String payload,
                            @Param("processing") LlmJobItemStatus processing,
                            @Param("terminal") Collection<LlmJobItemStatus> terminal);

    default int markStillProcessing(Long id, String payload) {
        return markStillProcessing(id, payload, LlmJobItemStatus.PROCESSING, LlmJobItemStatus.TERMINAL);
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJobItem i SET i.status = :failed, i.lastError = :error, " +
           "i.responsePayload = COALESCE(:payload, i.responsePayload), i.completedAt = :now " +
           "WHERE i.id = :id AND i.status NOT IN :terminal")
    int markFailed(@Param("id") Long id,
                   @Param("error") String error,
                   @Param("payload") String payload,
                   @Param("now") LocalDateTime now,
                   @Param("failed") LlmJobItemStatus failed,
                   @Param("terminal") Collection<LlmJobItemStatus> terminal);

    default int markFailed(Long id, String error, String payload, LocalDateTime now) {
        return markFailed(id, error, payload, now, LlmJobItemStatus.FAILED, LlmJobItemStatus.TERMINAL);
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJobItem i SET i.status = :succeeded, i.flagged = :flagged, i.responsePayload = :payload, " +
           "i.inputTokens = :inputTokens, i.outputTokens = :outputTokens, i.completedAt = :now " +
           "WHERE i.id = :id AND i.status NOT IN :terminal")
    int markSucceeded(@Param("id") Long id,
                      @Param("flagged") boolean flagged,
                      @Param("payload") String payload,
                      @Param("inputTokens") long inputTokens,
                      @Param("outputTokens") long outputTokens,
                      @Param("now") LocalDateTime now,
                      @Param("succeeded") LlmJobItemStatus succeeded,
                      @Param("terminal") Collection<LlmJobItemStatus> terminal);

    default int markSucceeded(Long id, boolean flagged, String payload, long inputTokens, long outputTokens,
                              LocalDateTime now) {
        return markSucceeded(id, flagged, payload, inputTokens, outputTokens, now,
                LlmJobItemStatus.SUCCEEDED, LlmJobItemStatus.TERMINAL);
    }

    /**
     * Record a failed poll without changing status; the item is retried on the next pass
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJobItem i SET i.lastError = :error, i.attemptCount = i.attemptCount + 1 " +
           "WHERE i.id = :id AND i.status NOT IN :terminal")
    int recordPollError(@Param("id") Long id,
                        @Param("error") String error,
                        @Param("terminal") Collection<LlmJobItemStatus> terminal);

    default int recordPollError(Long id, String error) {
        return recordPollError(id, error, LlmJobItemStatus.TERMINAL);
    }

    // ========================================
    // Sweeps
    // ========================================

    /**
     * Fail a job's items that have been queued or processing since before the cutoff
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJobItem i SET i.status = :failed, i.lastError = :error, i.completedAt = :now " +
           "WHERE i.jobId = :jobId AND i.status IN :statuses AND i.createdAt < :before")
    int failTimedOutItems(@Param("jobId") Long jobId,
                          @Param("statuses") Collection<LlmJobItemStatus> statuses,
                          @Param("before") LocalDateTime before,
                          @Param("error") String error,
                          @Param("now") LocalDateTime now,
                          @Param("failed") LlmJobItemStatus failed);

    default int failTimedOutItems(Long jobId, LocalDateTime before, String error, LocalDateTime now) {
        return failTimedOutItems(jobId, List.of(LlmJobItemStatus.QUEUED, LlmJobItemStatus.PROCESSING),
                before, error, now, LlmJobItemStatus.FAILED);
    }

    /**
     * Release claims left behind by an invocation that died mid-submission.
     * Items of soft-deleted jobs are left alone.
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJobItem i SET i.status = :queued, i.startedAt = NULL, i.claimToken = NULL " +
           "WHERE i.status = :submitting AND i.startedAt < :before " +
           "AND i.jobId IN (SELECT j.id FROM LlmJob j WHERE j.deleted = false)")
    int resetStuckSubmissions(@Param("before") LocalDateTime before,
                              @Param("submitting") LlmJobItemStatus submitting,
                              @Param("queued") LlmJobItemStatus queued);

    default int resetStuckSubmissions(LocalDateTime before) {
        return resetStuckSubmissions(before, LlmJobItemStatus.SUBMITTING, LlmJobItemStatus.QUEUED);
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJobItem i SET i.status = :failed, i.lastError = :error, i.completedAt = :now " +
           "WHERE i.jobId IN :jobIds AND i.status NOT IN :terminal")
    int failNonTerminalItems(@Param("jobIds") Collection<Long> jobIds,
                             @Param("error") String error,
                             @Param("now") LocalDateTime now,
                             @Param("failed") LlmJobItemStatus failed,
                             @Param("terminal") Collection<LlmJobItemStatus> terminal);

    default int failNonTerminalItems(Collection<Long> jobIds, String error, LocalDateTime now) {
        return failNonTerminalItems(jobIds, error, now, LlmJobItemStatus.FAILED, LlmJobItemStatus.TERMINAL);
    }

    // ========================================
    // Cancellation
    // ========================================

    @Query("SELECT i FROM LlmJobItem i WHERE i.jobId = :jobId AND i.status NOT IN :terminal " +
           "AND i.providerTaskId IS NOT NULL ORDER BY i.id ASC")
    List<LlmJobItem> findCancellableByJobId(@Param("jobId") Long jobId,
                                            @Param("terminal") Collection<LlmJobItemStatus> terminal);

    default List<LlmJobItem> findCancellableByJobId(Long jobId) {
        return findCancellableByJobId(jobId, LlmJobItemStatus.TERMINAL);
    }

    /**
     * Fail a job's items that were never submitted
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE LlmJobItem i SET i.status = :failed, i.lastError = :error, i.completedAt = :now " +
           "WHERE i.jobId = :jobId AND i.status = :queued AND i.providerTaskId IS NULL")
    int failUnsubmittedItems(@Param("jobId") Long jobId,
                             @Param("error") String error,
                             @Param("now") LocalDateTime now,
                             @Param("queued") LlmJobItemStatus queued,
                             @Param("failed") LlmJobItemStatus failed);

    default int failUnsubmittedItems(Long jobId, String error, LocalDateTime now) {
        return failUnsubmittedItems(jobId, error, now, LlmJobItemStatus.QUEUED, LlmJobItemStatus.FAILED);
    }

    // ========================================
    // Aggregates
    // ========================================

    /**
     * total, submitted, processed, succeeded, failed, flagged, input tokens, output tokens
     */
    @Query("SELECT COUNT(i), " +
           "SUM(CASE WHEN i.providerTaskId IS NOT NULL THEN 1 ELSE 0 END), " +
           "SUM(CASE WHEN i.status IN :terminal THEN 1 ELSE 0 END), " +
           "SUM(CASE WHEN i.status = :succeeded THEN 1 ELSE 0 END), " +
           "SUM(CASE WHEN i.status = :failed THEN 1 ELSE 0 END), " +
           "SUM(CASE WHEN i.flagged = true THEN 1 ELSE 0 END), " +
           "SUM(COALESCE(i.inputTokens, 0)), " +
           "SUM(COALESCE(i.outputTokens, 0)) " +
           "FROM LlmJobItem i WHERE i.jobId = :jobId")
    List<Object[]> aggregateByJobId(@Param("jobId") Long jobId,
                                    @Param("terminal") Collection<LlmJobItemStatus> terminal,
                                    @Param("succeeded") LlmJobItemStatus succeeded,
                                    @Param("failed") LlmJobItemStatus failed);

    default List<Object[]> aggregateByJobId(Long jobId) {
        return aggregateByJobId(jobId, LlmJobItemStatus.TERMINAL, LlmJobItemStatus.SUCCEEDED, LlmJobItemStatus.FAILED);
    }

    @Query("SELECT COUNT(i) FROM LlmJobItem i JOIN i.job j " +
           "WHERE i.status NOT IN :terminal AND j.deleted = false AND j.status IN :jobStatuses")
    long countPending(@Param("terminal") Collection<LlmJobItemStatus> terminal,
                      @Param("jobStatuses") Collection<LlmJobStatus> jobStatuses);

    /**
     * Non-terminal items of live, non-terminal jobs
     */
    default long countPending() {
        return countPending(LlmJobItemStatus.TERMINAL, LlmJobStatus.ACTIVE);
    }

    long countByJobIdAndStatus(Long jobId, LlmJobItemStatus status);
}
