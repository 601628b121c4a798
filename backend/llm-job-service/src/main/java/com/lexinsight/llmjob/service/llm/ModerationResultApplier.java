package com.lexinsight.llmjob.service.llm;

import com.lexinsight.llmjob.dto.llm.FlaggingResponse;
import com.lexinsight.llmjob.dto.llm.ProviderTask;
import com.lexinsight.llmjob.entity.llm.EntityReference;
import com.lexinsight.llmjob.entity.llm.LlmJobItem;
import com.lexinsight.llmjob.repository.LlmJobItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Applies a parsed verdict: flags the target lexical entry and marks the item succeeded,
 * in one transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModerationResultApplier {

    static final String ENTRY_NOT_FOUND = "Entry not found when applying result";

    private final LexicalEntryFlagWriter flagWriter;
    private final LlmJobItemRepository itemRepository;

    public enum Outcome {
        APPLIED,
        ENTRY_MISSING,
        ALREADY_TERMINAL
    }

    @Transactional
    public Outcome apply(LlmJobItem item, String jobLabel, FlaggingResponse result, ProviderTask task) {
        EntityReference target = item.getEntityReference();
        LocalDateTime now = LocalDateTime.now();

        if (!flagWriter.exists(target)) {
            log.warn("Job item {} targets missing entry {}", item.getId(), target);
            int updated = itemRepository.markFailed(item.getId(), ENTRY_NOT_FOUND, task.rawJson(), now);
            return updated > 0 ? Outcome.ENTRY_MISSING : Outcome.ALREADY_TERMINAL;
        }

        // 항목 상태를 먼저 확정하고, 이미 종료된 항목이면 엔트리를 건드리지 않음
        int updated = itemRepository.markSucceeded(item.getId(), result.flagged(), task.rawJson(),
                task.inputTokens(), task.outputTokens(), now);
        if (updated == 0) {
            log.debug("Job item {} already terminal, verdict discarded", item.getId());
            return Outcome.ALREADY_TERMINAL;
        }

        flagWriter.write(target, result.flagged(), flaggedReason(jobLabel, result));
        return Outcome.APPLIED;
    }

    /**
     * "label: reason" when flagged, otherwise null
     */
    public static String flaggedReason(String jobLabel, FlaggingResponse result) {
        if (!result.flagged()) {
            return null;
        }
        String label = jobLabel != null ? jobLabel : "LLM";
        String reason = result.flaggedReason() != null ? result.flaggedReason() : "Flagged by AI";
        return label + ": " + reason;
    }
}
