package com.lexinsight.llmjob.service.llm;

import com.lexinsight.llmjob.entity.lexical.FlaggableEntry;
import com.lexinsight.llmjob.entity.llm.EntityReference;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes moderation verdicts onto lexical entries (verbs, nouns, adjectives, adverbs, frames).
 */
@Component
@Slf4j
public class LexicalEntryFlagWriter {

    @PersistenceContext
    private EntityManager entityManager;

    public boolean exists(EntityReference target) {
        return entityManager.find(target.kind().getEntityClass(), target.id()) != null;
    }

    /**
     * @return false when the entry no longer exists
     */
    @Transactional
    public boolean write(EntityReference target, boolean flagged, String reason) {
        FlaggableEntry entry = entityManager.find(target.kind().getEntityClass(), target.id());
        if (entry == null) {
            log.warn("Lexical entry {} not found, verdict not applied", target);
            return false;
        }
        entry.applyVerdict(flagged, reason);
        // bulk item updates later in the transaction clear the persistence context
        entityManager.flush();
        return true;
    }
}
