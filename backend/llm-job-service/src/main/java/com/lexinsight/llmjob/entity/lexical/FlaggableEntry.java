package com.lexinsight.llmjob.entity.lexical;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;

/**
 * Common moderation columns shared by every lexical table an LLM job can flag.
 */
@MappedSuperclass
@Getter
@Setter
public abstract class FlaggableEntry {

    @Id
    private Long id;

    @Column(name = "flagged")
    private Boolean flagged;

    @Column(name = "flagged_reason", columnDefinition = "TEXT")
    private String flaggedReason;

    /**
     * Apply a moderation verdict. The reason is cleared when the entry is not flagged.
     */
    public void applyVerdict(boolean flagged, String reason) {
        this.flagged = flagged;
        this.flaggedReason = flagged ? reason : null;
    }
}
