package com.lexinsight.llmjob.entity.lexical;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Semantic frame. Frames are keyed by name rather than by a lexical code.
 */
@Entity
@Table(name = "frames")
@Getter
@Setter
@NoArgsConstructor
public class Frame extends FlaggableEntry {

    @Column(name = "frame_name", nullable = false, length = 256)
    private String frameName;

    @Column(columnDefinition = "TEXT")
    private String definition;
}
