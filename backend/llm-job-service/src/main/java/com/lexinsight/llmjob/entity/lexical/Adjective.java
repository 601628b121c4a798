package com.lexinsight.llmjob.entity.lexical;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "adjectives")
@Getter
@Setter
@NoArgsConstructor
public class Adjective extends FlaggableEntry {

    @Column(nullable = false, unique = true, length = 128)
    private String code;

    @Column(columnDefinition = "TEXT")
    private String gloss;
}
