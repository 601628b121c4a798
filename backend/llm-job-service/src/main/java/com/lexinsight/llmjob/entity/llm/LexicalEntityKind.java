package com.lexinsight.llmjob.entity.llm;

import com.lexinsight.llmjob.entity.lexical.Adjective;
import com.lexinsight.llmjob.entity.lexical.Adverb;
import com.lexinsight.llmjob.entity.lexical.FlaggableEntry;
import com.lexinsight.llmjob.entity.lexical.Frame;
import com.lexinsight.llmjob.entity.lexical.Noun;
import com.lexinsight.llmjob.entity.lexical.Verb;

/**
 * Kinds of lexical entries a job item can target.
 * Each kind corresponds to one nullable foreign key column on llm_job_items.
 */
public enum LexicalEntityKind {
    VERB,
    NOUN,
    ADJECTIVE,
    ADVERB,
    FRAME;

    public Class<? extends FlaggableEntry> getEntityClass() {
        return switch (this) {
            case VERB -> Verb.class;
            case NOUN -> Noun.class;
            case ADJECTIVE -> Adjective.class;
            case ADVERB -> Adverb.class;
            case FRAME -> Frame.class;
        };
    }
}
