package com.lexinsight.llmjob.entity.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reference from a job item to the single lexical entry its result is written to.
 *
 * <p>Built from the five nullable foreign key columns of an item; construction fails unless
 * exactly one of them is populated, so consumers can switch on {@link #kind()} without a
 * "nothing matched" branch.
 */
public record EntityReference(LexicalEntityKind kind, long id) {

    public EntityReference {
        Objects.requireNonNull(kind, "kind");
    }

    public static EntityReference of(Long verbId, Long nounId, Long adjectiveId, Long adverbId, Long frameId) {
        List<EntityReference> populated = new ArrayList<>(1);
        addIfPresent(populated, LexicalEntityKind.VERB, verbId);
        addIfPresent(populated, LexicalEntityKind.NOUN, nounId);
        addIfPresent(populated, LexicalEntityKind.ADJECTIVE, adjectiveId);
        addIfPresent(populated, LexicalEntityKind.ADVERB, adverbId);
        addIfPresent(populated, LexicalEntityKind.FRAME, frameId);

        if (populated.size() != 1) {
            throw new IllegalArgumentException(
                    "Exactly one entity reference must be populated, found " + populated.size());
        }
        return populated.get(0);
    }

    private static void addIfPresent(List<EntityReference> populated, LexicalEntityKind kind, Long id) {
        if (id != null) {
            populated.add(new EntityReference(kind, id));
        }
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + id;
    }
}
