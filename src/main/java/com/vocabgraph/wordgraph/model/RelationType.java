package com.vocabgraph.wordgraph.model;

/**
 * Semantic link kinds between two words, grouped by {@link RelationCategory}.
 */
public enum RelationType {
    SYNONYM(RelationCategory.SEMANTIC),
    ANTONYM(RelationCategory.SEMANTIC),
    HYPERNYM(RelationCategory.SEMANTIC),
    HYPONYM(RelationCategory.SEMANTIC),
    HOLONYM(RelationCategory.SEMANTIC),
    MERONYM(RelationCategory.SEMANTIC),
    HOMOPHONE(RelationCategory.FORMAL),
    HOMONYM(RelationCategory.FORMAL),
    HOMOGLYPH(RelationCategory.FORMAL),
    PARONYM(RelationCategory.FORMAL),
    DERIVATION(RelationCategory.MORPHOLOGICAL),
    VARIANT(RelationCategory.MORPHOLOGICAL),
    ABBREVIATION(RelationCategory.MORPHOLOGICAL),
    PLURAL(RelationCategory.MORPHOLOGICAL),
    PAST_TENSE(RelationCategory.MORPHOLOGICAL),
    RELATED(RelationCategory.ASSOCIATIVE),
    CUSTOM(RelationCategory.ASSOCIATIVE);

    private final RelationCategory category;

    RelationType(RelationCategory category) {
        this.category = category;
    }

    public RelationCategory getCategory() {
        return category;
    }
}
