package info.isaksson.erland.tonto.lang;

/** Semantic grouping of token types (used for statistics, highlighting and hint vocabularies). */
public enum TokenCategory {
    LANGUAGE_KEYWORD,
    CLASS_STEREOTYPE,
    RELATION_STEREOTYPE,
    DATA_TYPE,
    META_ATTRIBUTE,
    IDENTIFIER,
    LITERAL,
    DELIMITER,
    PUNCTUATION,
    RELATION_OPERATOR
}
