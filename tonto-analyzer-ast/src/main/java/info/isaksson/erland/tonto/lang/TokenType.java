package info.isaksson.erland.tonto.lang;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Token types of the Tonto language.
 *
 * <p>Reserved words carry their exact source spelling; identifier families, literals and
 * operators are recognized by the lexer's matcher table instead.</p>
 */
public enum TokenType {

    // Language keywords
    KEYWORD_CATEGORIZER(TokenCategory.LANGUAGE_KEYWORD, "categorizer"),
    KEYWORD_ENUM(TokenCategory.LANGUAGE_KEYWORD, "enum"),
    KEYWORD_DATATYPE(TokenCategory.LANGUAGE_KEYWORD, "datatype"),
    KEYWORD_GENSET(TokenCategory.LANGUAGE_KEYWORD, "genset"),
    KEYWORD_DISJOINT(TokenCategory.LANGUAGE_KEYWORD, "disjoint"),
    KEYWORD_COMPLETE(TokenCategory.LANGUAGE_KEYWORD, "complete"),
    KEYWORD_GENERAL(TokenCategory.LANGUAGE_KEYWORD, "general"),
    KEYWORD_SPECIFICS(TokenCategory.LANGUAGE_KEYWORD, "specifics"),
    KEYWORD_WHERE(TokenCategory.LANGUAGE_KEYWORD, "where"),
    KEYWORD_PACKAGE(TokenCategory.LANGUAGE_KEYWORD, "package"),
    KEYWORD_IMPORT(TokenCategory.LANGUAGE_KEYWORD, "import"),
    KEYWORD_FUNCTIONAL_COMPLEXES(TokenCategory.LANGUAGE_KEYWORD, "functional-complexes"),
    KEYWORD_INTRINSIC_MODES(TokenCategory.LANGUAGE_KEYWORD, "intrinsic-modes"),
    KEYWORD_EXTRINSIC_MODES(TokenCategory.LANGUAGE_KEYWORD, "extrinsic-modes"),
    KEYWORD_ABSTRACT_INDIVIDUALS(TokenCategory.LANGUAGE_KEYWORD, "abstract-individuals"),
    KEYWORD_SPECIALIZES(TokenCategory.LANGUAGE_KEYWORD, "specializes"),
    KEYWORD_RELATOR(TokenCategory.LANGUAGE_KEYWORD, "relator"),
    KEYWORD_RELATORS(TokenCategory.LANGUAGE_KEYWORD, "relators"),
    KEYWORD_RELATION(TokenCategory.LANGUAGE_KEYWORD, "relation"),
    KEYWORD_INVERSEOF(TokenCategory.LANGUAGE_KEYWORD, "inverseOf"),

    // OntoUML class stereotypes
    CLASS_EVENT(TokenCategory.CLASS_STEREOTYPE, "event"),
    CLASS_SITUATION(TokenCategory.CLASS_STEREOTYPE, "situation"),
    CLASS_PROCESS(TokenCategory.CLASS_STEREOTYPE, "process"),
    CLASS_CATEGORY(TokenCategory.CLASS_STEREOTYPE, "category"),
    CLASS_MIXIN(TokenCategory.CLASS_STEREOTYPE, "mixin"),
    CLASS_PHASEMIXIN(TokenCategory.CLASS_STEREOTYPE, "phaseMixin"),
    CLASS_ROLEMIXIN(TokenCategory.CLASS_STEREOTYPE, "roleMixin"),
    CLASS_HISTORICALROLEMIXIN(TokenCategory.CLASS_STEREOTYPE, "historicalRoleMixin"),
    CLASS_KIND(TokenCategory.CLASS_STEREOTYPE, "kind"),
    CLASS_COLLECTIVE(TokenCategory.CLASS_STEREOTYPE, "collective"),
    CLASS_QUANTITY(TokenCategory.CLASS_STEREOTYPE, "quantity"),
    CLASS_QUALITY(TokenCategory.CLASS_STEREOTYPE, "quality"),
    CLASS_MODE(TokenCategory.CLASS_STEREOTYPE, "mode"),
    CLASS_INTRINSICMODE(TokenCategory.CLASS_STEREOTYPE, "intrinsicMode"),
    CLASS_EXTRINSICMODE(TokenCategory.CLASS_STEREOTYPE, "extrinsicMode"),
    CLASS_SUBKIND(TokenCategory.CLASS_STEREOTYPE, "subkind"),
    CLASS_PHASE(TokenCategory.CLASS_STEREOTYPE, "phase"),
    CLASS_ROLE(TokenCategory.CLASS_STEREOTYPE, "role"),
    CLASS_HISTORICALROLE(TokenCategory.CLASS_STEREOTYPE, "historicalRole"),

    // OntoUML relation stereotypes
    RELATION_MATERIAL(TokenCategory.RELATION_STEREOTYPE, "material"),
    RELATION_DERIVATION(TokenCategory.RELATION_STEREOTYPE, "derivation"),
    RELATION_COMPARATIVE(TokenCategory.RELATION_STEREOTYPE, "comparative"),
    RELATION_MEDIATION(TokenCategory.RELATION_STEREOTYPE, "mediation"),
    RELATION_CHARACTERIZATION(TokenCategory.RELATION_STEREOTYPE, "characterization"),
    RELATION_EXTERNALDEPENDENCE(TokenCategory.RELATION_STEREOTYPE, "externalDependence"),
    RELATION_COMPONENTOF(TokenCategory.RELATION_STEREOTYPE, "componentOf"),
    RELATION_MEMBEROF(TokenCategory.RELATION_STEREOTYPE, "memberOf"),
    RELATION_SUBCOLLECTIONOF(TokenCategory.RELATION_STEREOTYPE, "subCollectionOf"),
    RELATION_SUBQUALITYOF(TokenCategory.RELATION_STEREOTYPE, "subQualityOf"),
    RELATION_INSTANTIATION(TokenCategory.RELATION_STEREOTYPE, "instantiation"),
    RELATION_TERMINATION(TokenCategory.RELATION_STEREOTYPE, "termination"),
    RELATION_PARTICIPATIONAL(TokenCategory.RELATION_STEREOTYPE, "participational"),
    RELATION_PARTICIPATION(TokenCategory.RELATION_STEREOTYPE, "participation"),
    RELATION_HISTORICALDEPENDENCE(TokenCategory.RELATION_STEREOTYPE, "historicalDependence"),
    RELATION_CREATION(TokenCategory.RELATION_STEREOTYPE, "creation"),
    RELATION_MANIFESTATION(TokenCategory.RELATION_STEREOTYPE, "manifestation"),
    RELATION_BRINGSABOUT(TokenCategory.RELATION_STEREOTYPE, "bringsAbout"),
    RELATION_TRIGGERS(TokenCategory.RELATION_STEREOTYPE, "triggers"),
    RELATION_COMPOSITION(TokenCategory.RELATION_STEREOTYPE, "composition"),
    RELATION_AGGREGATION(TokenCategory.RELATION_STEREOTYPE, "aggregation"),
    RELATION_INHERENCE(TokenCategory.RELATION_STEREOTYPE, "inherence"),
    RELATION_VALUE(TokenCategory.RELATION_STEREOTYPE, "value"),
    RELATION_FORMAL(TokenCategory.RELATION_STEREOTYPE, "formal"),
    RELATION_CONSTITUTION(TokenCategory.RELATION_STEREOTYPE, "constitution"),

    // Primitive data types
    TYPE_NUMBER(TokenCategory.DATA_TYPE, "Number"),
    TYPE_STRING(TokenCategory.DATA_TYPE, "String"),
    TYPE_BOOLEAN(TokenCategory.DATA_TYPE, "Boolean"),
    TYPE_DATE(TokenCategory.DATA_TYPE, "Date"),
    TYPE_TIME(TokenCategory.DATA_TYPE, "Time"),
    TYPE_DATETIME(TokenCategory.DATA_TYPE, "Datetime"),

    // Meta attributes
    META_ORDERED(TokenCategory.META_ATTRIBUTE, "ordered"),
    META_CONST(TokenCategory.META_ATTRIBUTE, "const"),
    META_DERIVED(TokenCategory.META_ATTRIBUTE, "derived"),
    META_SUBSETS(TokenCategory.META_ATTRIBUTE, "subsets"),
    META_REDEFINES(TokenCategory.META_ATTRIBUTE, "redefines"),

    // Identifier families (classified by naming convention)
    CLASS_NAME(TokenCategory.IDENTIFIER, null),
    RELATION_NAME(TokenCategory.IDENTIFIER, null),
    INSTANCE_NAME(TokenCategory.IDENTIFIER, null),
    NEW_DATATYPE(TokenCategory.IDENTIFIER, null),
    IDENTIFIER(TokenCategory.IDENTIFIER, null),

    // Literals
    STRING(TokenCategory.LITERAL, null),
    NUMBER(TokenCategory.LITERAL, null),

    // Relation operators
    CARDINALITY(TokenCategory.RELATION_OPERATOR, ".."),
    ASSOCIATION(TokenCategory.RELATION_OPERATOR, "--"),
    ASSOCIATIONL(TokenCategory.RELATION_OPERATOR, "<--"),
    ASSOCIATIONR(TokenCategory.RELATION_OPERATOR, "-->"),
    ASSOCIATIONLR(TokenCategory.RELATION_OPERATOR, "<-->"),
    AGGREGATIONL(TokenCategory.RELATION_OPERATOR, "<>--"),
    AGGREGATIONR(TokenCategory.RELATION_OPERATOR, "--<>"),
    COMPOSITIONL(TokenCategory.RELATION_OPERATOR, "<o>--"),
    COMPOSITIONR(TokenCategory.RELATION_OPERATOR, "--<o>"),

    // Delimiters
    LBRACE(TokenCategory.DELIMITER, "{"),
    RBRACE(TokenCategory.DELIMITER, "}"),
    LPAREN(TokenCategory.DELIMITER, "("),
    RPAREN(TokenCategory.DELIMITER, ")"),
    LBRACKET(TokenCategory.DELIMITER, "["),
    RBRACKET(TokenCategory.DELIMITER, "]"),

    // Punctuation
    ASTERISK(TokenCategory.PUNCTUATION, "*"),
    AT(TokenCategory.PUNCTUATION, "@"),
    COLON(TokenCategory.PUNCTUATION, ":"),
    COMMA(TokenCategory.PUNCTUATION, ","),
    LT(TokenCategory.PUNCTUATION, "<"),
    GT(TokenCategory.PUNCTUATION, ">");

    private static final Map<String, TokenType> RESERVED = buildReserved();

    private final TokenCategory category;
    private final String spelling;

    TokenType(TokenCategory category, String spelling) {
        this.category = category;
        this.spelling = spelling;
    }

    public TokenCategory category() {
        return category;
    }

    /** Exact source text for reserved words, operators and punctuation; {@code null} for families and literals. */
    public String spelling() {
        return spelling;
    }

    public boolean isReservedWord() {
        switch (category) {
            case LANGUAGE_KEYWORD:
            case CLASS_STEREOTYPE:
            case RELATION_STEREOTYPE:
            case DATA_TYPE:
            case META_ATTRIBUTE:
                return true;
            default:
                return false;
        }
    }

    /** Operators that may connect the two ends of a relation. */
    public boolean isAssociationOperator() {
        return category == TokenCategory.RELATION_OPERATOR && this != CARDINALITY;
    }

    /** Human-readable form used in "expected ..." diagnostics. */
    public String displayName() {
        if (spelling != null) return "'" + spelling + "'";
        switch (this) {
            case CLASS_NAME: return "class name";
            case RELATION_NAME: return "relation name";
            case INSTANCE_NAME: return "instance name";
            case NEW_DATATYPE: return "datatype name";
            case IDENTIFIER: return "identifier";
            case STRING: return "string literal";
            case NUMBER: return "number";
            default: return name();
        }
    }

    /** Reserved word lookup; returns {@code null} when {@code word} is not reserved. */
    public static TokenType reserved(String word) {
        if (word == null) return null;
        return RESERVED.get(word);
    }

    private static Map<String, TokenType> buildReserved() {
        Map<String, TokenType> out = new HashMap<>();
        for (TokenType t : values()) {
            if (t.isReservedWord()) out.put(t.spelling, t);
        }
        return Collections.unmodifiableMap(out);
    }
}
