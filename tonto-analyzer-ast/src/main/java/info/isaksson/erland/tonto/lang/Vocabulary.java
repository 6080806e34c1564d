package info.isaksson.erland.tonto.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Word lists of the Tonto vocabulary, grouped by {@link TokenCategory}.
 *
 * <p>Lists are in declaration order of {@link TokenType} and never change at runtime.</p>
 */
public final class Vocabulary {

    private static final Map<TokenCategory, List<String>> WORDS = buildWords();

    private Vocabulary() {}

    public static List<String> words(TokenCategory category) {
        List<String> out = WORDS.get(category);
        return out == null ? List.of() : out;
    }

    public static List<String> languageKeywords() {
        return words(TokenCategory.LANGUAGE_KEYWORD);
    }

    public static List<String> classStereotypes() {
        return words(TokenCategory.CLASS_STEREOTYPE);
    }

    public static List<String> relationStereotypes() {
        return words(TokenCategory.RELATION_STEREOTYPE);
    }

    public static List<String> primitiveTypes() {
        return words(TokenCategory.DATA_TYPE);
    }

    public static List<String> metaAttributes() {
        return words(TokenCategory.META_ATTRIBUTE);
    }

    public static boolean isPrimitiveType(String name) {
        return primitiveTypes().contains(name);
    }

    /** Natures accepted after {@code of} in a class declaration. */
    public static List<String> natures() {
        return List.of(
                TokenType.KEYWORD_FUNCTIONAL_COMPLEXES.spelling(),
                TokenType.KEYWORD_INTRINSIC_MODES.spelling(),
                TokenType.KEYWORD_EXTRINSIC_MODES.spelling(),
                TokenType.KEYWORD_ABSTRACT_INDIVIDUALS.spelling(),
                TokenType.KEYWORD_RELATORS.spelling());
    }

    private static Map<TokenCategory, List<String>> buildWords() {
        Map<TokenCategory, List<String>> tmp = new EnumMap<>(TokenCategory.class);
        for (TokenType t : TokenType.values()) {
            if (!t.isReservedWord()) continue;
            tmp.computeIfAbsent(t.category(), k -> new ArrayList<>()).add(t.spelling());
        }
        Map<TokenCategory, List<String>> out = new EnumMap<>(TokenCategory.class);
        tmp.forEach((k, v) -> out.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(out);
    }
}
