package info.isaksson.erland.tonto.parser;

import info.isaksson.erland.tonto.lang.TokenCategory;
import info.isaksson.erland.tonto.lang.TokenType;
import info.isaksson.erland.tonto.lang.Vocabulary;
import info.isaksson.erland.tonto.lexer.Token;
import info.isaksson.erland.tonto.text.EditDistance;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * "Did you mean ..." recommendations for syntax errors.
 *
 * <p>Sources, tried in order:</p>
 * <ol>
 *   <li>a table of common misspellings and words borrowed from other modeling languages,</li>
 *   <li>the closest word (edit distance at most {@value #MAX_DISTANCE}) from the vocabularies the
 *       parser expected at that point,</li>
 *   <li>the naming convention for class names when a lowercase name stands where a class name
 *       was expected.</li>
 * </ol>
 */
public final class SyntaxHints {

    static final int MAX_DISTANCE = 2;

    private static final Map<String, String> TYPOS = typoTable();

    public SyntaxHints() {}

    /** Returns a recommendation for {@code found} (null at end of input), or empty when there is none. */
    public Optional<String> recommend(Token found, Collection<TokenType> expected) {
        if (found == null || found.lexeme == null) return Optional.empty();
        String word = found.lexeme;

        String typo = TYPOS.get(word);
        if (typo == null) typo = TYPOS.get(word.toLowerCase());
        if (typo != null && !typo.equals(word)) return Optional.of(didYouMean(typo));

        if (word.length() >= 3) {
            Optional<String> close = EditDistance.closest(word, candidates(expected), MAX_DISTANCE);
            if (close.isPresent()) return Optional.of(didYouMean(close.get()));
        }

        if (expected != null && expected.contains(TokenType.CLASS_NAME) && startsLowercase(found)) {
            String fixed = Character.toUpperCase(word.charAt(0)) + word.substring(1);
            return Optional.of("Class names must start with an uppercase letter. Did you mean '" + fixed + "'?");
        }
        return Optional.empty();
    }

    /** Words worth comparing against: the expected reserved words plus their whole categories. */
    static Set<String> candidates(Collection<TokenType> expected) {
        Set<String> out = new LinkedHashSet<>();
        if (expected == null) return out;
        Set<TokenCategory> categories = new LinkedHashSet<>();
        for (TokenType t : expected) {
            if (t.isReservedWord()) {
                out.add(t.spelling());
                categories.add(t.category());
            }
        }
        for (TokenCategory c : categories) {
            out.addAll(Vocabulary.words(c));
        }
        return out;
    }

    private static boolean startsLowercase(Token t) {
        switch (t.type) {
            case RELATION_NAME:
            case INSTANCE_NAME:
            case IDENTIFIER:
                return Character.isLowerCase(t.lexeme.charAt(0));
            default:
                return false;
        }
    }

    private static String didYouMean(String word) {
        return "Did you mean '" + word + "'?";
    }

    private static Map<String, String> typoTable() {
        Map<String, String> m = new LinkedHashMap<>();
        // words from other modeling languages
        m.put("class", "kind");
        m.put("entity", "kind");
        m.put("type", "kind");
        m.put("extends", "specializes");
        m.put("inherits", "specializes");
        m.put("implements", "specializes");
        m.put("generalization", "genset");
        m.put("generalisation", "genset");
        m.put("generalizationset", "genset");
        m.put("relationship", "relation");
        m.put("association", "relation");
        m.put("enumeration", "enum");
        m.put("int", "Number");
        m.put("integer", "Number");
        m.put("float", "Number");
        m.put("double", "Number");
        m.put("str", "String");
        m.put("bool", "Boolean");
        m.put("datetime", "Datetime");
        m.put("DateTime", "Datetime");
        // misspellings
        m.put("specialize", "specializes");
        m.put("specialise", "specializes");
        m.put("specialises", "specializes");
        m.put("specialization", "specializes");
        m.put("specific", "specifics");
        m.put("generals", "general");
        m.put("disjunct", "disjoint");
        m.put("completed", "complete");
        m.put("categoriser", "categorizer");
        m.put("packages", "package");
        m.put("imports", "import");
        m.put("subKind", "subkind");
        m.put("rolemixin", "roleMixin");
        m.put("phasemixin", "phaseMixin");
        m.put("externaldependence", "externalDependence");
        return m;
    }
}
