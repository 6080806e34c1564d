package info.isaksson.erland.tonto.lexer;

import info.isaksson.erland.tonto.diagnostics.LexicalError;
import info.isaksson.erland.tonto.lang.TokenCategory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Tokens in source order plus the lexical errors met along the way. */
public final class LexResult {
    public final List<Token> tokens;
    public final List<LexicalError> errors;

    public LexResult(List<Token> tokens, List<LexicalError> errors) {
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** Token count per category, in category declaration order. */
    public Map<TokenCategory, Integer> categoryCounts() {
        Map<TokenCategory, Integer> out = new EnumMap<>(TokenCategory.class);
        for (Token t : tokens) {
            out.merge(t.type.category(), 1, Integer::sum);
        }
        return out;
    }
}
