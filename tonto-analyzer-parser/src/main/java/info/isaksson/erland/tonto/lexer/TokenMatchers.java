package info.isaksson.erland.tonto.lexer;

import info.isaksson.erland.tonto.lang.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static info.isaksson.erland.tonto.lexer.TokenMatcher.Mode.FIXED;
import static info.isaksson.erland.tonto.lexer.TokenMatcher.Mode.RESERVED_LOOKUP;
import static info.isaksson.erland.tonto.lexer.TokenMatcher.Mode.SKIP;

/**
 * The lexer's classification table. The first matcher that matches at the current position wins.
 *
 * <p>Order matters: names ending in {@code DataType} before class names, instance names before
 * relation names, compound hyphenated keywords before relation names, and operators longest
 * first. Every name matcher refuses to stop in the middle of a word.</p>
 */
public final class TokenMatchers {

    private static final String WORD_END = "(?![A-Za-z0-9_])";

    private static final List<TokenMatcher> ORDERED = build();

    private TokenMatchers() {}

    public static List<TokenMatcher> ordered() {
        return ORDERED;
    }

    private static List<TokenMatcher> build() {
        List<TokenMatcher> out = new ArrayList<>();
        out.add(new TokenMatcher("STRING", "\"(?:[^\\\\\\n\"]|\\\\.)*\"", TokenType.STRING, FIXED));
        out.add(new TokenMatcher("NUMBER", "[0-9]+", TokenType.NUMBER, FIXED));
        out.add(new TokenMatcher("NEW_DATATYPE", "[a-zA-Z][a-zA-Z]*DataType" + WORD_END, TokenType.NEW_DATATYPE, RESERVED_LOOKUP));
        out.add(new TokenMatcher("COMPOUND_KEYWORD",
                "(?:functional-complexes|intrinsic-modes|extrinsic-modes|abstract-individuals)(?![A-Za-z0-9_-])",
                TokenType.IDENTIFIER, RESERVED_LOOKUP));
        // instance names are never reserved: every reserved word ends in a letter
        out.add(new TokenMatcher("INSTANCE_NAME", "[a-z][a-zA-Z_]*[0-9]+" + WORD_END, TokenType.INSTANCE_NAME, FIXED));
        out.add(new TokenMatcher("CLASS_NAME", "[A-Z][a-zA-Z0-9_]*" + WORD_END, TokenType.CLASS_NAME, RESERVED_LOOKUP));
        out.add(new TokenMatcher("RELATION_NAME", "[a-z][a-zA-Z_]*" + WORD_END, TokenType.RELATION_NAME, RESERVED_LOOKUP));
        out.add(new TokenMatcher("IDENTIFIER", "[a-zA-Z_][a-zA-Z0-9_]*" + WORD_END, TokenType.IDENTIFIER, RESERVED_LOOKUP));
        out.add(new TokenMatcher("COMMENT", "//[^\\n]*", null, SKIP));

        // relation operators, longest first
        out.add(operator(TokenType.COMPOSITIONL));
        out.add(operator(TokenType.COMPOSITIONR));
        out.add(operator(TokenType.ASSOCIATIONLR));
        out.add(operator(TokenType.AGGREGATIONL));
        out.add(operator(TokenType.AGGREGATIONR));
        out.add(operator(TokenType.ASSOCIATIONL));
        out.add(operator(TokenType.ASSOCIATIONR));
        out.add(operator(TokenType.ASSOCIATION));
        out.add(operator(TokenType.CARDINALITY));

        for (TokenType t : List.of(
                TokenType.LBRACE, TokenType.RBRACE, TokenType.LPAREN, TokenType.RPAREN,
                TokenType.LBRACKET, TokenType.RBRACKET, TokenType.ASTERISK, TokenType.AT,
                TokenType.COLON, TokenType.COMMA, TokenType.LT, TokenType.GT)) {
            out.add(operator(t));
        }
        return List.copyOf(out);
    }

    private static TokenMatcher operator(TokenType t) {
        return new TokenMatcher(t.name(), Pattern.quote(t.spelling()), t, FIXED);
    }
}
