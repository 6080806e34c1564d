package info.isaksson.erland.tonto.lexer;

import info.isaksson.erland.tonto.lang.TokenType;

import java.util.regex.Pattern;

/**
 * One entry of the lexer's ordered matcher table.
 *
 * <p>{@code type} is {@code null} for matchers whose text is discarded (comments).</p>
 */
public final class TokenMatcher {

    /** How a match is turned into a token type. */
    public enum Mode {
        /** Emit {@link #type} as is. */
        FIXED,
        /** Emit the reserved word type when the lexeme is reserved, otherwise {@link #type}. */
        RESERVED_LOOKUP,
        /** Produce no token. */
        SKIP
    }

    public final String name;
    public final Pattern pattern;
    public final TokenType type;
    public final Mode mode;

    TokenMatcher(String name, String regex, TokenType type, Mode mode) {
        this.name = name;
        this.pattern = Pattern.compile(regex);
        this.type = type;
        this.mode = mode;
    }

    public TokenType classify(String lexeme) {
        if (mode == Mode.RESERVED_LOOKUP) {
            TokenType reserved = TokenType.reserved(lexeme);
            if (reserved != null) return reserved;
        }
        return type;
    }

    @Override
    public String toString() {
        return name + "=" + pattern.pattern();
    }
}
