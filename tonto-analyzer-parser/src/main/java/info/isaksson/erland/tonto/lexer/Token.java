package info.isaksson.erland.tonto.lexer;

import info.isaksson.erland.tonto.lang.TokenType;

import java.util.Objects;

/**
 * A lexical token.
 *
 * <p>{@code value} is the string content (without quotes) for string literals, an {@link Integer}
 * for numbers and the lexeme otherwise. {@code offset} is the 0-based index of the first character.</p>
 */
public final class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object value;
    public final int line;
    public final int column;
    public final int offset;

    public Token(TokenType type, String lexeme, Object value, int line, int column, int offset) {
        this.type = Objects.requireNonNull(type, "type");
        this.lexeme = lexeme;
        this.value = value == null ? lexeme : value;
        this.line = line;
        this.column = column;
        this.offset = offset;
    }

    public boolean is(TokenType t) {
        return type == t;
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "')@" + line + ":" + column;
    }
}
