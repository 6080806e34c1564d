package info.isaksson.erland.tonto.lexer;

import info.isaksson.erland.tonto.diagnostics.LexicalError;
import info.isaksson.erland.tonto.diagnostics.SourceText;
import info.isaksson.erland.tonto.lang.TokenType;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Tonto lexer.
 *
 * <p>Each {@link #tokenize(String, String)} call runs in its own session (line counter, error
 * list), so an instance can be reused and shared between threads. Unrecognized characters are
 * reported and skipped one code point at a time.</p>
 */
public final class Lexer {

    private final List<TokenMatcher> matchers;

    public Lexer() {
        this(TokenMatchers.ordered());
    }

    Lexer(List<TokenMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    public LexResult tokenize(String text, String filename) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        return new Session(text, filename).run();
    }

    private final class Session {
        private final String text;
        private final String filename;
        private final Matcher[] active;
        private final List<Token> tokens = new ArrayList<>();
        private final List<LexicalError> errors = new ArrayList<>();
        private int pos = 0;
        private int line = 1;

        Session(String text, String filename) {
            this.text = text;
            this.filename = filename;
            this.active = new Matcher[matchers.size()];
            for (int i = 0; i < matchers.size(); i++) {
                active[i] = matchers.get(i).pattern.matcher(text);
            }
        }

        LexResult run() {
            final int len = text.length();
            while (pos < len) {
                int c = text.codePointAt(pos);
                if (c == '\n') {
                    line++;
                    pos++;
                    continue;
                }
                if (c == ' ' || c == '\t' || c == '\r') {
                    pos++;
                    continue;
                }
                if (!matchAt(len)) {
                    int column = SourceText.column(text, pos);
                    errors.add(new LexicalError(c, line, column, SourceText.lineText(text, pos), filename));
                    pos += Character.charCount(c);
                }
            }
            return new LexResult(tokens, errors);
        }

        private boolean matchAt(int len) {
            for (int i = 0; i < active.length; i++) {
                Matcher m = active[i];
                m.region(pos, len);
                if (!m.lookingAt()) continue;

                TokenMatcher tm = matchers.get(i);
                String lexeme = m.group();
                if (tm.mode != TokenMatcher.Mode.SKIP) {
                    TokenType type = tm.classify(lexeme);
                    tokens.add(new Token(type, lexeme, valueOf(type, lexeme), line, SourceText.column(text, pos), pos));
                }
                pos += lexeme.length();
                return true;
            }
            return false;
        }
    }

    private static Object valueOf(TokenType type, String lexeme) {
        switch (type) {
            case STRING:
                return lexeme.substring(1, lexeme.length() - 1);
            case NUMBER:
                try {
                    return Integer.valueOf(lexeme);
                } catch (NumberFormatException e) {
                    return new BigInteger(lexeme);
                }
            default:
                return lexeme;
        }
    }
}
