package info.isaksson.erland.tonto.parser;

import info.isaksson.erland.tonto.ast.TontoFile;
import info.isaksson.erland.tonto.diagnostics.LexicalError;
import info.isaksson.erland.tonto.diagnostics.SyntaxError;
import info.isaksson.erland.tonto.lexer.Token;

import java.util.List;

/**
 * Parser output. {@code file} is always present: declarations that could not be parsed are
 * dropped from it and described in {@code syntaxErrors}.
 */
public final class ParseResult {
    public final TontoFile file;
    public final List<Token> tokens;
    public final List<LexicalError> lexicalErrors;
    public final List<SyntaxError> syntaxErrors;

    public ParseResult(TontoFile file, List<Token> tokens, List<LexicalError> lexicalErrors, List<SyntaxError> syntaxErrors) {
        this.file = file;
        this.tokens = tokens == null ? List.of() : List.copyOf(tokens);
        this.lexicalErrors = lexicalErrors == null ? List.of() : List.copyOf(lexicalErrors);
        this.syntaxErrors = syntaxErrors == null ? List.of() : List.copyOf(syntaxErrors);
    }

    public boolean hasErrors() {
        return !lexicalErrors.isEmpty() || !syntaxErrors.isEmpty();
    }
}
