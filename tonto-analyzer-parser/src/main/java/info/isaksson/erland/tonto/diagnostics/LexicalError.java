package info.isaksson.erland.tonto.diagnostics;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** Unrecognized character. The lexer skips exactly this one character and continues. */
@JsonPropertyOrder({"type", "character", "message", "line", "column", "line_text", "pointer", "filename"})
public final class LexicalError extends SourceDiagnostic {
    public static final String TYPE = "IllegalCharacter";

    public final String character;

    public LexicalError(int codePoint, int line, int column, String lineText, String filename) {
        this(new String(Character.toChars(codePoint)), line, column, lineText, filename);
    }

    private LexicalError(String character, int line, int column, String lineText, String filename) {
        super(TYPE,
                "Illegal character '" + character + "' at line " + line + ", column " + column,
                line, column, lineText, filename);
        this.character = character;
    }
}
