package info.isaksson.erland.tonto.diagnostics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A lexical or syntactic problem anchored at a source position.
 *
 * <p>Carries the offending line and a caret pointer so callers can render it without the source.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class SourceDiagnostic {
    public final String type;
    public final String message;
    public final int line;
    public final int column;

    @JsonProperty("line_text")
    public final String lineText;

    public final String pointer;
    public final String filename;

    protected SourceDiagnostic(String type, String message, int line, int column, String lineText, String filename) {
        this.type = type;
        this.message = message;
        this.line = line;
        this.column = column;
        this.lineText = lineText == null ? "" : lineText;
        this.pointer = SourceText.pointer(column);
        this.filename = filename;
    }

    @Override
    public String toString() {
        return (filename == null ? "" : filename + ":") + line + ":" + column + ": " + message;
    }
}
