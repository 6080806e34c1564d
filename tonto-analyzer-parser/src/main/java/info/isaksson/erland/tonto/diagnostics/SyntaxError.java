package info.isaksson.erland.tonto.diagnostics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Unexpected token (or unexpected end of input).
 *
 * <p>{@code expected} lists human-readable descriptions of what would have been accepted;
 * {@code recommendation} is an optional "Did you mean ..." hint.</p>
 */
@JsonPropertyOrder({"type", "token", "token_type", "message", "line", "column", "line_text", "pointer",
        "expected", "recommendation", "filename"})
public final class SyntaxError extends SourceDiagnostic {
    public static final String TYPE = "SyntaxError";
    public static final String EOF = "EOF";

    /** Offending lexeme; {@code null} at end of input. */
    public final String token;

    @JsonProperty("token_type")
    public final String tokenType;

    public final List<String> expected;
    public final String recommendation;

    public SyntaxError(
            String token,
            String tokenType,
            int line,
            int column,
            String lineText,
            List<String> expected,
            String recommendation,
            String filename
    ) {
        this(token, tokenType, line, column, lineText, expected, recommendation, filename, null);
    }

    /** {@code detail}, when present, replaces the "expected ..." part of the message. */
    public SyntaxError(
            String token,
            String tokenType,
            int line,
            int column,
            String lineText,
            List<String> expected,
            String recommendation,
            String filename,
            String detail
    ) {
        super(TYPE, buildMessage(token, tokenType, line, column, expected, detail), line, column, lineText, filename);
        this.token = token;
        this.tokenType = tokenType;
        this.expected = expected == null ? List.of() : List.copyOf(expected);
        this.recommendation = recommendation;
    }

    private static String buildMessage(String token, String tokenType, int line, int column, List<String> expected,
                                       String detail) {
        StringBuilder sb = new StringBuilder();
        if (token == null) {
            sb.append("Syntax error: unexpected end of input on line ").append(line);
        } else {
            sb.append("Syntax error at token '").append(token).append("' (type: ").append(tokenType)
                    .append(") on line ").append(line).append(", column ").append(column);
        }
        if (detail != null) {
            sb.append("; ").append(detail);
        } else if (expected != null && !expected.isEmpty()) {
            sb.append("; expected ").append(String.join(" or ", expected));
        }
        return sb.toString();
    }
}
