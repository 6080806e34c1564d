package info.isaksson.erland.tonto.checks;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.tonto.ast.AstNode;

import java.util.Objects;

/**
 * A rule violation found in a model.
 *
 * <p>{@code line}/{@code column} point at the declaration the violation is about and are absent
 * when it concerns something that is missing from the model as a whole.</p>
 */
@JsonPropertyOrder({"code", "severity", "message", "line", "column"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Violation {
    public final String code;
    public final Severity severity;
    public final String message;
    public final Integer line;
    public final Integer column;

    @JsonIgnore
    public final Suggestion suggestion;

    public Violation(String code, Severity severity, String message, Integer line, Integer column, Suggestion suggestion) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.line = line;
        this.column = column;
        this.suggestion = suggestion;
    }

    public static Violation at(AstNode node, String code, Severity severity, String message) {
        return at(node, code, severity, message, null);
    }

    public static Violation at(AstNode node, String code, Severity severity, String message, Suggestion suggestion) {
        if (node == null) return new Violation(code, severity, message, null, null, suggestion);
        return new Violation(code, severity, message, node.line, node.column, suggestion);
    }

    @JsonIgnore
    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Violation)) return false;
        Violation v = (Violation) o;
        return code.equals(v.code) && severity == v.severity && message.equals(v.message)
                && Objects.equals(line, v.line) && Objects.equals(column, v.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, severity, message, line, column);
    }

    @Override
    public String toString() {
        String at = line == null ? "" : " (line " + line + ")";
        return severity.label() + " " + code + ": " + message + at;
    }
}
