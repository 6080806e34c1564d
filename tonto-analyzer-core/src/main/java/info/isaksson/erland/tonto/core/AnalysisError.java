package info.isaksson.erland.tonto.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.Violation;
import info.isaksson.erland.tonto.diagnostics.SourceDiagnostic;

import java.util.Objects;

/** One entry of {@link AnalysisResult#errors}. Equality ignores severity (always error). */
@JsonPropertyOrder({"code", "severity", "message", "line", "column"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisError {
    public final String code;
    public final Severity severity = Severity.ERROR;
    public final String message;
    public final Integer line;
    public final Integer column;

    public AnalysisError(String code, String message, Integer line, Integer column) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.line = line;
        this.column = column;
    }

    static AnalysisError of(SourceDiagnostic d) {
        return new AnalysisError(d.type, d.message, d.line, d.column);
    }

    static AnalysisError of(Violation v) {
        return new AnalysisError(v.code, v.message, v.line, v.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalysisError)) return false;
        AnalysisError e = (AnalysisError) o;
        return code.equals(e.code) && message.equals(e.message)
                && Objects.equals(line, e.line) && Objects.equals(column, e.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, line, column);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
