package info.isaksson.erland.tonto.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.Suggestion;
import info.isaksson.erland.tonto.checks.Violation;
import info.isaksson.erland.tonto.patterns.PatternFinding;
import info.isaksson.erland.tonto.patterns.PatternType;

/**
 * One entry of {@link AnalysisResult#warnings}: a pattern violation of any severity, or a
 * non-error model check. Model checks carry no pattern type or anchor.
 */
@JsonPropertyOrder({"code", "severity", "message", "pattern_type", "anchor_class", "suggestion", "line", "column"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AnalysisWarning {
    public final String code;
    public final Severity severity;
    public final String message;

    @JsonProperty("pattern_type")
    public final PatternType patternType;

    @JsonProperty("anchor_class")
    public final String anchorClass;

    public final Suggestion suggestion;
    public final Integer line;
    public final Integer column;

    private AnalysisWarning(Violation v, PatternType patternType, String anchorClass) {
        this.code = v.code;
        this.severity = v.severity;
        this.message = v.message;
        this.patternType = patternType;
        this.anchorClass = anchorClass;
        this.suggestion = v.suggestion;
        this.line = v.line;
        this.column = v.column;
    }

    static AnalysisWarning of(PatternFinding f) {
        return new AnalysisWarning(f.violation, f.patternType, f.anchorClass);
    }

    static AnalysisWarning of(Violation modelCheck) {
        return new AnalysisWarning(modelCheck, null, null);
    }

    @Override
    public String toString() {
        return severity.label() + " " + code + ": " + message;
    }
}
