package info.isaksson.erland.tonto.patterns;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.tonto.checks.Suggestion;
import info.isaksson.erland.tonto.checks.Violation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An instance of an ontology pattern found in a model.
 *
 * <p>Status follows one rule for every pattern family: a pattern is {@link PatternStatus#INCOMPLETE}
 * iff it carries at least one error, or its family requires a formalizing genset and none was
 * found. Warnings and infos are reported but never affect the status on their own.</p>
 */
@JsonPropertyOrder({"pattern_type", "status", "anchor_class", "anchor_stereotype", "elements", "constraints",
        "violations", "suggestions"})
public final class Pattern {

    @JsonProperty("pattern_type")
    public final PatternType patternType;

    public final PatternStatus status;

    @JsonProperty("anchor_class")
    public final String anchorClass;

    @JsonProperty("anchor_stereotype")
    public final String anchorStereotype;

    /** Participating classes and gensets, by role in the pattern. Values are names or lists of names. */
    public final Map<String, Object> elements;

    public final Map<String, Boolean> constraints;

    public final List<Violation> violations;

    public final List<Suggestion> suggestions;

    Pattern(
            PatternType patternType,
            String anchorClass,
            String anchorStereotype,
            Map<String, Object> elements,
            Map<String, Boolean> constraints,
            List<Violation> violations,
            List<Suggestion> suggestions,
            boolean formalizationMissing
    ) {
        if (patternType == null) throw new IllegalArgumentException("patternType must not be null");
        if (anchorClass == null) throw new IllegalArgumentException("anchorClass must not be null");
        this.patternType = patternType;
        this.anchorClass = anchorClass;
        this.anchorStereotype = anchorStereotype;
        this.elements = elements == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(elements));
        this.constraints = constraints == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(constraints));
        this.violations = violations == null ? List.of() : List.copyOf(violations);
        this.suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        this.status = statusFor(this.violations, formalizationMissing);
    }

    public static PatternStatus statusFor(List<Violation> violations, boolean formalizationMissing) {
        if (formalizationMissing) return PatternStatus.INCOMPLETE;
        for (Violation v : violations) {
            if (v.isError()) return PatternStatus.INCOMPLETE;
        }
        return PatternStatus.COMPLETE;
    }

    @JsonIgnore
    public boolean isComplete() {
        return status == PatternStatus.COMPLETE;
    }

    public boolean hasViolation(String code) {
        for (Violation v : violations) {
            if (v.code.equals(code)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return patternType.label() + "(" + anchorClass + ", " + status.label() + ", " + violations.size() + " violations)";
    }
}
