package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.ast.AstNode;
import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.Suggestion;
import info.isaksson.erland.tonto.checks.Violation;
import info.isaksson.erland.tonto.symbols.ClassSymbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Accumulates the parts of one {@link Pattern}. Not thread-safe; one builder per pattern. */
final class PatternBuilder {

    private final PatternType type;
    private final ClassSymbol anchor;
    private final Map<String, Object> elements = new LinkedHashMap<>();
    private final Map<String, Boolean> constraints = new LinkedHashMap<>();
    private final List<Violation> violations = new ArrayList<>();
    private final List<Suggestion> suggestions = new ArrayList<>();
    private boolean formalizationMissing;

    PatternBuilder(PatternType type, ClassSymbol anchor) {
        this.type = type;
        this.anchor = anchor;
    }

    PatternBuilder element(String key, Object value) {
        elements.put(key, value instanceof Collection ? List.copyOf((Collection<?>) value) : value);
        return this;
    }

    PatternBuilder constraint(String key, boolean value) {
        constraints.put(key, value);
        return this;
    }

    /** Adds {@code v} unless an equal violation is already present; its suggestion goes to the suggestion list. */
    PatternBuilder add(Violation v) {
        if (violations.contains(v)) return this;
        violations.add(v);
        if (v.suggestion != null && !suggestions.contains(v.suggestion)) suggestions.add(v.suggestion);
        return this;
    }

    PatternBuilder addAll(Collection<Violation> vs) {
        for (Violation v : vs) add(v);
        return this;
    }

    PatternBuilder violation(AstNode at, String code, Severity severity, String message) {
        return violation(at, code, severity, message, null);
    }

    PatternBuilder violation(AstNode at, String code, Severity severity, String message, Suggestion suggestion) {
        return add(Violation.at(at, code, severity, message, suggestion));
    }

    /** Marks the pattern as lacking the genset its family requires. */
    PatternBuilder formalizationMissing(boolean missing) {
        this.formalizationMissing = missing;
        return this;
    }

    Pattern build() {
        return new Pattern(type, anchor.name(), anchor.stereotype(), elements, constraints, violations, suggestions,
                formalizationMissing);
    }
}
