package info.isaksson.erland.tonto.checks;

import info.isaksson.erland.tonto.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Collects model-level violations.
 *
 * <p>Final output is deduplicated and sorted by (line, column, code, message); violations without
 * a position sort last.</p>
 */
public final class ModelIssues {

    static final Comparator<Violation> ORDER = Comparator
            .comparing((Violation v) -> v.line, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(v -> v.column, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(v -> v.code)
            .thenComparing(v -> v.message);

    private final List<Violation> issues = new ArrayList<>();

    public void add(Violation v) {
        issues.add(v);
    }

    public void error(AstNode at, String code, String message) {
        add(Violation.at(at, code, Severity.ERROR, message));
    }

    public void warn(AstNode at, String code, String message) {
        add(Violation.at(at, code, Severity.WARNING, message));
    }

    public List<Violation> toDeterministicList() {
        List<Violation> out = new ArrayList<>(new LinkedHashSet<>(issues));
        out.sort(ORDER);
        return Collections.unmodifiableList(out);
    }
}
