package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.checks.Violation;

/** A violation together with the pattern family and anchor class it was found for. */
public final class PatternFinding {
    public final PatternType patternType;
    public final String anchorClass;
    public final Violation violation;

    public PatternFinding(PatternType patternType, String anchorClass, Violation violation) {
        if (patternType == null) throw new IllegalArgumentException("patternType must not be null");
        if (violation == null) throw new IllegalArgumentException("violation must not be null");
        this.patternType = patternType;
        this.anchorClass = anchorClass;
        this.violation = violation;
    }

    @Override
    public String toString() {
        return patternType.label() + "[" + anchorClass + "] " + violation;
    }
}
