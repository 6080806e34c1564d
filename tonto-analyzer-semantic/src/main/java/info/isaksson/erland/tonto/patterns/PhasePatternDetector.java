package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.Suggestion;
import info.isaksson.erland.tonto.checks.SuggestionAction;
import info.isaksson.erland.tonto.lang.Stereotypes;
import info.isaksson.erland.tonto.symbols.GensetSymbol;

import java.util.List;
import java.util.Set;

/**
 * Two or more phases partitioning a class. An instance is in exactly one phase at a time, so the
 * genset must be disjoint and a phase may belong to one genset only.
 */
public final class PhasePatternDetector extends SpecializationPatternDetector {

    public static final String MISSING_DISJOINT = "MISSING_DISJOINT";
    public static final String MISSING_COMPLETE = "MISSING_COMPLETE";
    public static final String PHASE_IN_MULTIPLE_GENSETS = "PHASE_IN_MULTIPLE_GENSETS";

    private static final Set<String> ANCHORS = Set.of(
            Stereotypes.KIND, Stereotypes.SUBKIND, Stereotypes.CATEGORY, Stereotypes.PHASE);

    @Override
    public PatternType type() {
        return PatternType.PHASE;
    }

    @Override
    protected Set<String> anchorStereotypes() {
        return ANCHORS;
    }

    @Override
    protected String childStereotype() {
        return Stereotypes.PHASE;
    }

    @Override
    protected String childrenNoun() {
        return "phases";
    }

    @Override
    protected boolean gensetRequired() {
        return true;
    }

    @Override
    protected Severity missingGensetSeverity() {
        return Severity.WARNING;
    }

    @Override
    protected boolean suggestDisjoint() {
        return true;
    }

    @Override
    protected boolean suggestComplete() {
        return true;
    }

    @Override
    protected String multipleGensetsCode() {
        return PHASE_IN_MULTIPLE_GENSETS;
    }

    @Override
    protected Severity multipleGensetsSeverity() {
        return Severity.ERROR;
    }

    @Override
    protected void checkGensetKeywords(GensetSymbol genset, List<String> specifics, PatternBuilder pattern) {
        if (!genset.disjoint()) {
            pattern.violation(genset.definition, MISSING_DISJOINT, Severity.ERROR,
                    type().label() + " genset '" + genset.name() + "' should have 'disjoint' keyword",
                    new Suggestion(SuggestionAction.ADD_KEYWORD, "Add 'disjoint' keyword to genset",
                            regenerate(genset, specifics, true, genset.complete())));
        }
        if (!genset.complete()) {
            pattern.violation(genset.definition, MISSING_COMPLETE, Severity.INFO,
                    type().label() + " genset '" + genset.name() + "' could be 'complete' if the phases cover every state",
                    new Suggestion(SuggestionAction.ADD_KEYWORD, "Add 'complete' keyword to genset",
                            regenerate(genset, specifics, true, true)));
        }
    }
}
