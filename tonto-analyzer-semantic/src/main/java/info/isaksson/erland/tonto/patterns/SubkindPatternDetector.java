package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.Suggestion;
import info.isaksson.erland.tonto.checks.SuggestionAction;
import info.isaksson.erland.tonto.lang.Stereotypes;
import info.isaksson.erland.tonto.symbols.GensetSymbol;

import java.util.List;
import java.util.Set;

/** A kind (or subkind) specialized by two or more subkinds, formalized by a disjoint genset. */
public final class SubkindPatternDetector extends SpecializationPatternDetector {

    public static final String MISSING_DISJOINT = "MISSING_DISJOINT";
    public static final String SUBKIND_IN_MULTIPLE_GENSETS = "SUBKIND_IN_MULTIPLE_GENSETS";

    private static final Set<String> ANCHORS = Set.of(Stereotypes.KIND, Stereotypes.SUBKIND);

    @Override
    public PatternType type() {
        return PatternType.SUBKIND;
    }

    @Override
    protected Set<String> anchorStereotypes() {
        return ANCHORS;
    }

    @Override
    protected String childStereotype() {
        return Stereotypes.SUBKIND;
    }

    @Override
    protected String childrenNoun() {
        return "subkinds";
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
        return false;
    }

    @Override
    protected String multipleGensetsCode() {
        return SUBKIND_IN_MULTIPLE_GENSETS;
    }

    @Override
    protected Severity multipleGensetsSeverity() {
        return Severity.INFO;
    }

    @Override
    protected void checkGensetKeywords(GensetSymbol genset, List<String> specifics, PatternBuilder pattern) {
        if (!genset.disjoint()) {
            pattern.violation(genset.definition, MISSING_DISJOINT, Severity.WARNING,
                    type().label() + " genset '" + genset.name() + "' should have 'disjoint' keyword",
                    new Suggestion(SuggestionAction.ADD_KEYWORD, "Add 'disjoint' keyword to genset",
                            regenerate(genset, specifics, true, genset.complete())));
        }
    }
}
