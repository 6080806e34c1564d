package info.isaksson.erland.tonto.patterns;

import info.isaksson.erland.tonto.checks.Severity;
import info.isaksson.erland.tonto.checks.Suggestion;
import info.isaksson.erland.tonto.checks.SuggestionAction;
import info.isaksson.erland.tonto.lang.Stereotypes;
import info.isaksson.erland.tonto.symbols.GensetSymbol;

import java.util.List;
import java.util.Set;

/**
 * Two or more roles specializing the same class. Roles may overlap, so the genset is optional and
 * must not be disjoint; a role can take part in several gensets.
 */
public final class RolePatternDetector extends SpecializationPatternDetector {

    public static final String DISJOINT_ROLE_GENSET = "DISJOINT_ROLE_GENSET";
    public static final String ROLE_IN_MULTIPLE_GENSETS = "ROLE_IN_MULTIPLE_GENSETS";

    private static final Set<String> ANCHORS = Set.of(
            Stereotypes.KIND, Stereotypes.SUBKIND, Stereotypes.CATEGORY, Stereotypes.ROLE, Stereotypes.ROLE_MIXIN);

    @Override
    public PatternType type() {
        return PatternType.ROLE;
    }

    @Override
    protected Set<String> anchorStereotypes() {
        return ANCHORS;
    }

    @Override
    protected String childStereotype() {
        return Stereotypes.ROLE;
    }

    @Override
    protected String childrenNoun() {
        return "roles";
    }

    @Override
    protected boolean gensetRequired() {
        return false;
    }

    @Override
    protected Severity missingGensetSeverity() {
        return Severity.INFO;
    }

    @Override
    protected boolean suggestDisjoint() {
        return false;
    }

    @Override
    protected boolean suggestComplete() {
        return false;
    }

    @Override
    protected String multipleGensetsCode() {
        return ROLE_IN_MULTIPLE_GENSETS;
    }

    @Override
    protected Severity multipleGensetsSeverity() {
        return Severity.INFO;
    }

    @Override
    protected void checkGensetKeywords(GensetSymbol genset, List<String> specifics, PatternBuilder pattern) {
        if (genset.disjoint()) {
            pattern.violation(genset.definition, DISJOINT_ROLE_GENSET, Severity.ERROR,
                    type().label() + " genset '" + genset.name() + "' must not be 'disjoint': roles of one class may overlap",
                    new Suggestion(SuggestionAction.REMOVE_KEYWORD, "Remove 'disjoint' keyword from genset",
                            regenerate(genset, specifics, false, genset.complete())));
        }
    }
}
